package com.datahub.calgroup.client;

import com.datahub.calgroup.model.dto.GrouperEndpoint;
import com.datahub.calgroup.model.dto.ReconciliationJob;
import com.datahub.calgroup.model.dto.ReconciliationOutcome;

/**
 * Membership writes against the Grouper web services.
 */
public interface GrouperApiClient {

    /**
     * Sends the job's members to its group in one call. With
     * {@code replaceExisting} set the directory drops everyone not in the list.
     * Resubmitting the same job is safe; concurrent submissions for one group are not arbitrated.
     *
     * @return success, or the problem the directory reported
     */
    ReconciliationOutcome replaceMembers(GrouperEndpoint endpoint, ReconciliationJob job);
}
