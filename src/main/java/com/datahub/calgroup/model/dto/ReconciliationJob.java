package com.datahub.calgroup.model.dto;

import java.util.List;

/**
 * One membership write against the directory.
 *
 * @param replaceExisting {@code true} replaces the whole membership, {@code false} only adds
 */
public record ReconciliationJob(String groupName, List<MemberIdentifier> members, boolean replaceExisting) {

    public ReconciliationJob {
        members = List.copyOf(members);
    }
}
