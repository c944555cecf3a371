package com.datahub.calgroup.model.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What the directory said about a membership write.
 *
 * @param resultMetadata the directory's {@code resultMetadata} block, if it sent one
 */
public record ReconciliationOutcome(boolean success, String groupName, int memberCount, JsonNode resultMetadata) {

    public static ReconciliationOutcome succeeded(ReconciliationJob job, JsonNode resultMetadata) {
        return new ReconciliationOutcome(true, job.groupName(), job.members().size(), resultMetadata);
    }

    public static ReconciliationOutcome problem(ReconciliationJob job, JsonNode resultMetadata) {
        return new ReconciliationOutcome(false, job.groupName(), job.members().size(), resultMetadata);
    }
}
