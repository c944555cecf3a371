package com.datahub.calgroup.model.dto;

import com.datahub.calgroup.model.domain.CycleStatus;

import java.time.Instant;

/**
 * Summary of one reconciliation cycle, kept for logging and the status endpoint.
 */
public record CycleResult(
    CycleStatus status,
    String groupName,
    int usersFetched,
    int membersSent,
    Instant startedAt,
    Instant finishedAt,
    String message
) {

    public static CycleResult skipped(String groupName, String reason) {
        Instant now = Instant.now();
        return new CycleResult(CycleStatus.SKIPPED, groupName, 0, 0, now, now, reason);
    }

    public static CycleResult failed(Instant startedAt, String message) {
        return new CycleResult(CycleStatus.FAILED, null, 0, 0, startedAt, Instant.now(), message);
    }
}
