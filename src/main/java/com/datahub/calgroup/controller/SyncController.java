package com.datahub.calgroup.controller;

import com.datahub.calgroup.jobs.CalgroupSyncJob;
import com.datahub.calgroup.model.dto.CycleResult;
import com.datahub.calgroup.model.dto.SyncStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Internal endpoint for operators: run a sync now, or see what the last one did.
 */
@Slf4j
@RestController
@RequestMapping("/api/internal/sync")
@RequiredArgsConstructor
public class SyncController {

    private final CalgroupSyncJob syncJob;

    /**
     * Run a sync cycle now, unless one is already running
     */
    @PostMapping
    public ResponseEntity<CycleResult> triggerSync() {
        log.info("🔧 Manual sync requested via SyncController");
        CycleResult result = syncJob.runIfIdle("manual request");
        return switch (result.status()) {
            case ALREADY_RUNNING -> ResponseEntity.status(HttpStatus.CONFLICT).body(result);
            case FAILED, DIRECTORY_PROBLEM -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
            default -> ResponseEntity.ok(result);
        };
    }

    @GetMapping("/status")
    public ResponseEntity<SyncStatus> status() {
        return ResponseEntity.ok(new SyncStatus(syncJob.getState(), syncJob.getLastResult().orElse(null)));
    }
}
