package com.datahub.calgroup.jobs;

import com.datahub.calgroup.model.domain.CycleStatus;
import com.datahub.calgroup.model.domain.SchedulerState;
import com.datahub.calgroup.model.dto.CycleResult;
import com.datahub.calgroup.model.dto.SyncSettings;
import com.datahub.calgroup.service.reconciliation.SyncCycleService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives the sync: one cycle right at startup, then one every
 * {@code calgroup.sync.every} seconds after the previous cycle finished.
 *
 * Only one cycle runs at a time. A trigger that arrives while a cycle is running
 * (a manual request, or a scheduler with a bigger pool) is skipped, not queued.
 * A failed cycle is logged and the schedule carries on.
 */
@Component
public class CalgroupSyncJob {

    private static final Logger log = LoggerFactory.getLogger(CalgroupSyncJob.class);

    private final SyncCycleService syncCycleService;
    private final SyncSettings settings;
    private final MeterRegistry meterRegistry;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<CycleResult> lastResult = new AtomicReference<>();

    public CalgroupSyncJob(SyncCycleService syncCycleService, SyncSettings settings, MeterRegistry meterRegistry) {
        this.syncCycleService = syncCycleService;
        this.settings = settings;
        this.meterRegistry = meterRegistry;
    }

    @Scheduled(initialDelayString = "${calgroup.sync.initial-delay:0}",
               fixedDelayString = "${calgroup.sync.every:3600}",
               timeUnit = TimeUnit.SECONDS)
    public void run() {
        runIfIdle("schedule");
    }

    public CycleResult runIfIdle(String trigger) {
        if (!running.compareAndSet(false, true)) {
            log.warn("Sync requested by {} while a cycle is still running, skipping", trigger);
            CycleResult busy = new CycleResult(CycleStatus.ALREADY_RUNNING, null, 0, 0,
                    Instant.now(), Instant.now(), "A sync cycle is already running");
            record(busy);
            return busy;
        }

        Instant startedAt = Instant.now();
        CycleResult result;
        try {
            log.info("🚀 Starting CalGroups sync cycle ({})", trigger);
            result = syncCycleService.runCycle(settings);
            log.info("✅ Sync cycle finished: {} group={} users={} members={}",
                    result.status(), result.groupName(), result.usersFetched(), result.membersSent());
        } catch (Exception e) {
            log.error("❌ Sync cycle failed: {}", e.getMessage(), e);
            result = CycleResult.failed(startedAt, e.getMessage());
        } finally {
            running.set(false);
        }
        lastResult.set(result);
        record(result);
        return result;
    }

    public SchedulerState getState() {
        return running.get() ? SchedulerState.RUNNING : SchedulerState.IDLE;
    }

    public Optional<CycleResult> getLastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    private void record(CycleResult result) {
        meterRegistry.counter("calgroup.sync.cycles", "outcome", result.status().name().toLowerCase(Locale.ROOT))
                .increment();
    }
}
