package com.datahub.calgroup.model.dto;

import com.datahub.calgroup.model.domain.SchedulerState;

public record SyncStatus(SchedulerState state, CycleResult lastResult) {}
