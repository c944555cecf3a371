package com.datahub.calgroup.model.domain;

public enum SchedulerState {
    IDLE,
    RUNNING
}
