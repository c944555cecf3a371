package com.datahub.calgroup.model.domain;

public enum CycleStatus {
    SUCCEEDED,
    DIRECTORY_PROBLEM,
    FAILED,
    SKIPPED,
    ALREADY_RUNNING
}
