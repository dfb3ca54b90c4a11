package com.delta.scraper.scrape.model;

import java.util.EnumSet;
import java.util.Set;

public enum JobStatus {
    PENDING,
    QUEUED,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return allowedTargets().contains(next);
    }

    private Set<JobStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(QUEUED, RUNNING, CANCELLED, FAILED);
            case QUEUED -> EnumSet.of(RUNNING, CANCELLED, FAILED);
            case RUNNING -> EnumSet.of(PAUSED, COMPLETED, FAILED, CANCELLED);
            case PAUSED -> EnumSet.of(RUNNING, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
