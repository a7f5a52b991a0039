package com.gt.wordfilter.maintenance;

public enum MaintenanceJobState {
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isFinished() {
        return this != RUNNING;
    }
}
