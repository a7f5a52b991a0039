package com.gt.wordfilter.maintenance;

public enum MaintenanceJobType {
    VALIDATE,
    CLEANUP
}
