package com.bmsedge.emergency.model.enums;

public enum BackupOverallStatus {
    OPTIMAL,
    DEGRADED
}
