package com.bmsedge.emergency.model.enums;

public enum RecoveryStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED
}
