package com.bmsedge.emergency.model.enums;

public enum WellbeingStatus {
    PENDING,
    COMPLETED
}
