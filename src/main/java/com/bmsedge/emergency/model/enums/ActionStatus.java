package com.bmsedge.emergency.model.enums;

public enum ActionStatus {
    EXECUTED,
    FAILED
}
