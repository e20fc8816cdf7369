package com.bmsedge.emergency.model.enums;

public enum TriggerOutcome {
    CREATED,
    UPDATED,
    UNKNOWN_TYPE
}
