package com.bmsedge.emergency.model.enums;

public enum IncidentStatus {
    ACTIVE,
    RESOLVED,
    // Closed by an engine stop while still active
    ABANDONED
}
