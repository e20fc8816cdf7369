package com.bmsedge.emergency.model.enums;

public enum SensorReportOutcome {
    ACCEPTED,
    WARNING,
    UNKNOWN_SENSOR
}
