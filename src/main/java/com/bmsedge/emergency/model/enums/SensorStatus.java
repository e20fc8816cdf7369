package com.bmsedge.emergency.model.enums;

public enum SensorStatus {
    ONLINE,
    OFFLINE
}
