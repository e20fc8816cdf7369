package com.bmsedge.emergency.model.enums;

public enum LightStatus {
    READY,
    ACTIVE
}
