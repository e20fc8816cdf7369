package com.bmsedge.emergency.model.enums;

public enum AlertTemplate {
    STANDARD,
    SMS,
    VOICE,
    DISPLAY,
    CONTACT
}
