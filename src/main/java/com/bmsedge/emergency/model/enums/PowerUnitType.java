package com.bmsedge.emergency.model.enums;

public enum PowerUnitType {
    UPS,
    BATTERY,
    GENERATOR
}
