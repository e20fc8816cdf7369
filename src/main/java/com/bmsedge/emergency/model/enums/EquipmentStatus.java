package com.bmsedge.emergency.model.enums;

public enum EquipmentStatus {
    GOOD,
    EXPIRING_SOON,
    EXPIRED
}
