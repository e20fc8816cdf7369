package com.bmsedge.emergency.model.enums;

public enum PowerUnitStatus {
    STANDBY,      // mains available, unit ready
    ACTIVE,       // UPS carrying load
    DISCHARGING,  // battery carrying load
    CHARGING,     // battery refilling after an outage
    RUNNING,      // generator producing power
    COOLDOWN      // generator stopping after mains returned
}
