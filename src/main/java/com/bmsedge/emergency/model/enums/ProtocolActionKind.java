package com.bmsedge.emergency.model.enums;

/**
 * Kinds of response protocol actions. Kinds that do not touch a device are
 * guidance for occupants and are recorded without actuation.
 */
public enum ProtocolActionKind {
    SOUND_ALARM(true),
    ACTIVATE_EMERGENCY_LIGHTING(false),
    ACTIVATE_LOCKDOWN(false),
    LOCK_DOORS(true),
    UNLOCK_DOORS(true),
    CUT_SUPPLY(true),
    OPEN_VENTILATION(true),
    ACTIVATE_SPRINKLERS(true),
    ACTIVATE_SUMP_PUMP(true),
    CLOSE_SHUTTERS(true),
    RECORD_CAMERAS(true),
    SWITCH_TO_BACKUP_POWER(true),
    CALL_EMERGENCY_SERVICES(true),
    DISPLAY_MESSAGE(true),
    INSTRUCTION(false);

    private final boolean deviceAction;

    ProtocolActionKind(boolean deviceAction) {
        this.deviceAction = deviceAction;
    }

    public boolean isDeviceAction() {
        return deviceAction;
    }
}
