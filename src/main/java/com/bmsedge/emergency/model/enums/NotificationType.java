package com.bmsedge.emergency.model.enums;

/**
 * Outbound notifications, each broadcast on {@code /topic/emergency/<topic>}.
 */
public enum NotificationType {
    INCIDENT_CREATED("incident-created"),
    INCIDENT_UPDATED("incident-updated"),
    INCIDENT_RESOLVED("incident-resolved"),
    RECOVERY_INITIATED("recovery-initiated"),
    SENSOR_WARNING("sensor-warning"),
    SENSOR_HEALTH("sensor-health"),
    LOCKDOWN_ACTIVATED("lockdown-activated"),
    LOCKDOWN_DEACTIVATED("lockdown-deactivated"),
    PANIC_BUTTON_ACTIVATED("panic-button"),
    PANIC_BUTTON_DEACTIVATED("panic-deactivated"),
    LIGHTING_ACTIVATED("lighting-activated"),
    GENERATOR_STARTED("generator-started"),
    BACKUP_LEVEL_LOW("backup-level-low"),
    POWER_RESTORED("power-restored"),
    WELLBEING_CHECK_SCHEDULED("wellbeing-check-scheduled"),
    WELLBEING_CHECK_OVERDUE("wellbeing-check-overdue"),
    EQUIPMENT_ISSUES("equipment-issues"),
    DRILL_REMINDER("drill-reminder"),
    DRILL_OVERDUE("drill-overdue"),
    DRILL_COMPLETED("drill-completed"),
    WEATHER_ALERT("weather-alert"),
    ROUTE_UPDATED("route-updated"),
    CONTACT_ADDED("contact-added"),
    CONTACT_REMOVED("contact-removed"),
    DAMAGE_ASSESSED("damage-assessed");

    private final String topic;

    NotificationType(String topic) {
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}
