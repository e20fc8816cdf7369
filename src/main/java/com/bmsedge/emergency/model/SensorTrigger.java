package com.bmsedge.emergency.model;

import lombok.Value;

import java.util.Set;

/**
 * A sensor type plus the event types that count for it. An empty event type
 * set accepts any event from that sensor type.
 */
@Value
public class SensorTrigger {

    String sensorType;
    Set<String> eventTypes;

    public static SensorTrigger anyEvent(String sensorType) {
        return new SensorTrigger(sensorType, Set.of());
    }

    public boolean matches(SensorEvent event) {
        if (!sensorType.equals(event.getSensorType())) {
            return false;
        }
        return eventTypes.isEmpty() || eventTypes.contains(event.getEventType());
    }
}
