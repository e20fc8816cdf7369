package com.bmsedge.emergency.service;

import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.enums.ProtocolActionKind;

/**
 * Performs a physical protocol action (siren, door locks, valves, calls).
 * Implementations either complete before returning or hand the action off
 * fire-and-forget; a thrown exception marks the step as failed.
 */
public interface DeviceActuator {

    /**
     * @param kind      a device action kind, see {@link ProtocolActionKind#isDeviceAction()}
     * @param parameter kind-specific target such as a supply name or phone number, may be null
     * @param incident  the incident the action is executed for
     * @return a short outcome note recorded on the executed action
     */
    String perform(ProtocolActionKind kind, String parameter, Incident incident);
}
