package com.bmsedge.emergency.service;

import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.enums.ProtocolActionKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default actuator when no device integration is wired in: the action is
 * logged and reported as dispatched.
 */
@Component
@Slf4j
public class LoggingDeviceActuator implements DeviceActuator {

    @Override
    public String perform(ProtocolActionKind kind, String parameter, Incident incident) {
        log.info("🔧 [{}] {}{}", incident.getId(), kind, parameter != null ? " (" + parameter + ")" : "");
        return parameter != null ? kind + " dispatched: " + parameter : kind + " dispatched";
    }
}
