package com.bmsedge.emergency.service;

import com.bmsedge.emergency.model.EmergencyType;
import com.bmsedge.emergency.model.ExecutedAction;
import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.ProtocolStep;
import com.bmsedge.emergency.model.enums.ActionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Interprets an emergency type's response protocol for a new incident.
 * Each step is recorded; a failing step is recorded as FAILED and the
 * remaining steps still run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProtocolExecutor {

    private final DeviceActuator deviceActuator;
    private final SafetyModeController safetyModeController;
    private final Clock clock;

    public List<ExecutedAction> execute(Incident incident, EmergencyType type) {
        List<ProtocolStep> protocol = type.getResponseProtocol();
        log.info("Executing response protocol for: {} ({} steps)", type.getLabel(), protocol.size());

        List<ExecutedAction> actions = new ArrayList<>();
        for (int i = 0; i < protocol.size(); i++) {
            actions.add(executeStep(incident, protocol.get(i), i + 1, protocol.size()));
        }
        return actions;
    }

    private ExecutedAction executeStep(Incident incident, ProtocolStep step, int index, int total) {
        log.info("Protocol step {}/{}: {}", index, total, step.getDescription());

        ExecutedAction.ExecutedActionBuilder action = ExecutedAction.builder()
                .step(index)
                .kind(step.getKind())
                .action(step.getDescription())
                .executedAt(LocalDateTime.now(clock));
        try {
            return action.status(ActionStatus.EXECUTED)
                    .detail(apply(incident, step))
                    .build();
        } catch (RuntimeException e) {
            log.error("❌ Protocol step {} failed for incident {}: {}", index, incident.getId(), e.getMessage());
            return action.status(ActionStatus.FAILED)
                    .detail(e.getMessage())
                    .build();
        }
    }

    private String apply(Incident incident, ProtocolStep step) {
        if (step.getKind().isDeviceAction()) {
            return deviceActuator.perform(step.getKind(), step.getParameter(), incident);
        }
        switch (step.getKind()) {
            case ACTIVATE_EMERGENCY_LIGHTING:
                List<String> lights = safetyModeController.activateLighting(incident.getId());
                incident.getActivatedLightIds().addAll(lights);
                return lights.size() + " emergency lights active";
            case ACTIVATE_LOCKDOWN:
                return safetyModeController.activateLockdown(incident.getLabel() + ": " + incident.getReason())
                        ? "Lockdown activated"
                        : "Lockdown already active";
            default:
                return "Instruction issued";
        }
    }
}
