package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.IncidentSummaryDTO;
import com.bmsedge.emergency.dto.ResolutionResult;
import com.bmsedge.emergency.dto.TriggerResult;
import com.bmsedge.emergency.model.EmergencyType;
import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.IncidentUpdate;
import com.bmsedge.emergency.model.RecoveryPlan;
import com.bmsedge.emergency.model.RecoveryStep;
import com.bmsedge.emergency.model.WellbeingCheck;
import com.bmsedge.emergency.model.enums.IncidentStatus;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.model.enums.RecoveryStatus;
import com.bmsedge.emergency.model.enums.TriggerOutcome;
import com.bmsedge.emergency.repository.EmergencyTypeCatalog;
import com.bmsedge.emergency.repository.IncidentLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates, deduplicates and resolves incidents.
 *
 * At most one incident per emergency type is active at a time; further
 * triggers for that type are recorded as updates on the active one.
 * Resolved incidents leave the active set but stay in the incident log.
 *
 * Not thread-safe on its own: callers serialize access.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IncidentLifecycleManager {

    private static final String DEFAULT_RESOLUTION = "Manually resolved";

    private final EmergencyTypeCatalog typeCatalog;
    private final IncidentLogRepository incidentLog;
    private final ProtocolExecutor protocolExecutor;
    private final AlertDispatcher alertDispatcher;
    private final SafetyModeController safetyModeController;
    private final WellbeingScheduler wellbeingScheduler;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    private final Map<String, Incident> active = new LinkedHashMap<>();
    private final Map<String, RecoveryPlan> recoveryPlans = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    // ==================== TRIGGER ====================

    public TriggerResult trigger(String typeId, String reason, Map<String, Object> details) {
        Optional<EmergencyType> found = typeCatalog.findById(typeId);
        if (found.isEmpty()) {
            log.error("❌ Unknown emergency type: {}", typeId);
            return TriggerResult.unknownType();
        }
        EmergencyType type = found.get();
        Map<String, Object> safeDetails = details != null ? details : new HashMap<>();
        LocalDateTime now = LocalDateTime.now(clock);

        Optional<Incident> existing = findActiveByType(typeId);
        if (existing.isPresent()) {
            Incident incident = existing.get();
            log.info("Emergency already active: {}, updating details", typeId);
            incident.getUpdates().add(IncidentUpdate.builder()
                    .reason(reason)
                    .details(safeDetails)
                    .timestamp(now)
                    .build());
            incident.setReason(reason);
            notificationPublisher.publish(NotificationType.INCIDENT_UPDATED, IncidentSummaryDTO.from(incident));
            return new TriggerResult(TriggerOutcome.UPDATED, incident);
        }

        Incident incident = Incident.builder()
                .id(nextIncidentId(now))
                .typeId(typeId)
                .label(type.getLabel())
                .colorCode(type.getColorCode())
                .severity(type.getBaseSeverity())
                .status(IncidentStatus.ACTIVE)
                .reason(reason)
                .details(safeDetails)
                .triggeredAt(now)
                .loggedAt(now)
                .build();

        active.put(incident.getId(), incident);
        incidentLog.append(incident);

        log.info("🚨 EMERGENCY TRIGGERED: {} (Severity {})", type.getLabel(), type.getBaseSeverity());
        log.info("Reason: {}", reason);

        incident.getActionsExecuted().addAll(protocolExecutor.execute(incident, type));
        incident.getAlertsSent().addAll(alertDispatcher.dispatch(incident, type));

        notificationPublisher.publish(NotificationType.INCIDENT_CREATED, IncidentSummaryDTO.from(incident));
        return new TriggerResult(TriggerOutcome.CREATED, incident);
    }

    // ==================== RESOLVE ====================

    /**
     * @return empty for an unknown or already resolved incident id
     */
    public Optional<ResolutionResult> resolve(String incidentId, String resolution) {
        Incident incident = incidentId != null ? active.get(incidentId) : null;
        if (incident == null) {
            log.error("❌ Emergency not found: {}", incidentId);
            return Optional.empty();
        }

        LocalDateTime resolvedAt = LocalDateTime.now(clock);
        if (resolvedAt.isBefore(incident.getTriggeredAt())) {
            resolvedAt = incident.getTriggeredAt();
        }

        incident.setStatus(IncidentStatus.RESOLVED);
        incident.setResolvedAt(resolvedAt);
        incident.setResolution(resolution != null ? resolution : DEFAULT_RESOLUTION);
        incident.setResponseTimeMs(Duration.between(incident.getTriggeredAt(), resolvedAt).toMillis());
        active.remove(incidentId);

        log.info("✅ Emergency resolved: {} (Response time: {}s)",
                incident.getLabel(), Math.round(incident.getResponseTimeMs() / 1000.0));

        safetyModeController.releaseLighting(incident.getId());
        RecoveryPlan plan = initiateRecovery(incident);
        WellbeingCheck check = wellbeingScheduler.schedule(incident);

        if (active.isEmpty() && safetyModeController.isLockdownActive()) {
            safetyModeController.deactivateLockdown("All emergencies resolved");
        }

        notificationPublisher.publish(NotificationType.INCIDENT_RESOLVED, IncidentSummaryDTO.from(incident));
        return Optional.of(new ResolutionResult(incident, plan, check));
    }

    // ==================== RECOVERY ====================

    private RecoveryPlan initiateRecovery(Incident incident) {
        List<String> steps = typeCatalog.findById(incident.getTypeId())
                .map(EmergencyType::getRecoverySteps)
                .orElse(List.of());
        if (steps.isEmpty()) {
            return null;
        }

        log.info("Initiating recovery procedures for: {}", incident.getLabel());
        RecoveryPlan plan = RecoveryPlan.builder()
                .incidentId(incident.getId())
                .typeId(incident.getTypeId())
                .status(RecoveryStatus.IN_PROGRESS)
                .createdAt(incident.getResolvedAt())
                .build();
        for (int i = 0; i < steps.size(); i++) {
            plan.getSteps().add(RecoveryStep.builder()
                    .step(i + 1)
                    .description(steps.get(i))
                    .status(RecoveryStatus.PENDING)
                    .build());
        }
        recoveryPlans.put(incident.getId(), plan);

        Map<String, Object> payload = new HashMap<>();
        payload.put("incidentId", incident.getId());
        payload.put("type", incident.getTypeId());
        payload.put("stepsCount", steps.size());
        notificationPublisher.publish(NotificationType.RECOVERY_INITIATED, payload);
        return plan;
    }

    /**
     * Marks one recovery step done; the plan completes with its last step.
     *
     * @return empty when the incident has no plan or the step number is out of range
     */
    public Optional<RecoveryPlan> completeRecoveryStep(String incidentId, int step) {
        RecoveryPlan plan = recoveryPlans.get(incidentId);
        if (plan == null || step < 1 || step > plan.getSteps().size()) {
            log.warn("No recovery step {} for incident {}", step, incidentId);
            return Optional.empty();
        }

        RecoveryStep recoveryStep = plan.getSteps().get(step - 1);
        if (recoveryStep.getStatus() != RecoveryStatus.COMPLETED) {
            recoveryStep.setStatus(RecoveryStatus.COMPLETED);
            recoveryStep.setCompletedAt(LocalDateTime.now(clock));
        }

        boolean allDone = plan.getSteps().stream().allMatch(s -> s.getStatus() == RecoveryStatus.COMPLETED);
        if (allDone && plan.getStatus() != RecoveryStatus.COMPLETED) {
            plan.setStatus(RecoveryStatus.COMPLETED);
            plan.setCompletedAt(LocalDateTime.now(clock));
            log.info("Recovery complete for incident {}", incidentId);
        }
        return Optional.of(plan);
    }

    public Optional<RecoveryPlan> getRecoveryPlan(String incidentId) {
        return Optional.ofNullable(recoveryPlans.get(incidentId));
    }

    // ==================== QUERIES ====================

    public Optional<Incident> findActiveByType(String typeId) {
        return active.values().stream()
                .filter(i -> i.getTypeId().equals(typeId))
                .findFirst();
    }

    public Optional<Incident> findActive(String incidentId) {
        return Optional.ofNullable(incidentId != null ? active.get(incidentId) : null);
    }

    public List<Incident> getActiveIncidents() {
        return new ArrayList<>(active.values());
    }

    public int countActive() {
        return active.size();
    }

    // Engine stop: the active set is dropped, the log keeps every incident
    /**
     * Closes every active incident as ABANDONED without recovery or
     * wellbeing follow-up; the log keeps them.
     *
     * @return number of incidents closed
     */
    public int abandonActive(String reason) {
        LocalDateTime now = LocalDateTime.now(clock);
        for (Incident incident : active.values()) {
            LocalDateTime closedAt = now.isBefore(incident.getTriggeredAt()) ? incident.getTriggeredAt() : now;
            incident.setStatus(IncidentStatus.ABANDONED);
            incident.setResolvedAt(closedAt);
            incident.setResolution(reason);
            incident.setResponseTimeMs(Duration.between(incident.getTriggeredAt(), closedAt).toMillis());
            log.warn("Emergency abandoned: {} ({})", incident.getLabel(), reason);
        }
        int closed = active.size();
        active.clear();
        return closed;
    }

    private String nextIncidentId(LocalDateTime now) {
        long millis = now.atZone(clock.getZone()).toInstant().toEpochMilli();
        return "emergency_" + millis + "_" + sequence.incrementAndGet();
    }
}
