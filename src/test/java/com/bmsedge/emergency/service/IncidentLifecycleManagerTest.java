package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.ResolutionResult;
import com.bmsedge.emergency.dto.TriggerResult;
import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.RecoveryPlan;
import com.bmsedge.emergency.model.enums.IncidentStatus;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.model.enums.RecoveryStatus;
import com.bmsedge.emergency.model.enums.TriggerOutcome;
import com.bmsedge.emergency.repository.EmergencyTypeCatalog;
import com.bmsedge.emergency.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class IncidentLifecycleManagerTest {

    private EngineFixture fixture;
    private IncidentLifecycleManager manager;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        manager = fixture.lifecycleManager;
    }

    @Test
    void shouldReturnUnknownTypeWithoutSideEffects() {
        TriggerResult result = manager.trigger("volcano", "Lava in the garden", null);

        assertThat(result.getOutcome()).isEqualTo(TriggerOutcome.UNKNOWN_TYPE);
        assertThat(result.getIncident()).isNull();
        assertThat(fixture.incidentLog.size()).isZero();
        assertThat(fixture.publisher.getRecent()).isEmpty();
    }

    @Test
    void shouldCreateIncidentWithTypeSeverityAndLogIt() {
        TriggerResult result = manager.trigger(EmergencyTypeCatalog.FLOOD, "Water in basement", Map.of("zone", "basement"));

        Incident incident = result.getIncident();
        assertThat(result.isCreated()).isTrue();
        assertThat(incident.getId()).startsWith("emergency_" + EngineFixture.START.toEpochMilli() + "_");
        assertThat(incident.getSeverity()).isEqualTo(4);
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.ACTIVE);
        assertThat(incident.getActionsExecuted()).hasSize(5);
        assertThat(fixture.incidentLog.findById(incident.getId())).contains(incident);
        assertThat(fixture.publisher.count(NotificationType.INCIDENT_CREATED)).isEqualTo(1);
    }

    @Test
    void shouldGiveDistinctIdsToIncidentsCreatedInTheSameMillisecond() {
        Incident fire = manager.trigger(EmergencyTypeCatalog.FIRE, "Smoke", null).getIncident();
        Incident flood = manager.trigger(EmergencyTypeCatalog.FLOOD, "Water", null).getIncident();

        assertThat(fire.getId()).isNotEqualTo(flood.getId());
    }

    @Test
    void shouldDeduplicateSecondTriggerOfAnActiveType() {
        // Given: an active fire
        Incident first = manager.trigger(EmergencyTypeCatalog.FIRE, "Smoke in kitchen", null).getIncident();

        // When: fire is triggered again
        fixture.clock.advance(Duration.ofSeconds(3));
        TriggerResult second = manager.trigger(EmergencyTypeCatalog.FIRE, "Smoke in hallway", Map.of("floor", 2));

        // Then: the active incident is updated instead of a new one being opened
        assertThat(second.getOutcome()).isEqualTo(TriggerOutcome.UPDATED);
        assertThat(second.getIncident()).isSameAs(first);
        assertThat(first.getUpdates()).hasSize(1);
        assertThat(first.getReason()).isEqualTo("Smoke in hallway");
        assertThat(manager.countActive()).isEqualTo(1);
        assertThat(fixture.incidentLog.size()).isEqualTo(1);
        assertThat(fixture.publisher.count(NotificationType.INCIDENT_UPDATED)).isEqualTo(1);
    }

    @Test
    void shouldResolveWithResponseTimeRecoveryPlanAndWellbeingCheck() {
        Incident incident = manager.trigger(EmergencyTypeCatalog.FIRE, "Smoke", null).getIncident();
        fixture.clock.advance(Duration.ofSeconds(90));

        ResolutionResult result = manager.resolve(incident.getId(), "Fire department cleared").orElseThrow();

        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
        assertThat(incident.getResponseTimeMs()).isEqualTo(90_000L);
        assertThat(incident.getResolution()).isEqualTo("Fire department cleared");
        assertThat(manager.findActive(incident.getId())).isEmpty();

        RecoveryPlan plan = result.getRecoveryPlan();
        assertThat(plan.getStatus()).isEqualTo(RecoveryStatus.IN_PROGRESS);
        assertThat(plan.getSteps()).hasSize(5)
                .allMatch(s -> s.getStatus() == RecoveryStatus.PENDING);
        assertThat(result.getWellbeingCheck().getIncidentId()).isEqualTo(incident.getId());
        assertThat(fixture.publisher.count(NotificationType.INCIDENT_RESOLVED)).isEqualTo(1);
    }

    @Test
    void shouldUseDefaultResolutionText() {
        Incident incident = manager.trigger(EmergencyTypeCatalog.MEDICAL, "Fall", null).getIncident();

        manager.resolve(incident.getId(), null);

        assertThat(incident.getResolution()).isEqualTo("Manually resolved");
    }

    @Test
    void shouldRejectSecondResolve() {
        Incident incident = manager.trigger(EmergencyTypeCatalog.FLOOD, "Water", null).getIncident();
        manager.resolve(incident.getId(), "Pumped out");

        Optional<ResolutionResult> again = manager.resolve(incident.getId(), "Again");

        assertThat(again).isEmpty();
        assertThat(incident.getResolution()).isEqualTo("Pumped out");
        assertThat(fixture.wellbeingScheduler.getPending()).hasSize(1);
    }

    @Test
    void shouldRejectUnknownIncidentId() {
        assertThat(manager.resolve("emergency_0_0", null)).isEmpty();
        assertThat(manager.resolve(null, null)).isEmpty();
    }

    @Test
    void shouldSkipRecoveryPlanForTypeWithoutRecoverySteps() {
        Incident incident = manager.trigger(EmergencyTypeCatalog.GENERIC, "Unclassified alarm", null).getIncident();

        ResolutionResult result = manager.resolve(incident.getId(), null).orElseThrow();

        assertThat(result.getRecoveryPlan()).isNull();
        assertThat(manager.getRecoveryPlan(incident.getId())).isEmpty();
        assertThat(fixture.publisher.count(NotificationType.RECOVERY_INITIATED)).isZero();
    }

    @Test
    void shouldClampResolutionTimeWhenTheClockGoesBack() {
        Incident incident = manager.trigger(EmergencyTypeCatalog.FLOOD, "Water", null).getIncident();
        fixture.clock.advance(Duration.ofMinutes(-5));

        manager.resolve(incident.getId(), null);

        assertThat(incident.getResolvedAt()).isEqualTo(incident.getTriggeredAt());
        assertThat(incident.getResponseTimeMs()).isZero();
    }

    @Test
    void shouldLiftLockdownWhenTheLastIncidentIsResolved() {
        // Given: an intruder incident locks the home down, and a flood is also active
        Incident intruder = manager.trigger(EmergencyTypeCatalog.INTRUDER, "Glass break", null).getIncident();
        Incident flood = manager.trigger(EmergencyTypeCatalog.FLOOD, "Water", null).getIncident();
        assertThat(fixture.safetyModeController.isLockdownActive()).isTrue();

        // When / Then: lockdown holds until nothing is active
        manager.resolve(intruder.getId(), null);
        assertThat(fixture.safetyModeController.isLockdownActive()).isTrue();

        manager.resolve(flood.getId(), null);
        assertThat(fixture.safetyModeController.isLockdownActive()).isFalse();
    }

    @Test
    void shouldReleaseOnlyTheResolvedIncidentsLights() {
        Incident fire = manager.trigger(EmergencyTypeCatalog.FIRE, "Smoke", null).getIncident();
        manager.trigger(EmergencyTypeCatalog.FLOOD, "Water", null);

        manager.resolve(fire.getId(), null);

        assertThat(fixture.safetyModeController.getActiveLights()).hasSize(8);
    }

    @Test
    void shouldCompleteRecoveryPlanWhenEveryStepIsDone() {
        Incident incident = manager.trigger(EmergencyTypeCatalog.STORM, "Storm", null).getIncident();
        manager.resolve(incident.getId(), null);

        for (int step = 1; step <= 3; step++) {
            manager.completeRecoveryStep(incident.getId(), step);
        }
        assertThat(manager.getRecoveryPlan(incident.getId()).get().getStatus()).isEqualTo(RecoveryStatus.IN_PROGRESS);

        RecoveryPlan plan = manager.completeRecoveryStep(incident.getId(), 4).orElseThrow();

        assertThat(plan.getStatus()).isEqualTo(RecoveryStatus.COMPLETED);
        assertThat(plan.getCompletedAt()).isNotNull();
        assertThat(manager.completeRecoveryStep(incident.getId(), 5)).isEmpty();
    }
}
