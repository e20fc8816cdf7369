package com.bmsedge.emergency.service;

import com.bmsedge.emergency.model.ExecutedAction;
import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.enums.ActionStatus;
import com.bmsedge.emergency.model.enums.ProtocolActionKind;
import com.bmsedge.emergency.repository.EmergencyTypeCatalog;
import com.bmsedge.emergency.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProtocolExecutorTest {

    @Mock
    private DeviceActuator deviceActuator;

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(deviceActuator);
    }

    @Test
    void shouldRecordEveryStepInOrder() {
        when(deviceActuator.perform(any(), any(), any())).thenReturn("ok");

        Incident incident = fixture.lifecycleManager
                .trigger(EmergencyTypeCatalog.FIRE, "Smoke", null).getIncident();

        List<ExecutedAction> actions = incident.getActionsExecuted();
        assertThat(actions).hasSize(8);
        assertThat(actions).extracting(ExecutedAction::getStep).containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(actions).allMatch(a -> a.getStatus() == ActionStatus.EXECUTED);
        assertThat(actions.get(3).getDetail()).isEqualTo("8 emergency lights active");
        assertThat(incident.getActivatedLightIds()).hasSize(8);
    }

    @Test
    void shouldKeepGoingWhenADeviceStepFails() {
        // Given: the sprinkler actuator is broken
        when(deviceActuator.perform(any(), any(), any())).thenReturn("ok");
        when(deviceActuator.perform(eq(ProtocolActionKind.ACTIVATE_SPRINKLERS), any(), any()))
                .thenThrow(new IllegalStateException("Sprinkler valve offline"));

        // When
        Incident incident = fixture.lifecycleManager
                .trigger(EmergencyTypeCatalog.FIRE, "Smoke", null).getIncident();

        // Then: the failure is recorded and the remaining steps still run
        List<ExecutedAction> actions = incident.getActionsExecuted();
        assertThat(actions).hasSize(8);
        ExecutedAction sprinklers = actions.get(4);
        assertThat(sprinklers.getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(sprinklers.getDetail()).isEqualTo("Sprinkler valve offline");
        assertThat(actions.subList(5, 8)).allMatch(a -> a.getStatus() == ActionStatus.EXECUTED);
        verify(deviceActuator).perform(eq(ProtocolActionKind.CALL_EMERGENCY_SERVICES), eq("112"), same(incident));
    }

    @Test
    void shouldNotActuateInstructionsOrLighting() {
        Incident incident = fixture.lifecycleManager
                .trigger(EmergencyTypeCatalog.GENERIC, "Alarm", null).getIncident();

        verify(deviceActuator).perform(eq(ProtocolActionKind.SOUND_ALARM), eq("general"), same(incident));
        verifyNoMoreInteractions(deviceActuator);
    }

    @Test
    void shouldActivateLockdownFromTheIntruderProtocol() {
        Incident incident = fixture.lifecycleManager
                .trigger(EmergencyTypeCatalog.INTRUDER, "Glass break", null).getIncident();

        assertThat(fixture.safetyModeController.isLockdownActive()).isTrue();
        assertThat(fixture.safetyModeController.getLockdownReason()).isEqualTo("Intruder / Break-in: Glass break");
        assertThat(incident.getActionsExecuted().get(1).getDetail()).isEqualTo("Lockdown activated");
    }
}
