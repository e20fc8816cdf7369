package com.bmsedge.emergency.service;

import com.bmsedge.emergency.model.EmergencyLight;
import com.bmsedge.emergency.model.enums.LightStatus;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SafetyModeControllerTest {

    private EngineFixture fixture;
    private SafetyModeController controller;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        controller = fixture.safetyModeController;
    }

    @Test
    void shouldActivateLockdownOnlyOnce() {
        assertThat(controller.activateLockdown("Suspicious activity")).isTrue();
        assertThat(controller.activateLockdown("Again")).isFalse();

        assertThat(controller.isLockdownActive()).isTrue();
        assertThat(controller.getLockdownReason()).isEqualTo("Suspicious activity");
        assertThat(fixture.publisher.count(NotificationType.LOCKDOWN_ACTIVATED)).isEqualTo(1);
    }

    @Test
    void shouldIgnoreDeactivationWhenNotLockedDown() {
        assertThat(controller.deactivateLockdown(null)).isFalse();
        assertThat(fixture.publisher.count(NotificationType.LOCKDOWN_DEACTIVATED)).isZero();
    }

    @Test
    void shouldKeepIncidentLightsOnWhenLockdownEnds() {
        // Given: an incident and a lockdown both hold the lights
        controller.activateLighting("emergency_1_1");
        controller.activateLockdown("Manual");

        // When
        controller.deactivateLockdown("Manual");

        // Then
        assertThat(controller.getActiveLights()).hasSize(8);
        assertThat(controller.getLights()).allMatch(l -> !l.getHolders().contains(SafetyModeController.LOCKDOWN_HOLDER));
    }

    @Test
    void shouldSkipLightsWithDrainedBattery() {
        EmergencyLight garage = fixture.lightingRepository.findById("emlight_garage").get();
        garage.setBatteryLevel(5);

        List<String> held = controller.activateLighting("emergency_1_1");

        assertThat(held).hasSize(7).doesNotContain("emlight_garage");
        assertThat(garage.getStatus()).isEqualTo(LightStatus.READY);
    }

    @Test
    void shouldHonourConfiguredMinimumBattery() {
        ReflectionTestUtils.setField(controller, "minBatteryLevel", 95.0);

        List<String> held = controller.activateLighting("emergency_1_1");

        assertThat(held).containsExactlyInAnyOrder(
                "emlight_hallway1", "emlight_hallway2", "emlight_kitchen", "emlight_exit_front", "emlight_exit_back");
    }

    @Test
    void shouldReturnLightsToReadyWhenTheLastHolderLetsGo() {
        controller.activateLighting("a");
        controller.activateLighting("b");

        assertThat(controller.releaseLighting("a")).isZero();
        assertThat(controller.releaseLighting("b")).isEqualTo(8);
        assertThat(controller.getActiveLights()).isEmpty();
    }

    @Test
    void shouldPublishLightingActivatedOnlyWhenSomethingSwitchedOn() {
        controller.activateLighting("a");
        controller.activateLighting("b");

        assertThat(fixture.publisher.count(NotificationType.LIGHTING_ACTIVATED)).isEqualTo(1);
    }

    @Test
    void shouldClearPanicOnlyWhenSet() {
        assertThat(controller.clearPanic()).isFalse();

        controller.setPanic("bedroom_button");

        assertThat(controller.isPanicActive()).isTrue();
        assertThat(controller.getPanicSource()).isEqualTo("bedroom_button");
        assertThat(controller.clearPanic()).isTrue();
        assertThat(controller.isPanicActive()).isFalse();
    }

    @Test
    void shouldResetModesAndLights() {
        controller.activateLockdown("Manual");
        controller.setPanic("app");

        controller.reset();

        assertThat(controller.isLockdownActive()).isFalse();
        assertThat(controller.isPanicActive()).isFalse();
        assertThat(controller.getActiveLights()).isEmpty();
    }
}
