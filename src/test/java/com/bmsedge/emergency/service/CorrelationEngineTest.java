package com.bmsedge.emergency.service;

import com.bmsedge.emergency.model.CorrelationMatch;
import com.bmsedge.emergency.model.SensorEvent;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.model.enums.SensorReportOutcome;
import com.bmsedge.emergency.repository.EmergencyTypeCatalog;
import com.bmsedge.emergency.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CorrelationEngineTest {

    private EngineFixture fixture;
    private CorrelationEngine engine;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        engine = fixture.correlationEngine;
    }

    @Test
    void shouldRejectUnknownSensorWithoutBuffering() {
        SensorReportOutcome outcome = engine.report("no_such_sensor", "alarm", Map.of());

        assertThat(outcome).isEqualTo(SensorReportOutcome.UNKNOWN_SENSOR);
        assertThat(engine.bufferSize()).isZero();
    }

    @Test
    void shouldWarnOnFirstEventOfATypeAndAcceptTheSecond() {
        // Given: a single flood sensor fires
        SensorReportOutcome first = engine.report("flood_sensor_basement", "water_detected", null);

        // When: a second flood sensor fires shortly after
        fixture.clock.advance(Duration.ofSeconds(5));
        SensorReportOutcome second = engine.report("flood_sensor_laundry", "water_detected", null);

        // Then: only the first one raises a sensor warning
        assertThat(first).isEqualTo(SensorReportOutcome.WARNING);
        assertThat(second).isEqualTo(SensorReportOutcome.ACCEPTED);
        assertThat(fixture.publisher.count(NotificationType.SENSOR_WARNING)).isEqualTo(1);
    }

    @Test
    void shouldCountTriggersOnTheSensorRecord() {
        engine.report("smoke_detector_kitchen", "smoke", null);
        engine.report("smoke_detector_kitchen", "smoke", null);

        assertThat(fixture.sensorRegistry.findById("smoke_detector_kitchen").get().getTriggerCount())
                .isEqualTo(2);
    }

    @Test
    void shouldMatchTwoDistinctFloodSensorsWithinTheWindow() {
        engine.report("flood_sensor_basement", "water_detected", null);
        fixture.clock.advance(Duration.ofSeconds(10));
        engine.report("flood_sensor_bathroom", "water_detected", null);

        List<CorrelationMatch> matches = engine.tick();

        assertThat(matches).hasSize(1);
        CorrelationMatch match = matches.get(0);
        assertThat(match.getRuleId()).isEqualTo("multiple_flood_sensors");
        assertThat(match.getEmergencyTypeId()).isEqualTo(EmergencyTypeCatalog.FLOOD);
        assertThat(match.getDetails()).containsEntry("confirmedBy", "2 sensors");
        assertThat(engine.bufferSize()).isZero();
    }

    @Test
    void shouldNotCountTheSameSensorTwice() {
        engine.report("flood_sensor_basement", "water_detected", null);
        engine.report("flood_sensor_basement", "water_detected", null);

        assertThat(engine.tick()).isEmpty();
        assertThat(engine.bufferSize()).isEqualTo(2);
    }

    @Test
    void shouldPruneEventsOlderThanTheWindow() {
        // Given: two flood sensors fire the full window apart
        engine.report("flood_sensor_basement", "water_detected", null);
        fixture.clock.advance(Duration.ofMillis(engine.getWindowMs()));
        engine.report("flood_sensor_bathroom", "water_detected", null);

        // When
        List<CorrelationMatch> matches = engine.tick();

        // Then: the first one has aged out and nothing correlates
        assertThat(matches).isEmpty();
        assertThat(engine.getBufferedEvents())
                .extracting(SensorEvent::getSensorId)
                .containsExactly("flood_sensor_bathroom");
    }

    @Test
    void shouldMatchSmokeWithExtremeHeatAsFire() {
        engine.report("smoke_detector_living", "smoke", null);
        engine.report("temp_extreme_attic", "high_temperature", Map.of("celsius", 72));

        List<CorrelationMatch> matches = engine.tick();

        assertThat(matches).extracting(CorrelationMatch::getRuleId).containsExactly("smoke_and_heat");
        assertThat(matches.get(0).getEmergencyTypeId()).isEqualTo(EmergencyTypeCatalog.FIRE);
    }

    @Test
    void shouldConsumeMatchedEventsSoTheyFireOnce() {
        engine.report("motion_sensor_back", "motion", null);
        engine.report("glass_break_back", "glass_break", null);

        assertThat(engine.tick()).hasSize(1);
        assertThat(engine.tick()).isEmpty();
    }

    @Test
    void shouldKeepInsertionTimestampsMonotonicWhenTheClockGoesBack() {
        engine.report("co_detector_garage", "co", null);
        fixture.clock.advance(Duration.ofSeconds(-20));
        engine.report("co_detector_basement", "co", null);

        assertThat(engine.getBufferedEvents().get(1).getTimestamp())
                .isEqualTo(engine.getBufferedEvents().get(0).getTimestamp());
    }

    @Test
    void shouldClearTheBuffer() {
        engine.report("gas_detector_kitchen", "gas", null);

        engine.clear();

        assertThat(engine.bufferSize()).isZero();
    }
}
