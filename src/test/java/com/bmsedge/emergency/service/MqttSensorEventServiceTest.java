package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.SensorReportResultDTO;
import com.bmsedge.emergency.model.SensorEvent;
import com.bmsedge.emergency.model.enums.SensorReportOutcome;
import com.bmsedge.emergency.support.EngineFixture;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class MqttSensorEventServiceTest {

    private EngineFixture fixture;
    private MqttSensorEventService service;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        fixture.engine.start();
        service = new MqttSensorEventService(fixture.engine, new ObjectMapper());
    }

    @Test
    void shouldReportSensorEventFromTopicAndBody() {
        Optional<SensorReportResultDTO> result = service.handleMessage(
                "emergency/sensors/smoke_detector_kitchen", "{\"eventType\":\"smoke\",\"density\":0.7}");

        assertThat(result).isPresent();
        assertThat(result.get().getOutcome()).isEqualTo(SensorReportOutcome.WARNING);
        SensorEvent event = fixture.correlationEngine.getBufferedEvents().get(0);
        assertThat(event.getEventType()).isEqualTo("smoke");
        assertThat(event.getPayload()).containsEntry("density", 0.7).doesNotContainKey("eventType");
    }

    @Test
    void shouldIgnoreMalformedMessages() {
        assertThat(service.handleMessage("emergency/sensors/smoke_detector_kitchen", "not json")).isEmpty();
        assertThat(service.handleMessage("emergency/sensors/smoke_detector_kitchen", "{\"density\":1}")).isEmpty();
        assertThat(service.handleMessage("emergency/other/smoke_detector_kitchen", "{\"eventType\":\"smoke\"}")).isEmpty();
        assertThat(fixture.correlationEngine.bufferSize()).isZero();
    }

    @Test
    void shouldExtractSensorIdFromTopic() {
        assertThat(MqttSensorEventService.sensorIdFrom("emergency/sensors/flood_sensor_basement"))
                .isEqualTo("flood_sensor_basement");
        assertThat(MqttSensorEventService.sensorIdFrom("emergency/sensors")).isNull();
        assertThat(MqttSensorEventService.sensorIdFrom(null)).isNull();
    }
}
