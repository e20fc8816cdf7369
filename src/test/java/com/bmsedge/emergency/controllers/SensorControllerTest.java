package com.bmsedge.emergency.controllers;

import com.bmsedge.emergency.dto.SensorReportResultDTO;
import com.bmsedge.emergency.model.enums.SensorReportOutcome;
import com.bmsedge.emergency.service.EmergencyResponseService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SensorController.class)
class SensorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EmergencyResponseService emergencyResponseService;

    @Test
    void shouldAcceptSensorEvent() throws Exception {
        when(emergencyResponseService.reportSensorEvent(eq("flood_sensor_basement"), eq("water_detected"), any()))
                .thenReturn(new SensorReportResultDTO("flood_sensor_basement", "water_detected",
                        SensorReportOutcome.WARNING, 1));

        mockMvc.perform(post("/api/sensors/{id}/events", "flood_sensor_basement")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventType\":\"water_detected\",\"payload\":{\"depthMm\":4}}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.outcome").value("WARNING"))
                .andExpect(jsonPath("$.bufferedEvents").value(1));
    }

    @Test
    void shouldReturnNotFoundForUnknownSensor() throws Exception {
        when(emergencyResponseService.reportSensorEvent(any(), any(), any()))
                .thenReturn(new SensorReportResultDTO("ghost", "smoke", SensorReportOutcome.UNKNOWN_SENSOR, 0));

        mockMvc.perform(post("/api/sensors/{id}/events", "ghost")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventType\":\"smoke\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldRejectBatteryOutOfRange() throws Exception {
        mockMvc.perform(put("/api/sensors/{id}/telemetry", "co_detector_garage")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"battery\":140}"))
                .andExpect(status().isBadRequest());

        verify(emergencyResponseService, never()).updateSensorTelemetry(any(), any());
    }

    @Test
    void shouldReturnNotFoundForTelemetryOfUnknownSensor() throws Exception {
        when(emergencyResponseService.updateSensorTelemetry(any(), any())).thenReturn(Optional.empty());

        mockMvc.perform(put("/api/sensors/{id}/telemetry", "ghost")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"battery\":40}"))
                .andExpect(status().isNotFound());
    }
}
