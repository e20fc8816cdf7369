package com.bmsedge.emergency.controllers;

import com.bmsedge.emergency.dto.SensorEventDTO;
import com.bmsedge.emergency.dto.SensorReportResultDTO;
import com.bmsedge.emergency.dto.SensorStatusDTO;
import com.bmsedge.emergency.dto.SensorTelemetryDTO;
import com.bmsedge.emergency.model.SensorRecord;
import com.bmsedge.emergency.model.enums.SensorReportOutcome;
import com.bmsedge.emergency.service.EmergencyResponseService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

import static com.bmsedge.emergency.exception.GlobalExceptionHandler.notFound;

@RestController
@RequestMapping("/api/sensors")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class SensorController {

    private final EmergencyResponseService emergencyResponseService;

    // Report a raw sensor event into the correlation buffer
    @PostMapping("/{id}/events")
    public ResponseEntity<SensorReportResultDTO> reportEvent(@PathVariable String id,
                                                             @Valid @RequestBody SensorEventDTO event) {
        SensorReportResultDTO result = emergencyResponseService.reportSensorEvent(
                id, event.getEventType(), event.getPayload());
        if (result.getOutcome() == SensorReportOutcome.UNKNOWN_SENSOR) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
        }
        return ResponseEntity.accepted().body(result);
    }

    @GetMapping("/status")
    public ResponseEntity<SensorStatusDTO> getStatus() {
        return ResponseEntity.ok(emergencyResponseService.getSensorStatus());
    }

    // Battery / connectivity telemetry from the device layer
    @PutMapping("/{id}/telemetry")
    public ResponseEntity<?> updateTelemetry(@PathVariable String id,
                                             @Valid @RequestBody SensorTelemetryDTO telemetry) {
        Optional<SensorRecord> sensor = emergencyResponseService.updateSensorTelemetry(id, telemetry);
        if (sensor.isEmpty()) {
            return notFound("Unknown sensor: " + id);
        }
        return ResponseEntity.ok(sensor.get());
    }
}
