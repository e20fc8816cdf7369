package com.bmsedge.emergency.controllers;

import com.bmsedge.emergency.dto.WeatherAlertDTO;
import com.bmsedge.emergency.model.WeatherAlert;
import com.bmsedge.emergency.service.EmergencyResponseService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

import static com.bmsedge.emergency.exception.GlobalExceptionHandler.notFound;

@RestController
@RequestMapping("/api/weather")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class WeatherController {

    private final EmergencyResponseService emergencyResponseService;

    @GetMapping("/alerts")
    public ResponseEntity<Map<String, Object>> getAlerts() {
        return ResponseEntity.ok(emergencyResponseService.getWeatherAlerts());
    }

    // Alert pushed by the weather feed
    @PostMapping("/alerts")
    public ResponseEntity<WeatherAlert> issue(@Valid @RequestBody WeatherAlertDTO dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(emergencyResponseService.issueWeatherAlert(dto));
    }

    @DeleteMapping("/alerts/{id}")
    public ResponseEntity<?> clear(@PathVariable String id) {
        Optional<WeatherAlert> alert = emergencyResponseService.clearWeatherAlert(id);
        if (alert.isEmpty()) {
            return notFound("Active weather alert not found: " + id);
        }
        return ResponseEntity.ok(alert.get());
    }
}
