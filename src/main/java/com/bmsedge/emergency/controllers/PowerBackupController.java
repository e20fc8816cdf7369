package com.bmsedge.emergency.controllers;

import com.bmsedge.emergency.dto.BackupLevelDTO;
import com.bmsedge.emergency.dto.PowerBackupStatusDTO;
import com.bmsedge.emergency.dto.ResolutionResult;
import com.bmsedge.emergency.dto.TriggerResult;
import com.bmsedge.emergency.model.PowerBackupUnit;
import com.bmsedge.emergency.service.EmergencyResponseService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.bmsedge.emergency.exception.GlobalExceptionHandler.notFound;

@RestController
@RequestMapping("/api/power")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class PowerBackupController {

    private final EmergencyResponseService emergencyResponseService;

    // Mains lost
    @PostMapping("/failure")
    public ResponseEntity<TriggerResult> powerFailure() {
        return ResponseEntity.ok(emergencyResponseService.handlePowerFailure());
    }

    // Mains back
    @PostMapping("/restored")
    public ResponseEntity<Map<String, Object>> powerRestored() {
        Optional<ResolutionResult> resolved = emergencyResponseService.handlePowerRestored();
        Map<String, Object> body = new HashMap<>();
        body.put("incidentResolved", resolved.isPresent());
        resolved.ifPresent(r -> body.put("resolution", r));
        body.put("status", emergencyResponseService.getPowerBackupStatus());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/status")
    public ResponseEntity<PowerBackupStatusDTO> getStatus() {
        return ResponseEntity.ok(emergencyResponseService.getPowerBackupStatus());
    }

    // Battery or fuel telemetry
    @PutMapping("/units/{id}/level")
    public ResponseEntity<?> reportLevel(@PathVariable String id, @Valid @RequestBody BackupLevelDTO level) {
        Optional<PowerBackupUnit> unit = emergencyResponseService.reportBackupLevel(id, level);
        if (unit.isEmpty()) {
            return notFound("Unknown power backup unit: " + id);
        }
        return ResponseEntity.ok(unit.get());
    }
}
