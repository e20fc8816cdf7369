package com.bmsedge.emergency.controllers;

import com.bmsedge.emergency.dto.DamageAssessmentDTO;
import com.bmsedge.emergency.dto.IncidentSummaryDTO;
import com.bmsedge.emergency.dto.LightingStatusDTO;
import com.bmsedge.emergency.dto.LockdownRequestDTO;
import com.bmsedge.emergency.dto.PanicButtonDTO;
import com.bmsedge.emergency.dto.ResolutionResult;
import com.bmsedge.emergency.dto.ResolveRequestDTO;
import com.bmsedge.emergency.dto.StatisticsDTO;
import com.bmsedge.emergency.dto.TriggerRequestDTO;
import com.bmsedge.emergency.dto.TriggerResult;
import com.bmsedge.emergency.model.DamageReport;
import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.RecoveryPlan;
import com.bmsedge.emergency.model.enums.TriggerOutcome;
import com.bmsedge.emergency.service.EmergencyResponseService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.bmsedge.emergency.exception.GlobalExceptionHandler.conflict;
import static com.bmsedge.emergency.exception.GlobalExceptionHandler.notFound;

@RestController
@RequestMapping("/api/emergency")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class EmergencyController {

    private final EmergencyResponseService emergencyResponseService;

    // Trigger an emergency manually
    @PostMapping("/trigger")
    public ResponseEntity<?> trigger(@Valid @RequestBody TriggerRequestDTO request) {
        TriggerResult result = emergencyResponseService.triggerEmergency(
                request.getType(), request.getReason(), request.getDetails());
        if (result.getOutcome() == TriggerOutcome.UNKNOWN_TYPE) {
            return notFound("Unknown emergency type: " + request.getType());
        }
        HttpStatus status = result.isCreated() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    // Resolve an active emergency
    @PostMapping("/{id}/resolve")
    public ResponseEntity<?> resolve(@PathVariable String id,
                                     @RequestBody(required = false) ResolveRequestDTO request) {
        String resolution = request != null ? request.getResolution() : null;
        Optional<ResolutionResult> result = emergencyResponseService.resolveEmergency(id, resolution);
        if (result.isPresent()) {
            return ResponseEntity.ok(result.get());
        }
        Optional<Incident> closed = emergencyResponseService.getIncident(id);
        if (closed.isPresent()) {
            return conflict("Emergency is no longer active: " + id + " (" + closed.get().getStatus() + ")");
        }
        return notFound("Emergency not found: " + id);
    }

    @GetMapping("/active")
    public ResponseEntity<List<IncidentSummaryDTO>> getActive() {
        return ResponseEntity.ok(emergencyResponseService.getActiveEmergencies());
    }

    // Incident log, newest first
    @GetMapping("/history")
    public ResponseEntity<List<IncidentSummaryDTO>> getHistory(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(emergencyResponseService.getIncidentHistory(limit));
    }

    @GetMapping("/statistics")
    public ResponseEntity<StatisticsDTO> getStatistics() {
        return ResponseEntity.ok(emergencyResponseService.getStatistics());
    }

    // Full incident with actions, alerts and updates
    @GetMapping("/{id}")
    public ResponseEntity<?> getIncident(@PathVariable String id) {
        Optional<Incident> incident = emergencyResponseService.getIncident(id);
        if (incident.isEmpty()) {
            return notFound("Emergency not found: " + id);
        }
        return ResponseEntity.ok(incident.get());
    }

    @GetMapping("/{id}/recovery")
    public ResponseEntity<?> getRecoveryPlan(@PathVariable String id) {
        Optional<RecoveryPlan> plan = emergencyResponseService.getRecoveryPlan(id);
        if (plan.isEmpty()) {
            return notFound("No recovery plan for: " + id);
        }
        return ResponseEntity.ok(plan.get());
    }

    @PatchMapping("/{id}/recovery/{step}")
    public ResponseEntity<?> completeRecoveryStep(@PathVariable String id, @PathVariable int step) {
        Optional<RecoveryPlan> plan = emergencyResponseService.completeRecoveryStep(id, step);
        if (plan.isEmpty()) {
            return notFound("No recovery step " + step + " for: " + id);
        }
        return ResponseEntity.ok(plan.get());
    }

    @PostMapping("/{id}/damage")
    public ResponseEntity<?> assessDamage(@PathVariable String id,
                                          @Valid @RequestBody DamageAssessmentDTO assessment) {
        Optional<DamageReport> report = emergencyResponseService.assessDamage(id, assessment);
        if (report.isEmpty()) {
            return notFound("Emergency not found: " + id);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(report.get());
    }

    // ==================== PANIC / LOCKDOWN ====================

    @PostMapping("/panic")
    public ResponseEntity<TriggerResult> triggerPanic(@RequestBody(required = false) PanicButtonDTO request) {
        PanicButtonDTO body = request != null ? request : new PanicButtonDTO();
        TriggerResult result = emergencyResponseService.triggerPanicButton(body.getSource(), body.getDetails());
        return ResponseEntity.status(result.isCreated() ? HttpStatus.CREATED : HttpStatus.OK).body(result);
    }

    @DeleteMapping("/panic")
    public ResponseEntity<Map<String, Object>> deactivatePanic() {
        boolean changed = emergencyResponseService.deactivatePanicButton();
        return ResponseEntity.ok(Map.of("changed", changed, "panicActive", false));
    }

    @PostMapping("/lockdown")
    public ResponseEntity<Map<String, Object>> activateLockdown(@RequestBody(required = false) LockdownRequestDTO request) {
        boolean changed = emergencyResponseService.activateLockdown(request != null ? request.getReason() : null);
        return ResponseEntity.ok(Map.of("changed", changed, "lockdownActive", true));
    }

    @DeleteMapping("/lockdown")
    public ResponseEntity<Map<String, Object>> deactivateLockdown(@RequestBody(required = false) LockdownRequestDTO request) {
        boolean changed = emergencyResponseService.deactivateLockdown(request != null ? request.getReason() : null);
        return ResponseEntity.ok(Map.of("changed", changed, "lockdownActive", false));
    }

    @GetMapping("/lighting")
    public ResponseEntity<LightingStatusDTO> getLighting() {
        return ResponseEntity.ok(emergencyResponseService.getLightingStatus());
    }
}
