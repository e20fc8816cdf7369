package com.bmsedge.emergency.controllers;

import com.bmsedge.emergency.dto.WellbeingResponseDTO;
import com.bmsedge.emergency.model.WellbeingCheck;
import com.bmsedge.emergency.service.EmergencyResponseService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

import static com.bmsedge.emergency.exception.GlobalExceptionHandler.notFound;

@RestController
@RequestMapping("/api/wellbeing")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class WellbeingController {

    private final EmergencyResponseService emergencyResponseService;

    @GetMapping("/pending")
    public ResponseEntity<List<WellbeingCheck>> getPending() {
        return ResponseEntity.ok(emergencyResponseService.getPendingWellbeingChecks());
    }

    @GetMapping("/completed")
    public ResponseEntity<List<WellbeingCheck>> getCompleted() {
        return ResponseEntity.ok(emergencyResponseService.getCompletedWellbeingChecks());
    }

    @PostMapping("/{id}/respond")
    public ResponseEntity<?> respond(@PathVariable String id, @Valid @RequestBody WellbeingResponseDTO body) {
        if (!emergencyResponseService.respondToWellbeingCheck(id, body.getResponse())) {
            return notFound("Wellbeing check not found: " + id);
        }
        return ResponseEntity.ok(Map.of("checkId", id, "response", body.getResponse()));
    }
}
