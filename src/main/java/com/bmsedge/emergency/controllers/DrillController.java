package com.bmsedge.emergency.controllers;

import com.bmsedge.emergency.dto.DrillResultDTO;
import com.bmsedge.emergency.model.Drill;
import com.bmsedge.emergency.model.DrillRun;
import com.bmsedge.emergency.service.EmergencyResponseService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

import static com.bmsedge.emergency.exception.GlobalExceptionHandler.notFound;

@RestController
@RequestMapping("/api/drills")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class DrillController {

    private final EmergencyResponseService emergencyResponseService;

    @GetMapping
    public ResponseEntity<List<Drill>> getSchedule() {
        return ResponseEntity.ok(emergencyResponseService.getDrillSchedule());
    }

    @GetMapping("/runs")
    public ResponseEntity<List<DrillRun>> getRuns() {
        return ResponseEntity.ok(emergencyResponseService.getDrillRuns());
    }

    // Record a completed drill
    @PostMapping("/{id}/runs")
    public ResponseEntity<?> recordRun(@PathVariable String id, @Valid @RequestBody DrillResultDTO result) {
        Optional<DrillRun> run = emergencyResponseService.recordDrillRun(id, result);
        if (run.isEmpty()) {
            return notFound("Unknown drill: " + id);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(run.get());
    }
}
