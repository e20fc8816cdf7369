package com.bmsedge.emergency.controllers;

import com.bmsedge.emergency.dto.EquipmentIssueDTO;
import com.bmsedge.emergency.model.EmergencyEquipment;
import com.bmsedge.emergency.service.EmergencyResponseService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

import static com.bmsedge.emergency.exception.GlobalExceptionHandler.notFound;

@RestController
@RequestMapping("/api/equipment")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class EquipmentController {

    private final EmergencyResponseService emergencyResponseService;

    @GetMapping
    public ResponseEntity<List<EmergencyEquipment>> getInventory() {
        return ResponseEntity.ok(emergencyResponseService.getEquipmentInventory());
    }

    @PostMapping("/{id}/inspect")
    public ResponseEntity<?> inspect(@PathVariable String id) {
        Optional<EmergencyEquipment> item = emergencyResponseService.inspectEquipment(id);
        if (item.isEmpty()) {
            return notFound("Equipment not found: " + id);
        }
        return ResponseEntity.ok(item.get());
    }

    // Runs the expiry / battery check now
    @PostMapping("/check")
    public ResponseEntity<List<EquipmentIssueDTO>> check() {
        return ResponseEntity.ok(emergencyResponseService.checkEquipment());
    }
}
