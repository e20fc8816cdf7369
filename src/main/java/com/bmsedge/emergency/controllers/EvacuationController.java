package com.bmsedge.emergency.controllers;

import com.bmsedge.emergency.dto.RouteClearanceDTO;
import com.bmsedge.emergency.model.EvacuationRoute;
import com.bmsedge.emergency.service.EmergencyResponseService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.bmsedge.emergency.exception.GlobalExceptionHandler.conflict;
import static com.bmsedge.emergency.exception.GlobalExceptionHandler.notFound;

@RestController
@RequestMapping("/api/evacuation/routes")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class EvacuationController {

    private final EmergencyResponseService emergencyResponseService;

    @GetMapping
    public ResponseEntity<List<EvacuationRoute>> getRoutes() {
        return ResponseEntity.ok(emergencyResponseService.getEvacuationRoutes());
    }

    // Best clear route: accessible, lit, fastest
    @GetMapping("/recommended")
    public ResponseEntity<?> recommend() {
        Optional<EvacuationRoute> route = emergencyResponseService.recommendEvacuationRoute();
        if (route.isEmpty()) {
            return conflict("No evacuation routes available");
        }
        return ResponseEntity.ok(route.get());
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getPreferred(@PathVariable String id) {
        Optional<EvacuationRoute> route = emergencyResponseService.selectPreferredEvacuationRoute(id);
        if (route.isPresent()) {
            return ResponseEntity.ok(route.get());
        }
        return emergencyResponseService.evacuationRouteExists(id)
                ? conflict("Route is blocked: " + id)
                : notFound("Route not found: " + id);
    }

    @PutMapping("/{id}/clearance")
    public ResponseEntity<?> setClearance(@PathVariable String id, @Valid @RequestBody RouteClearanceDTO body) {
        if (!emergencyResponseService.setEvacuationRouteClearance(id, body.getClearance())) {
            return notFound("Route not found: " + id);
        }
        return ResponseEntity.ok(Map.of("routeId", id, "clearance", body.getClearance()));
    }
}
