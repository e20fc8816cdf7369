package com.bmsedge.emergency.repository;

import com.bmsedge.emergency.model.EvacuationRoute;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class EvacuationRouteRepository {

    private final List<EvacuationRoute> routes = new ArrayList<>();

    public EvacuationRouteRepository() {
        routes.add(EvacuationRoute.builder()
                .id("front_door").name("Front Door Route")
                .description("Main entrance through front hallway")
                .steps(List.of("Exit room to hallway", "Proceed to front entrance",
                        "Exit through front door", "Gather at front lawn assembly point"))
                .clearance(true).lighting(true).accessible(true)
                .estimatedSeconds(45).assemblyPoint("Front lawn by mailbox").floor(1)
                .lastInspected(LocalDate.of(2026, 1, 15))
                .build());
        routes.add(EvacuationRoute.builder()
                .id("back_door").name("Back Door Route")
                .description("Rear exit through kitchen to garden")
                .steps(List.of("Exit room toward kitchen", "Proceed through kitchen to back door",
                        "Exit to garden", "Move to rear assembly point"))
                .clearance(true).lighting(true).accessible(true)
                .estimatedSeconds(55).assemblyPoint("Back garden by shed").floor(1)
                .lastInspected(LocalDate.of(2026, 1, 15))
                .build());
        routes.add(EvacuationRoute.builder()
                .id("garage_exit").name("Garage Exit Route")
                .description("Exit through garage side door")
                .steps(List.of("Proceed to garage", "Exit through garage side door",
                        "Move to driveway", "Gather at street assembly point"))
                .clearance(true).lighting(false).accessible(false)
                .estimatedSeconds(60).assemblyPoint("Driveway near street").floor(0)
                .obstacles(List.of("Parked vehicles may block path"))
                .lastInspected(LocalDate.of(2026, 1, 10))
                .build());
    }

    public List<EvacuationRoute> findAll() {
        return new ArrayList<>(routes);
    }

    public Optional<EvacuationRoute> findById(String id) {
        return routes.stream().filter(r -> r.getId().equals(id)).findFirst();
    }
}
