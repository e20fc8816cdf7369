package com.bmsedge.emergency.repository;

import com.bmsedge.emergency.model.EmergencyLight;
import com.bmsedge.emergency.model.enums.LightStatus;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class EmergencyLightingRepository {

    private final List<EmergencyLight> lights = new ArrayList<>();

    public EmergencyLightingRepository() {
        lights.add(light("emlight_hallway1", "Front Hallway", 1, "LED emergency", 100));
        lights.add(light("emlight_hallway2", "Upstairs Hallway", 2, "LED emergency", 98));
        lights.add(light("emlight_stairs1", "Main Staircase", 1, "LED strip", 95));
        lights.add(light("emlight_basement", "Basement Corridor", 0, "LED emergency", 92));
        lights.add(light("emlight_garage", "Garage", 0, "LED emergency", 88));
        lights.add(light("emlight_kitchen", "Kitchen", 1, "LED under-cabinet", 97));
        lights.add(light("emlight_exit_front", "Front Door Exit Sign", 1, "Exit sign illuminated", 100));
        lights.add(light("emlight_exit_back", "Back Door Exit Sign", 1, "Exit sign illuminated", 100));
    }

    private static EmergencyLight light(String id, String location, int floor, String type, double battery) {
        return EmergencyLight.builder()
                .id(id)
                .location(location)
                .floor(floor)
                .type(type)
                .batteryLevel(battery)
                .status(LightStatus.READY)
                .autoActivate(true)
                .build();
    }

    public List<EmergencyLight> findAll() {
        return lights;
    }

    public Optional<EmergencyLight> findById(String id) {
        return lights.stream().filter(l -> l.getId().equals(id)).findFirst();
    }
}
