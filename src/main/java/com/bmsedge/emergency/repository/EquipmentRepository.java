package com.bmsedge.emergency.repository;

import com.bmsedge.emergency.model.EmergencyEquipment;
import com.bmsedge.emergency.model.enums.EquipmentStatus;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class EquipmentRepository {

    private final Map<String, EmergencyEquipment> equipment = new LinkedHashMap<>();

    public EquipmentRepository() {
        add("first_aid_main", "First Aid Kit (Main)", "first_aid", "Kitchen cabinet", 1,
                LocalDate.of(2026, 1, 20), LocalDate.of(2027, 6, 15), null);
        add("first_aid_car", "First Aid Kit (Car)", "first_aid", "Car trunk", 0,
                LocalDate.of(2026, 1, 10), LocalDate.of(2027, 3, 1), null);
        add("fire_ext_kitchen", "Fire Extinguisher (Kitchen)", "fire_extinguisher", "Kitchen wall mount", 1,
                LocalDate.of(2025, 12, 1), LocalDate.of(2027, 12, 1), null);
        add("fire_ext_garage", "Fire Extinguisher (Garage)", "fire_extinguisher", "Garage wall mount", 0,
                LocalDate.of(2025, 12, 1), LocalDate.of(2027, 12, 1), null);
        add("fire_ext_upstairs", "Fire Extinguisher (Upstairs)", "fire_extinguisher", "Upstairs hallway", 2,
                LocalDate.of(2025, 12, 1), LocalDate.of(2028, 6, 1), null);
        add("flashlight_main", "Flashlight (Main)", "flashlight", "Front hallway drawer", 1,
                LocalDate.of(2026, 1, 5), null, 95.0);
        add("flashlight_bedroom", "Flashlight (Bedroom)", "flashlight", "Bedside drawer", 2,
                LocalDate.of(2026, 1, 5), null, 80.0);
        add("flashlight_basement", "Flashlight (Basement)", "flashlight", "Basement shelf", 0,
                LocalDate.of(2026, 1, 5), null, 70.0);
        add("emergency_radio", "Emergency Radio", "emergency_radio", "Living room shelf", 1,
                LocalDate.of(2026, 1, 10), null, 100.0);
        add("blanket_emergency", "Emergency Blanket Pack (4)", "emergency_blanket", "Safe room", 0,
                LocalDate.of(2026, 1, 1), LocalDate.of(2030, 1, 1), null);
    }

    private void add(String id, String name, String type, String location, int floor,
                     LocalDate lastInspected, LocalDate expiry, Double battery) {
        equipment.put(id, EmergencyEquipment.builder()
                .id(id).name(name).type(type).location(location).floor(floor)
                .lastInspected(lastInspected).expiryDate(expiry)
                .status(EquipmentStatus.GOOD).batteryLevel(battery)
                .build());
    }

    public List<EmergencyEquipment> findAll() {
        return new ArrayList<>(equipment.values());
    }

    public Optional<EmergencyEquipment> findById(String id) {
        return Optional.ofNullable(id == null ? null : equipment.get(id));
    }
}
