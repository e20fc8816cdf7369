package com.bmsedge.emergency.repository;

import com.bmsedge.emergency.model.SensorRecord;
import com.bmsedge.emergency.model.enums.SensorStatus;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static catalog of emergency sensors with their trigger statistics.
 */
@Repository
public class SensorRegistry {

    private final Map<String, SensorRecord> sensors = new LinkedHashMap<>();

    public SensorRegistry() {
        register("smoke_detector_living", "smoke_detector", "Living Room", 1, 92, "high", "Fibaro FGSD-002");
        register("smoke_detector_kitchen", "smoke_detector", "Kitchen", 1, 88, "medium", "Fibaro FGSD-002");
        register("smoke_detector_bedroom", "smoke_detector", "Master Bedroom", 2, 95, "high", "Fibaro FGSD-002");
        register("smoke_detector_hallway", "smoke_detector", "Upstairs Hallway", 2, 90, "high", "Fibaro FGSD-002");
        register("co_detector_basement", "co_detector", "Basement", 0, 85, "high", "Fibaro FGCO-001");
        register("co_detector_garage", "co_detector", "Garage", 0, 78, "high", "Fibaro FGCO-001");
        register("flood_sensor_basement", "flood_sensor", "Basement Floor", 0, 91, "high", "Aeotec Water Sensor 7");
        register("flood_sensor_bathroom", "flood_sensor", "Main Bathroom", 1, 87, "medium", "Aeotec Water Sensor 7");
        register("flood_sensor_laundry", "flood_sensor", "Laundry Room", 1, 93, "medium", "Aeotec Water Sensor 7");
        register("motion_sensor_front", "motion_sensor", "Front Entrance", 1, 82, "high", "Philips Hue Motion");
        register("motion_sensor_back", "motion_sensor", "Back Entrance", 1, 79, "high", "Philips Hue Motion");
        register("motion_sensor_garage", "motion_sensor", "Garage", 0, 84, "medium", "Philips Hue Motion");
        register("motion_sensor_living", "motion_sensor", "Living Room", 1, 88, "low", "Philips Hue Motion");
        register("motion_sensor_upstairs", "motion_sensor", "Upstairs Landing", 2, 91, "medium", "Philips Hue Motion");
        register("glass_break_front", "glass_break_sensor", "Front Windows", 1, 94, "high", "Aeotec Glassbreak 7");
        register("glass_break_back", "glass_break_sensor", "Back Windows", 1, 89, "high", "Aeotec Glassbreak 7");
        register("glass_break_basement", "glass_break_sensor", "Basement Windows", 0, 86, "high", "Aeotec Glassbreak 7");
        register("gas_detector_kitchen", "gas_detector", "Kitchen", 1, 90, "high", "Fibaro Gas Sensor");
        register("gas_detector_utility", "gas_detector", "Utility Room", 0, 89, "high", "Fibaro Gas Sensor");
        register("temp_extreme_attic", "temperature_extreme", "Attic", 3, 83, "medium", "Aeotec MultiSensor 7");
        register("temp_extreme_basement", "temperature_extreme", "Basement", 0, 87, "medium", "Aeotec MultiSensor 7");
    }

    private void register(String id, String type, String location, int floor,
                          double battery, String sensitivity, String model) {
        sensors.put(id, SensorRecord.builder()
                .id(id)
                .type(type)
                .location(location)
                .floor(floor)
                .status(SensorStatus.ONLINE)
                .battery(battery)
                .sensitivity(sensitivity)
                .model(model)
                .build());
    }

    public Optional<SensorRecord> findById(String id) {
        return Optional.ofNullable(id == null ? null : sensors.get(id));
    }

    public List<SensorRecord> findAll() {
        return new ArrayList<>(sensors.values());
    }

    // Accepted event: count it and bring the sensor back online
    public void recordTrigger(SensorRecord sensor, LocalDateTime at) {
        sensor.setTriggerCount(sensor.getTriggerCount() + 1);
        sensor.setLastTriggered(at);
        sensor.setStatus(SensorStatus.ONLINE);
    }

    public long countByStatus(SensorStatus status) {
        return sensors.values().stream().filter(s -> s.getStatus() == status).count();
    }

    public int size() {
        return sensors.size();
    }
}
