package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.SensorStatusDTO;
import com.bmsedge.emergency.dto.SensorTelemetryDTO;
import com.bmsedge.emergency.model.SensorRecord;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.model.enums.SensorStatus;
import com.bmsedge.emergency.repository.SensorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Battery and connectivity of the registered sensors.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SensorHealthService {

    static final double LOW_BATTERY = 20;

    private final SensorRegistry sensorRegistry;
    private final NotificationPublisher notificationPublisher;

    public Optional<SensorRecord> updateTelemetry(String sensorId, SensorTelemetryDTO telemetry) {
        Optional<SensorRecord> found = sensorRegistry.findById(sensorId);
        if (found.isEmpty()) {
            log.error("❌ Unknown sensor: {}", sensorId);
            return Optional.empty();
        }
        SensorRecord sensor = found.get();
        if (telemetry.getBattery() != null) {
            sensor.setBattery(telemetry.getBattery());
        }
        if (telemetry.getStatus() != null) {
            sensor.setStatus(telemetry.getStatus());
        }
        return Optional.of(sensor);
    }

    /**
     * Publishes one health notification when any sensor is offline or low on battery.
     *
     * @return ids of the sensors with an issue
     */
    public List<String> check() {
        List<String> offline = new ArrayList<>();
        List<String> lowBattery = new ArrayList<>();
        for (SensorRecord sensor : sensorRegistry.findAll()) {
            if (sensor.getStatus() == SensorStatus.OFFLINE) {
                offline.add(sensor.getId());
            }
            if (sensor.getBattery() != null && sensor.getBattery() < LOW_BATTERY) {
                lowBattery.add(sensor.getId());
            }
        }

        if (offline.isEmpty() && lowBattery.isEmpty()) {
            return List.of();
        }
        log.warn("⚠️ Sensor health: {} offline, {} low battery", offline.size(), lowBattery.size());
        Map<String, Object> payload = new HashMap<>();
        payload.put("offline", offline);
        payload.put("lowBattery", lowBattery);
        notificationPublisher.publish(NotificationType.SENSOR_HEALTH, payload);

        List<String> issues = new ArrayList<>(offline);
        lowBattery.stream().filter(id -> !issues.contains(id)).forEach(issues::add);
        return issues;
    }

    public SensorStatusDTO getStatus() {
        List<SensorRecord> sensors = sensorRegistry.findAll();
        long online = sensorRegistry.countByStatus(SensorStatus.ONLINE);
        long offline = sensorRegistry.countByStatus(SensorStatus.OFFLINE);
        long lowBattery = sensors.stream()
                .filter(s -> s.getBattery() != null && s.getBattery() < LOW_BATTERY)
                .count();

        Map<String, SensorStatusDTO.TypeSummary> byType = new LinkedHashMap<>();
        Map<String, List<SensorRecord>> grouped = sensors.stream()
                .collect(Collectors.groupingBy(SensorRecord::getType, LinkedHashMap::new, Collectors.toList()));
        grouped.forEach((type, group) -> byType.put(type, new SensorStatusDTO.TypeSummary(
                group.size(),
                (int) group.stream().filter(s -> s.getStatus() == SensorStatus.ONLINE).count(),
                Math.round(group.stream().mapToDouble(s -> s.getBattery() != null ? s.getBattery() : 0).average().orElse(0)))));

        return SensorStatusDTO.builder()
                .totalSensors(sensors.size())
                .onlineCount(online)
                .offlineCount(offline)
                .lowBatteryCount(lowBattery)
                .healthPercent(sensors.isEmpty() ? 0 : (int) Math.round(online * 100.0 / sensors.size()))
                .byType(byType)
                .sensors(sensors)
                .build();
    }

    public int averageBattery() {
        return (int) Math.round(sensorRegistry.findAll().stream()
                .mapToDouble(s -> s.getBattery() != null ? s.getBattery() : 0)
                .average()
                .orElse(0));
    }
}
