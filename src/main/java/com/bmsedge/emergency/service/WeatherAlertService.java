package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.TriggerResult;
import com.bmsedge.emergency.dto.WeatherAlertDTO;
import com.bmsedge.emergency.model.WeatherAlert;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.repository.EmergencyTypeCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Weather alerts pushed by an external weather feed. Alerts of severity 3
 * and above open a storm incident.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WeatherAlertService {

    static final int INCIDENT_SEVERITY = 3;
    private static final int HISTORY_LIMIT = 20;

    private final IncidentLifecycleManager lifecycleManager;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    @Value("${emergency.weather.region:Stockholm}")
    private String defaultRegion = "Stockholm";

    private final List<WeatherAlert> alerts = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    public WeatherAlert issue(WeatherAlertDTO dto) {
        WeatherAlert alert = WeatherAlert.builder()
                .id("weather_" + sequence.incrementAndGet())
                .type(dto.getType())
                .severity(dto.getSeverity())
                .message(dto.getMessage())
                .region(dto.getRegion() != null ? dto.getRegion() : defaultRegion)
                .active(true)
                .issuedAt(LocalDateTime.now(clock))
                .build();
        alerts.add(alert);

        log.info("🌩️ Weather alert: {}", alert.getMessage());
        notificationPublisher.publish(NotificationType.WEATHER_ALERT, alert);

        if (alert.getSeverity() >= INCIDENT_SEVERITY) {
            Map<String, Object> details = new HashMap<>();
            details.put("weatherAlert", alert.getId());
            details.put("weatherType", alert.getType());
            details.put("region", alert.getRegion());
            TriggerResult result = lifecycleManager.trigger(EmergencyTypeCatalog.STORM,
                    "Weather service: " + alert.getMessage(), details);
            log.info("Weather alert {} → {}", alert.getId(), result.getOutcome());
        }
        return alert;
    }

    public Optional<WeatherAlert> clear(String alertId) {
        Optional<WeatherAlert> found = alerts.stream()
                .filter(a -> a.getId().equals(alertId) && a.isActive())
                .findFirst();
        if (found.isEmpty()) {
            log.error("❌ Active weather alert not found: {}", alertId);
            return Optional.empty();
        }
        found.get().setActive(false);
        found.get().setClearedAt(LocalDateTime.now(clock));
        log.info("Weather alert cleared: {}", alertId);
        return found;
    }

    public List<WeatherAlert> getActiveAlerts() {
        return alerts.stream().filter(WeatherAlert::isActive).collect(Collectors.toList());
    }

    // Most recent last
    public List<WeatherAlert> getHistory() {
        int from = Math.max(0, alerts.size() - HISTORY_LIMIT);
        return new ArrayList<>(alerts.subList(from, alerts.size()));
    }

    public String getRegion() {
        return defaultRegion;
    }
}
