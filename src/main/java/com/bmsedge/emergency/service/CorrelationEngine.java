package com.bmsedge.emergency.service;

import com.bmsedge.emergency.model.CorrelationMatch;
import com.bmsedge.emergency.model.CorrelationRule;
import com.bmsedge.emergency.model.SensorEvent;
import com.bmsedge.emergency.model.SensorRecord;
import com.bmsedge.emergency.model.SensorTrigger;
import com.bmsedge.emergency.model.enums.CorrelationPredicate;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.model.enums.SensorReportOutcome;
import com.bmsedge.emergency.repository.CorrelationRuleRepository;
import com.bmsedge.emergency.repository.SensorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Time-bounded buffer of raw sensor events. Reports are appended as they
 * arrive; {@link #tick()} prunes stale events and scans what is left against
 * the correlation rules. Events used by a match are removed so the same
 * pattern never fires twice.
 *
 * Not thread-safe on its own: callers serialize access.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CorrelationEngine {

    private final SensorRegistry sensorRegistry;
    private final CorrelationRuleRepository ruleRepository;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    @Value("${emergency.correlation.window-ms:30000}")
    private long windowMs = 30000;

    private final List<SensorEvent> buffer = new ArrayList<>();
    private LocalDateTime lastTimestamp;

    public SensorReportOutcome report(String sensorId, String eventType, Map<String, Object> payload) {
        Optional<SensorRecord> found = sensorRegistry.findById(sensorId);
        if (found.isEmpty()) {
            log.error("❌ Unknown sensor: {}", sensorId);
            return SensorReportOutcome.UNKNOWN_SENSOR;
        }

        SensorRecord sensor = found.get();
        LocalDateTime now = nextTimestamp();
        sensorRegistry.recordTrigger(sensor, now);

        SensorEvent event = SensorEvent.builder()
                .sensorId(sensor.getId())
                .sensorType(sensor.getType())
                .location(sensor.getLocation())
                .floor(sensor.getFloor())
                .eventType(eventType)
                .payload(payload != null ? payload : new HashMap<>())
                .timestamp(now)
                .build();
        buffer.add(event);

        log.info("Sensor event: {} at {} - {}", sensor.getType(), sensor.getLocation(), eventType);

        long recentSameType = buffer.stream()
                .filter(e -> e.getSensorType().equals(sensor.getType()))
                .filter(e -> withinWindow(e, now))
                .count();

        if (recentSameType == 1) {
            log.warn("⚠️ Single {} trigger at {} - monitoring for confirmation",
                    sensor.getType(), sensor.getLocation());
            Map<String, Object> warning = new HashMap<>();
            warning.put("sensorId", sensor.getId());
            warning.put("type", sensor.getType());
            warning.put("location", sensor.getLocation());
            warning.put("eventType", eventType);
            warning.put("message", "Single sensor triggered - monitoring for confirmation");
            notificationPublisher.publish(NotificationType.SENSOR_WARNING, warning);
            return SensorReportOutcome.WARNING;
        }
        return SensorReportOutcome.ACCEPTED;
    }

    public List<CorrelationMatch> tick() {
        LocalDateTime now = LocalDateTime.now(clock);
        int pruned = prune(now);
        if (pruned > 0) {
            log.debug("Pruned {} stale sensor events", pruned);
        }

        List<CorrelationMatch> matches = new ArrayList<>();
        for (CorrelationRule rule : ruleRepository.findAll()) {
            List<SensorEvent> used = evaluate(rule);
            if (used.isEmpty()) {
                continue;
            }
            buffer.removeAll(used);
            log.info("🔗 Correlation {} → {}", rule.getId(), rule.getEmergencyTypeId());
            matches.add(CorrelationMatch.builder()
                    .ruleId(rule.getId())
                    .emergencyTypeId(rule.getEmergencyTypeId())
                    .reason(rule.getReason())
                    .details(describe(used))
                    .consumedEvents(used)
                    .build());
        }
        return matches;
    }

    // Empty when the rule does not match; otherwise every buffered event of the rule's sensor types
    private List<SensorEvent> evaluate(CorrelationRule rule) {
        List<SensorTrigger> triggers = rule.getTriggers();
        if (triggers.isEmpty()) {
            return List.of();
        }

        if (rule.getPredicate() == CorrelationPredicate.COUNT_THRESHOLD) {
            SensorTrigger trigger = triggers.get(0);
            List<SensorEvent> matching = buffer.stream()
                    .filter(trigger::matches)
                    .collect(Collectors.toList());
            long distinctSensors = matching.stream().map(SensorEvent::getSensorId).distinct().count();
            return distinctSensors >= rule.getMinDistinctSensors() ? matching : List.of();
        }

        for (SensorTrigger trigger : triggers) {
            if (buffer.stream().noneMatch(trigger::matches)) {
                return List.of();
            }
        }
        return buffer.stream()
                .filter(e -> triggers.stream().anyMatch(t -> t.matches(e)))
                .collect(Collectors.toList());
    }

    private Map<String, Object> describe(List<SensorEvent> events) {
        Set<String> sensors = new LinkedHashSet<>();
        Set<String> locations = new LinkedHashSet<>();
        for (SensorEvent e : events) {
            sensors.add(e.getSensorId());
            locations.add(e.getLocation());
        }
        Map<String, Object> details = new HashMap<>();
        details.put("sensors", new ArrayList<>(sensors));
        details.put("locations", new ArrayList<>(locations));
        details.put("confirmedBy", sensors.size() + " sensors");
        return details;
    }

    private int prune(LocalDateTime now) {
        int before = buffer.size();
        buffer.removeIf(e -> !withinWindow(e, now));
        return before - buffer.size();
    }

    private boolean withinWindow(SensorEvent event, LocalDateTime now) {
        return Duration.between(event.getTimestamp(), now).toMillis() < windowMs;
    }

    // Insertion timestamps never go backwards, even if the clock does
    private LocalDateTime nextTimestamp() {
        LocalDateTime now = LocalDateTime.now(clock);
        if (lastTimestamp != null && now.isBefore(lastTimestamp)) {
            now = lastTimestamp;
        }
        lastTimestamp = now;
        return now;
    }

    public List<SensorEvent> getBufferedEvents() {
        return new ArrayList<>(buffer);
    }

    public int bufferSize() {
        return buffer.size();
    }

    public long getWindowMs() {
        return windowMs;
    }

    public void clear() {
        buffer.clear();
    }
}
