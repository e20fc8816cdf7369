package com.bmsedge.emergency.service;

import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.WellbeingCheck;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.model.enums.WellbeingStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Post-incident occupant check-ins. Checks move from pending to completed
 * on response and are never deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WellbeingScheduler {

    private static final String DEFAULT_PERSON = "All household members";

    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    @Value("${emergency.wellbeing.check-interval-minutes:30}")
    private long checkIntervalMinutes = 30;

    private final List<WellbeingCheck> pending = new ArrayList<>();
    private final List<WellbeingCheck> completed = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    public WellbeingCheck schedule(Incident incident) {
        WellbeingCheck check = WellbeingCheck.builder()
                .id("wellbeing_" + sequence.incrementAndGet())
                .incidentId(incident.getId())
                .emergencyType(incident.getTypeId())
                .person(DEFAULT_PERSON)
                .scheduledAt(LocalDateTime.now(clock))
                .status(WellbeingStatus.PENDING)
                .build();
        pending.add(check);
        log.info("Wellbeing check {} scheduled after {}", check.getId(), incident.getLabel());

        Map<String, Object> payload = new HashMap<>();
        payload.put("checkId", check.getId());
        payload.put("incidentId", incident.getId());
        notificationPublisher.publish(NotificationType.WELLBEING_CHECK_SCHEDULED, payload);
        return check;
    }

    /**
     * @return false for an unknown or already answered check id
     */
    public boolean respond(String checkId, String response) {
        Iterator<WellbeingCheck> it = pending.iterator();
        while (it.hasNext()) {
            WellbeingCheck check = it.next();
            if (check.getId().equals(checkId)) {
                it.remove();
                check.setStatus(WellbeingStatus.COMPLETED);
                check.setResponse(response);
                check.setRespondedAt(LocalDateTime.now(clock));
                completed.add(check);
                log.info("Wellbeing check responded: {} - {}", checkId, response);
                return true;
            }
        }
        log.error("❌ Wellbeing check not found: {}", checkId);
        return false;
    }

    /**
     * Escalates pending checks that have waited longer than the check
     * interval. Each check escalates once.
     *
     * @return checks escalated by this call
     */
    public List<WellbeingCheck> processOverdue() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<WellbeingCheck> escalated = new ArrayList<>();
        for (WellbeingCheck check : pending) {
            if (check.isEscalated()) {
                continue;
            }
            if (Duration.between(check.getScheduledAt(), now).compareTo(Duration.ofMinutes(checkIntervalMinutes)) > 0) {
                check.setEscalated(true);
                escalated.add(check);
                log.warn("⚠️ Wellbeing check overdue for: {} ({})", check.getPerson(), check.getId());

                Map<String, Object> payload = new HashMap<>();
                payload.put("checkId", check.getId());
                payload.put("person", check.getPerson());
                payload.put("scheduledAt", check.getScheduledAt());
                notificationPublisher.publish(NotificationType.WELLBEING_CHECK_OVERDUE, payload);
            }
        }
        return escalated;
    }

    public List<WellbeingCheck> getPending() {
        return new ArrayList<>(pending);
    }

    public List<WellbeingCheck> getCompleted() {
        return new ArrayList<>(completed);
    }
}
