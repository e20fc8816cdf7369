package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.DrillResultDTO;
import com.bmsedge.emergency.model.Drill;
import com.bmsedge.emergency.model.DrillRun;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.repository.DrillRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drill schedule and results. Runs are recorded with the score and time
 * measured by whoever ran the drill.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DrillService {

    static final int REMINDER_DAYS = 7;

    private final DrillRepository drillRepository;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    private final List<DrillRun> runs = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    public List<Drill> getSchedule() {
        return drillRepository.findAll();
    }

    public Optional<DrillRun> recordRun(String drillId, DrillResultDTO result) {
        Optional<Drill> found = drillRepository.findById(drillId);
        if (found.isEmpty()) {
            log.error("❌ Unknown drill: {}", drillId);
            return Optional.empty();
        }
        Drill drill = found.get();
        LocalDate today = LocalDate.now(clock);

        drill.setLastPerformed(today);
        drill.setLastScore(result.getScore());
        if (result.getScore() > drill.getBestScore()) {
            drill.setBestScore(result.getScore());
        }
        drill.setAverageEvacuationSeconds(
                Math.round((drill.getAverageEvacuationSeconds() + result.getEvacuationSeconds()) / 2.0f));
        drill.setNextScheduled(today.plusDays(drill.getFrequency().getIntervalDays()));

        DrillRun run = DrillRun.builder()
                .id("drill_run_" + sequence.incrementAndGet())
                .drillId(drillId)
                .name(drill.getName())
                .recordedAt(LocalDateTime.now(clock))
                .score(result.getScore())
                .evacuationSeconds(result.getEvacuationSeconds())
                .stepsCompleted(new ArrayList<>(drill.getProcedure()))
                .nextScheduled(drill.getNextScheduled())
                .build();
        runs.add(run);

        log.info("Drill completed: {} - Score: {}, Time: {}s", drill.getName(), run.getScore(), run.getEvacuationSeconds());
        notificationPublisher.publish(NotificationType.DRILL_COMPLETED, run);
        return Optional.of(run);
    }

    /**
     * Publishes a reminder for drills due within a week and an overdue notice
     * for drills whose date has passed.
     *
     * @return number of notifications published
     */
    public int checkSchedule() {
        LocalDate today = LocalDate.now(clock);
        int published = 0;
        for (Drill drill : drillRepository.findAll()) {
            long daysUntil = ChronoUnit.DAYS.between(today, drill.getNextScheduled());
            Map<String, Object> payload = new HashMap<>();
            payload.put("drill", drill.getName());
            payload.put("type", drill.getType());
            payload.put("scheduledDate", drill.getNextScheduled());

            if (daysUntil > 0 && daysUntil <= REMINDER_DAYS) {
                log.info("Drill reminder: {} in {} days", drill.getName(), daysUntil);
                payload.put("daysUntil", daysUntil);
                notificationPublisher.publish(NotificationType.DRILL_REMINDER, payload);
                published++;
            } else if (daysUntil <= 0) {
                log.warn("Drill overdue: {}", drill.getName());
                notificationPublisher.publish(NotificationType.DRILL_OVERDUE, payload);
                published++;
            }
        }
        return published;
    }

    public List<DrillRun> getRuns() {
        return new ArrayList<>(runs);
    }

    public int averageLastScore() {
        List<Drill> drills = drillRepository.findAll();
        if (drills.isEmpty()) {
            return 0;
        }
        return (int) Math.round(drills.stream().mapToInt(Drill::getLastScore).average().orElse(0));
    }
}
