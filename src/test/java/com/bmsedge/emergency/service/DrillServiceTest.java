package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.DrillResultDTO;
import com.bmsedge.emergency.model.Drill;
import com.bmsedge.emergency.model.DrillRun;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class DrillServiceTest {

    private EngineFixture fixture;
    private DrillService service;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        service = fixture.drillService;
    }

    @Test
    void shouldRecordRunAndRescheduleByFrequency() {
        DrillRun run = service.recordRun("fire_drill", new DrillResultDTO(91, 60)).orElseThrow();

        Drill drill = fixture.drillRepository.findById("fire_drill").orElseThrow();
        assertThat(run.getId()).isEqualTo("drill_run_1");
        assertThat(drill.getLastPerformed()).isEqualTo(LocalDate.of(2026, 3, 10));
        assertThat(drill.getNextScheduled()).isEqualTo(LocalDate.of(2026, 6, 8));
        assertThat(drill.getLastScore()).isEqualTo(91);
        assertThat(drill.getBestScore()).isEqualTo(91);
        assertThat(drill.getAverageEvacuationSeconds()).isEqualTo(64);
        assertThat(service.getRuns()).containsExactly(run);
        assertThat(fixture.publisher.count(NotificationType.DRILL_COMPLETED)).isEqualTo(1);
    }

    @Test
    void shouldKeepBestScoreOnWorseRun() {
        service.recordRun("earthquake_drill", new DrillResultDTO(40, 120));

        assertThat(fixture.drillRepository.findById("earthquake_drill").get().getBestScore()).isEqualTo(78);
    }

    @Test
    void shouldRejectUnknownDrill() {
        assertThat(service.recordRun("tsunami_drill", new DrillResultDTO(50, 50))).isEmpty();
    }

    @Test
    void shouldRemindAboutDrillDueWithinAWeek() {
        // fire_drill is due 2026-03-15, five days out
        assertThat(service.checkSchedule()).isEqualTo(1);
        assertThat(fixture.publisher.count(NotificationType.DRILL_REMINDER)).isEqualTo(1);
    }

    @Test
    void shouldFlagOverdueDrill() {
        fixture.drillRepository.findById("intruder_drill").get().setNextScheduled(LocalDate.of(2026, 3, 10));

        service.checkSchedule();

        assertThat(fixture.publisher.count(NotificationType.DRILL_OVERDUE)).isEqualTo(1);
    }
}
