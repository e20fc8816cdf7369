package com.bmsedge.emergency.repository;

import com.bmsedge.emergency.model.Drill;
import com.bmsedge.emergency.model.enums.DrillFrequency;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class DrillRepository {

    private final Map<String, Drill> drills = new LinkedHashMap<>();

    public DrillRepository() {
        drills.put("fire_drill", Drill.builder()
                .id("fire_drill").type(EmergencyTypeCatalog.FIRE).name("Fire Evacuation Drill")
                .frequency(DrillFrequency.QUARTERLY)
                .lastPerformed(LocalDate.of(2025, 12, 15)).nextScheduled(LocalDate.of(2026, 3, 15))
                .bestScore(85).lastScore(82).averageEvacuationSeconds(68)
                .procedure(List.of("Alarm sounds", "Drop everything and proceed to nearest exit",
                        "Follow evacuation route signs", "Meet at assembly point",
                        "Account for all members", "Record evacuation time"))
                .build());
        drills.put("earthquake_drill", Drill.builder()
                .id("earthquake_drill").type(EmergencyTypeCatalog.EARTHQUAKE).name("Earthquake Safety Drill")
                .frequency(DrillFrequency.BIANNUAL)
                .lastPerformed(LocalDate.of(2025, 10, 20)).nextScheduled(LocalDate.of(2026, 4, 20))
                .bestScore(78).lastScore(75).averageEvacuationSeconds(90)
                .procedure(List.of("Alarm sounds with earthquake warning", "DROP to hands and knees",
                        "Take COVER under sturdy furniture", "HOLD ON until shaking stops",
                        "When safe evacuate building", "Meet at assembly point"))
                .build());
        drills.put("intruder_drill", Drill.builder()
                .id("intruder_drill").type(EmergencyTypeCatalog.INTRUDER).name("Intruder Alert Drill")
                .frequency(DrillFrequency.BIANNUAL)
                .lastPerformed(LocalDate.of(2025, 11, 10)).nextScheduled(LocalDate.of(2026, 5, 10))
                .bestScore(80).lastScore(77).averageEvacuationSeconds(40)
                .procedure(List.of("Silent alarm triggers", "Proceed to safe room quietly",
                        "Lock safe room door", "Call police from safe room",
                        "Wait for all-clear signal", "Do not confront intruder"))
                .build());
    }

    public List<Drill> findAll() {
        return new ArrayList<>(drills.values());
    }

    public Optional<Drill> findById(String id) {
        return Optional.ofNullable(id == null ? null : drills.get(id));
    }
}
