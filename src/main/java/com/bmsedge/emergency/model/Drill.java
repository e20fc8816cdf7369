package com.bmsedge.emergency.model;

import com.bmsedge.emergency.model.enums.DrillFrequency;
import lombok.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Drill {

    private String id;
    private String type;              // Emergency type practised
    private String name;
    private DrillFrequency frequency;
    private LocalDate lastPerformed;
    private LocalDate nextScheduled;
    private int bestScore;
    private int lastScore;
    private int averageEvacuationSeconds;

    @Builder.Default
    private List<String> procedure = new ArrayList<>();
}
