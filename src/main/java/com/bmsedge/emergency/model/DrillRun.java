package com.bmsedge.emergency.model;

import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DrillRun {

    private String id;
    private String drillId;
    private String name;
    private LocalDateTime recordedAt;
    private int score;
    private int evacuationSeconds;

    @Builder.Default
    private List<String> stepsCompleted = new ArrayList<>();

    private LocalDate nextScheduled;
}
