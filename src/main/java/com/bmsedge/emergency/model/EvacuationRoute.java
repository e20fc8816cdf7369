package com.bmsedge.emergency.model;

import lombok.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvacuationRoute {

    private String id;
    private String name;
    private String description;

    @Builder.Default
    private List<String> steps = new ArrayList<>();

    private boolean clearance;        // False when blocked
    private boolean lighting;
    private boolean accessible;
    private int estimatedSeconds;
    private String assemblyPoint;
    private Integer floor;

    @Builder.Default
    private List<String> obstacles = new ArrayList<>();

    private LocalDate lastInspected;
}
