package com.bmsedge.emergency.model;

import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DamageReport {

    private String id;
    private String incidentId;
    private String emergencyType;
    private LocalDateTime assessedAt;
    private String assessor;
    private String overallSeverity;   // minor / moderate / severe / unknown

    @Builder.Default
    private List<String> areas = new ArrayList<>();

    private double estimatedCost;
    private boolean insuranceClaim;
    private boolean professionalNeeded;
    private boolean habitable;
    private int photos;
    private String notes;
}
