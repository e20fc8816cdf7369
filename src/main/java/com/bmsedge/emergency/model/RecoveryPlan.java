package com.bmsedge.emergency.model;

import com.bmsedge.emergency.model.enums.RecoveryStatus;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecoveryPlan {

    private String incidentId;
    private String typeId;

    @Builder.Default
    private List<RecoveryStep> steps = new ArrayList<>();

    private RecoveryStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;
}
