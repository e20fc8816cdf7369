package com.bmsedge.emergency.model;

import com.bmsedge.emergency.model.enums.RecoveryStatus;
import lombok.*;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecoveryStep {

    private int step;
    private String description;
    private RecoveryStatus status;
    private LocalDateTime completedAt;
}
