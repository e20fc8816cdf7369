package com.bmsedge.emergency.model;

import com.bmsedge.emergency.model.enums.ActionStatus;
import com.bmsedge.emergency.model.enums.ProtocolActionKind;
import lombok.*;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExecutedAction {

    private int step;
    private ProtocolActionKind kind;
    private String action;            // Step description
    private ActionStatus status;
    private String detail;            // Outcome note or failure message
    private LocalDateTime executedAt;
}
