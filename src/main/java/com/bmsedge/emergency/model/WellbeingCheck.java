package com.bmsedge.emergency.model;

import com.bmsedge.emergency.model.enums.WellbeingStatus;
import lombok.*;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WellbeingCheck {

    private String id;
    private String incidentId;
    private String emergencyType;
    private String person;
    private LocalDateTime scheduledAt;
    private WellbeingStatus status;
    private String response;
    private LocalDateTime respondedAt;
    private boolean escalated;
}
