package com.bmsedge.emergency.model;

import com.bmsedge.emergency.model.enums.AlertTemplate;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertChannel {

    private String id;
    private String name;
    private int priorityThreshold;    // Fires only when incident severity >= threshold
    private int delaySeconds;
    private boolean enabled;
    private AlertTemplate template;
}
