package com.bmsedge.emergency.model;

import lombok.*;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IncidentUpdate {

    private String reason;
    private Map<String, Object> details;
    private LocalDateTime timestamp;
}
