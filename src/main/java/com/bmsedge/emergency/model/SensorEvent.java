package com.bmsedge.emergency.model;

import lombok.*;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SensorEvent {

    private String sensorId;
    private String sensorType;
    private String location;
    private Integer floor;
    private String eventType;         // smoke / heat / water / motion / glass_break / ...
    private Map<String, Object> payload;
    private LocalDateTime timestamp;
}
