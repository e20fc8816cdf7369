package com.bmsedge.emergency.model;

import com.bmsedge.emergency.model.enums.SensorStatus;
import lombok.*;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SensorRecord {

    private String id;
    private String type;              // smoke_detector / co_detector / flood_sensor / motion_sensor / ...
    private String location;          // Room or zone name
    private Integer floor;            // 0 = basement
    private SensorStatus status;
    private Double battery;           // Percent
    private String sensitivity;       // low / medium / high
    private String model;
    private LocalDateTime lastTest;
    private LocalDateTime lastTriggered;

    @Builder.Default
    private long triggerCount = 0;    // Never decremented
}
