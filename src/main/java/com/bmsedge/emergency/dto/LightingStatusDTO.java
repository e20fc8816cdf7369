package com.bmsedge.emergency.dto;

import com.bmsedge.emergency.model.EmergencyLight;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LightingStatusDTO {
    private int totalLights;
    private long readyCount;          // READY or ACTIVE
    private long activeCount;
    private long lowBatteryCount;
    private int coveragePercent;
    private boolean lockdownActive;
    private String lockdownReason;
    private LocalDateTime lockdownSince;
    private boolean panicActive;
    private String panicSource;
    private LocalDateTime panicSince;
    private List<EmergencyLight> lights;
}
