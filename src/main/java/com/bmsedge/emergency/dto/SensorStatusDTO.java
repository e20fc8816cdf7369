package com.bmsedge.emergency.dto;

import com.bmsedge.emergency.model.SensorRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensorStatusDTO {
    private int totalSensors;
    private long onlineCount;
    private long offlineCount;
    private long lowBatteryCount;
    private int healthPercent;
    private Map<String, TypeSummary> byType;
    private List<SensorRecord> sensors;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TypeSummary {
        private int total;
        private int online;
        private long avgBattery;
    }
}
