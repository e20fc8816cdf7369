package com.bmsedge.emergency.dto;

import com.bmsedge.emergency.model.enums.SensorReportOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensorReportResultDTO {
    private String sensorId;
    private String eventType;
    private SensorReportOutcome outcome;
    private int bufferedEvents;
}
