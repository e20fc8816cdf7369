package com.bmsedge.emergency.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class CorrelationMatch {

    String ruleId;
    String emergencyTypeId;
    String reason;
    Map<String, Object> details;
    List<SensorEvent> consumedEvents;
}
