package com.bmsedge.emergency.model;

import com.bmsedge.emergency.model.enums.CorrelationPredicate;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CorrelationRule {

    String id;
    String emergencyTypeId;
    CorrelationPredicate predicate;

    @Singular
    List<SensorTrigger> triggers;     // SET_OF_TYPES: all required; COUNT_THRESHOLD: first entry only

    int minDistinctSensors;           // Only read for COUNT_THRESHOLD
    String reason;
}
