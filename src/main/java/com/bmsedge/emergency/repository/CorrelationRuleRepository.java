package com.bmsedge.emergency.repository;

import com.bmsedge.emergency.model.CorrelationRule;
import com.bmsedge.emergency.model.SensorTrigger;
import com.bmsedge.emergency.model.enums.CorrelationPredicate;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;

/**
 * Multi-sensor patterns, evaluated in declaration order on every correlation tick.
 */
@Repository
public class CorrelationRuleRepository {

    private final List<CorrelationRule> rules = List.of(
            CorrelationRule.builder()
                    .id("smoke_and_heat")
                    .emergencyTypeId(EmergencyTypeCatalog.FIRE)
                    .predicate(CorrelationPredicate.SET_OF_TYPES)
                    .trigger(SensorTrigger.anyEvent("smoke_detector"))
                    .trigger(SensorTrigger.anyEvent("temperature_extreme"))
                    .reason("Multi-sensor correlation: smoke and extreme heat detected")
                    .build(),
            CorrelationRule.builder()
                    .id("motion_and_glass_break")
                    .emergencyTypeId(EmergencyTypeCatalog.INTRUDER)
                    .predicate(CorrelationPredicate.SET_OF_TYPES)
                    .trigger(SensorTrigger.anyEvent("motion_sensor"))
                    .trigger(SensorTrigger.anyEvent("glass_break_sensor"))
                    .reason("Multi-sensor correlation: motion and glass break detected")
                    .build(),
            countRule("multiple_flood_sensors", EmergencyTypeCatalog.FLOOD, "flood_sensor",
                    "Multi-sensor correlation: multiple flood sensors triggered"),
            countRule("multiple_smoke_detectors", EmergencyTypeCatalog.FIRE, "smoke_detector",
                    "Multiple smoke detectors confirm fire"),
            countRule("multiple_co_detectors", EmergencyTypeCatalog.CARBON_MONOXIDE, "co_detector",
                    "Multiple CO detectors confirm carbon monoxide"),
            countRule("multiple_gas_detectors", EmergencyTypeCatalog.GAS_LEAK, "gas_detector",
                    "Multiple gas detectors confirm gas leak"),
            countRule("multiple_glass_break_sensors", EmergencyTypeCatalog.INTRUDER, "glass_break_sensor",
                    "Multiple glass break sensors confirm break-in")
    );

    private static CorrelationRule countRule(String id, String typeId, String sensorType, String reason) {
        return CorrelationRule.builder()
                .id(id)
                .emergencyTypeId(typeId)
                .predicate(CorrelationPredicate.COUNT_THRESHOLD)
                .trigger(SensorTrigger.anyEvent(sensorType))
                .minDistinctSensors(2)
                .reason(reason)
                .build();
    }

    public List<CorrelationRule> findAll() {
        return Collections.unmodifiableList(rules);
    }
}
