package com.bmsedge.emergency.model;

import com.bmsedge.emergency.model.enums.LightStatus;
import lombok.*;

import java.util.LinkedHashSet;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmergencyLight {

    private String id;
    private String location;
    private Integer floor;
    private String type;
    private double batteryLevel;
    private LightStatus status;
    private boolean autoActivate;

    // Incident ids or "lockdown" currently keeping the light on
    @Builder.Default
    private Set<String> holders = new LinkedHashSet<>();
}
