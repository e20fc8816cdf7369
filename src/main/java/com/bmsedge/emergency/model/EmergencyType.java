package com.bmsedge.emergency.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class EmergencyType {

    String id;
    String label;
    int baseSeverity;                 // 1-5
    String colorCode;                 // Display colour
    String emergencyNumber;           // Null when no external service is called

    @Singular("responseStep")
    List<ProtocolStep> responseProtocol;

    @Singular
    List<String> recoverySteps;
}
