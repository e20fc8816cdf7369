package com.bmsedge.emergency.dto;

import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.RecoveryPlan;
import com.bmsedge.emergency.model.WellbeingCheck;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionResult {
    private Incident incident;
    private RecoveryPlan recoveryPlan;    // Null when the type has no recovery steps
    private WellbeingCheck wellbeingCheck;
}
