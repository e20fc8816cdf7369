package com.bmsedge.emergency.dto;

import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.enums.TriggerOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerResult {
    private TriggerOutcome outcome;
    private Incident incident;        // Null for UNKNOWN_TYPE

    public static TriggerResult unknownType() {
        return new TriggerResult(TriggerOutcome.UNKNOWN_TYPE, null);
    }

    public boolean isCreated() {
        return outcome == TriggerOutcome.CREATED;
    }
}
