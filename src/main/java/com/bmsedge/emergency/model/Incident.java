package com.bmsedge.emergency.model;

import com.bmsedge.emergency.model.enums.IncidentStatus;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Incident {

    private String id;
    private String typeId;
    private String label;
    private String colorCode;
    private int severity;             // Fixed at creation from the type's base severity
    private IncidentStatus status;
    private String reason;            // Refreshed by deduplicated triggers
    private Map<String, Object> details;

    private LocalDateTime triggeredAt;
    private LocalDateTime loggedAt;
    private LocalDateTime resolvedAt;  // Set once, at resolution
    private String resolution;
    private Long responseTimeMs;       // Set once, at resolution

    @Builder.Default
    private List<ExecutedAction> actionsExecuted = new ArrayList<>();

    @Builder.Default
    private List<AlertRecord> alertsSent = new ArrayList<>();

    @Builder.Default
    private List<IncidentUpdate> updates = new ArrayList<>();

    @Builder.Default
    private Set<String> activatedLightIds = new LinkedHashSet<>();

    private DamageReport damageReport;

    public boolean isActive() {
        return status == IncidentStatus.ACTIVE;
    }
}
