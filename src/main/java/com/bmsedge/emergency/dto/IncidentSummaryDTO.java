package com.bmsedge.emergency.dto;

import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.enums.IncidentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentSummaryDTO {
    private String id;
    private String type;
    private String label;
    private int severity;
    private String colorCode;
    private IncidentStatus status;
    private String reason;
    private LocalDateTime triggeredAt;
    private LocalDateTime resolvedAt;
    private String resolution;
    private Long responseTimeMs;
    private int actionsExecuted;
    private int alertsSent;
    private int updates;

    public static IncidentSummaryDTO from(Incident incident) {
        return IncidentSummaryDTO.builder()
                .id(incident.getId())
                .type(incident.getTypeId())
                .label(incident.getLabel())
                .severity(incident.getSeverity())
                .colorCode(incident.getColorCode())
                .status(incident.getStatus())
                .reason(incident.getReason())
                .triggeredAt(incident.getTriggeredAt())
                .resolvedAt(incident.getResolvedAt())
                .resolution(incident.getResolution())
                .responseTimeMs(incident.getResponseTimeMs())
                .actionsExecuted(incident.getActionsExecuted().size())
                .alertsSent(incident.getAlertsSent().size())
                .updates(incident.getUpdates().size())
                .build();
    }
}
