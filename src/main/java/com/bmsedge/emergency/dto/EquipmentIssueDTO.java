package com.bmsedge.emergency.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EquipmentIssueDTO {
    private String id;
    private String name;
    private String issue;             // expired / expiring_soon / low_battery
    private Long days;                // Days overdue or remaining
    private Double batteryLevel;
}
