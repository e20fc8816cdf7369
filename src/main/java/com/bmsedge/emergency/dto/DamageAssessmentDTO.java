package com.bmsedge.emergency.dto;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DamageAssessmentDTO {
    private String assessor;
    private String severity;          // minor / moderate / severe
    private List<String> areas;

    @Min(value = 0, message = "Estimated cost cannot be negative")
    private Double estimatedCost;

    private Boolean insuranceClaim;
    private Boolean professionalNeeded;
    private Boolean habitable;

    @Min(value = 0, message = "Photo count cannot be negative")
    private Integer photos;

    private String notes;
}
