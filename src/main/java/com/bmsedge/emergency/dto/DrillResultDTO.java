package com.bmsedge.emergency.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DrillResultDTO {

    @NotNull(message = "Score is required")
    @Min(0)
    @Max(100)
    private Integer score;

    @NotNull(message = "Evacuation time is required")
    @Min(0)
    private Integer evacuationSeconds;
}
