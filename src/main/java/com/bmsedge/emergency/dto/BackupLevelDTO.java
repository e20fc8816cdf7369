package com.bmsedge.emergency.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BackupLevelDTO {

    @NotNull(message = "Level is required")
    @Min(0)
    @Max(100)
    private Double level;
}
