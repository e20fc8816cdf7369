package com.bmsedge.emergency.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteClearanceDTO {

    @NotNull(message = "Clearance is required")
    private Boolean clearance;
}
