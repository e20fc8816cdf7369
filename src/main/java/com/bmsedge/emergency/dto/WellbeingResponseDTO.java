package com.bmsedge.emergency.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WellbeingResponseDTO {

    @NotBlank(message = "Response is required")
    private String response;
}
