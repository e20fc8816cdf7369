package com.bmsedge.emergency.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeatherAlertDTO {

    @NotBlank(message = "Type is required")
    private String type;

    @NotNull(message = "Severity is required")
    @Min(1)
    @Max(5)
    private Integer severity;

    @NotBlank(message = "Message is required")
    private String message;

    private String region;
}
