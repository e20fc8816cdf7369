package com.bmsedge.emergency.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensorEventDTO {

    @NotBlank(message = "Event type is required")
    private String eventType;

    private Map<String, Object> payload;
}
