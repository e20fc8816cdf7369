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
public class TriggerRequestDTO {

    @NotBlank(message = "Emergency type is required")
    private String type;

    @NotBlank(message = "Reason is required")
    private String reason;

    private Map<String, Object> details;
}
