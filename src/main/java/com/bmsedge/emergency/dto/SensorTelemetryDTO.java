package com.bmsedge.emergency.dto;

import com.bmsedge.emergency.model.enums.SensorStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensorTelemetryDTO {

    @Min(0)
    @Max(100)
    private Double battery;

    private SensorStatus status;
}
