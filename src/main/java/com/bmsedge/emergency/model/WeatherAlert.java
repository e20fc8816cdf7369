package com.bmsedge.emergency.model;

import lombok.*;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WeatherAlert {

    private String id;
    private String type;              // storm / heavy_snow / extreme_cold / flooding / high_winds
    private int severity;
    private String message;
    private String region;
    private boolean active;
    private LocalDateTime issuedAt;
    private LocalDateTime clearedAt;
}
