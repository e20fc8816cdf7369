package com.bmsedge.emergency.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveRequestDTO {
    private String resolution;        // Defaults to "Manually resolved"
}
