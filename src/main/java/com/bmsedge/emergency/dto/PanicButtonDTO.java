package com.bmsedge.emergency.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PanicButtonDTO {
    private String source;            // wall_panel / mobile_app / keyfob ...
    private Map<String, Object> details;
}
