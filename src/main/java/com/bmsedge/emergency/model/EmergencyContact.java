package com.bmsedge.emergency.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmergencyContact {

    private String id;
    private String name;
    private String number;
    private String type;              // emergency / police / fire / medical / family / neighbor / ...
    private int priority;             // Lower is contacted first
    private boolean autoCall;
}
