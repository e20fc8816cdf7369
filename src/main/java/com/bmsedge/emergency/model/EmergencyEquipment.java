package com.bmsedge.emergency.model;

import com.bmsedge.emergency.model.enums.EquipmentStatus;
import lombok.*;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmergencyEquipment {

    private String id;
    private String name;
    private String type;              // first_aid / fire_extinguisher / flashlight / ...
    private String location;
    private Integer floor;
    private LocalDate lastInspected;
    private LocalDate expiryDate;     // Null when the item does not expire
    private EquipmentStatus status;
    private Double batteryLevel;      // Null for unpowered items
}
