package com.bmsedge.emergency.model;

import com.bmsedge.emergency.model.enums.PowerUnitStatus;
import com.bmsedge.emergency.model.enums.PowerUnitType;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PowerBackupUnit {

    private String id;
    private String name;
    private PowerUnitType type;
    private PowerUnitStatus status;
    private double level;             // Battery percent, or fuel percent for the generator
    private int runtimeMinutes;       // Runtime at 100 %
    private int maxLoadWatts;
    private boolean autoStart;        // Generator only
    private String fuelType;          // Generator only
    private String model;

    public int estimatedRuntimeMinutes() {
        return (int) Math.round(runtimeMinutes * level / 100.0);
    }
}
