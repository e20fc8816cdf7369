package com.bmsedge.emergency.dto;

import com.bmsedge.emergency.model.PowerBackupUnit;
import com.bmsedge.emergency.model.enums.BackupOverallStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PowerBackupStatusDTO {
    private BackupOverallStatus overallStatus;
    private boolean mainsAvailable;
    private int totalEstimatedRuntimeMinutes;
    private List<PowerBackupUnit> units;
    private LocalDateTime generatorStartDue;      // Pending auto-start, null otherwise
    private LocalDateTime generatorCooldownUntil;
}
