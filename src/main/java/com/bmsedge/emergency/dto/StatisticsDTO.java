package com.bmsedge.emergency.dto;

import com.bmsedge.emergency.model.enums.BackupOverallStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatisticsDTO {
    private boolean running;
    private int emergencyTypes;

    // Sensors
    private int totalSensors;
    private long onlineSensors;
    private int sensorHealthPercent;
    private int averageSensorBattery;
    private int bufferedSensorEvents;

    // Incidents
    private int activeEmergencies;
    private int totalIncidents;
    private int resolvedIncidents;
    private long averageResponseTimeMs;

    // Collaborators
    private int evacuationRoutes;
    private long routesClear;
    private int emergencyContacts;
    private int emergencyLightsTotal;
    private long emergencyLightsReady;
    private int equipmentTotal;
    private long equipmentGood;
    private long equipmentIssues;
    private int drillsScheduled;
    private int averageDrillScore;

    // Modes
    private boolean lockdownActive;
    private boolean panicButtonActive;
    private BackupOverallStatus powerBackupStatus;
    private int weatherAlertsActive;
    private int wellbeingChecksPending;
    private int alertChannels;

    private LocalDateTime timestamp;
}
