package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.BackupLevelDTO;
import com.bmsedge.emergency.dto.DamageAssessmentDTO;
import com.bmsedge.emergency.dto.DrillResultDTO;
import com.bmsedge.emergency.dto.EmergencyContactDTO;
import com.bmsedge.emergency.dto.EquipmentIssueDTO;
import com.bmsedge.emergency.dto.IncidentSummaryDTO;
import com.bmsedge.emergency.dto.LightingStatusDTO;
import com.bmsedge.emergency.dto.PowerBackupStatusDTO;
import com.bmsedge.emergency.dto.ResolutionResult;
import com.bmsedge.emergency.dto.SensorReportResultDTO;
import com.bmsedge.emergency.dto.SensorStatusDTO;
import com.bmsedge.emergency.dto.SensorTelemetryDTO;
import com.bmsedge.emergency.dto.StatisticsDTO;
import com.bmsedge.emergency.dto.TriggerResult;
import com.bmsedge.emergency.dto.WeatherAlertDTO;
import com.bmsedge.emergency.model.CorrelationMatch;
import com.bmsedge.emergency.model.DamageReport;
import com.bmsedge.emergency.model.Drill;
import com.bmsedge.emergency.model.DrillRun;
import com.bmsedge.emergency.model.EmergencyContact;
import com.bmsedge.emergency.model.EmergencyEquipment;
import com.bmsedge.emergency.model.EmergencyLight;
import com.bmsedge.emergency.model.EvacuationRoute;
import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.PowerBackupUnit;
import com.bmsedge.emergency.model.RecoveryPlan;
import com.bmsedge.emergency.model.SensorRecord;
import com.bmsedge.emergency.model.WeatherAlert;
import com.bmsedge.emergency.model.WellbeingCheck;
import com.bmsedge.emergency.model.enums.IncidentStatus;
import com.bmsedge.emergency.model.enums.LightStatus;
import com.bmsedge.emergency.model.enums.SensorReportOutcome;
import com.bmsedge.emergency.repository.AlertChannelRepository;
import com.bmsedge.emergency.repository.EmergencyTypeCatalog;
import com.bmsedge.emergency.repository.IncidentLogRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point to the emergency response engine.
 *
 * Every inbound call, query and scheduled tick goes through a synchronized
 * method of this class, so each one runs to completion before the next
 * starts. The component services hold no locks of their own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmergencyResponseService {

    static final String STOP_RESOLUTION = "Engine stopped";
    private static final double LIGHT_LOW_BATTERY = 30;

    private final CorrelationEngine correlationEngine;
    private final IncidentLifecycleManager lifecycleManager;
    private final SafetyModeController safetyModeController;
    private final PowerBackupSupervisor powerBackupSupervisor;
    private final WellbeingScheduler wellbeingScheduler;
    private final SensorHealthService sensorHealthService;
    private final EquipmentService equipmentService;
    private final DrillService drillService;
    private final WeatherAlertService weatherAlertService;
    private final EvacuationRouteService evacuationRouteService;
    private final DamageAssessmentService damageAssessmentService;
    private final EmergencyContactService contactService;
    private final IncidentLogRepository incidentLog;
    private final EmergencyTypeCatalog typeCatalog;
    private final AlertChannelRepository channelRepository;
    private final Clock clock;

    private boolean running;

    // ==================== LIFECYCLE ====================

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        log.info("✅ Emergency response engine started: {} types, {} sensors",
                typeCatalog.size(), sensorHealthService.getStatus().getTotalSensors());
    }

    /**
     * Stops the periodic work and drops transient state: active incidents
     * (closed as ABANDONED), buffered sensor events, lockdown, panic and lights. The incident log,
     * registries and statistics are kept.
     */
    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        int abandoned = lifecycleManager.abandonActive(STOP_RESOLUTION);
        correlationEngine.clear();
        safetyModeController.reset();
        powerBackupSupervisor.cancelPending();
        log.info("Emergency response engine stopped - all monitoring stopped ({} active emergencies abandoned)",
                abandoned);
    }

    public synchronized boolean isRunning() {
        return running;
    }

    // ==================== INBOUND ====================

    public synchronized SensorReportResultDTO reportSensorEvent(String sensorId, String eventType,
                                                                Map<String, Object> payload) {
        SensorReportOutcome outcome = correlationEngine.report(sensorId, eventType, payload);
        return SensorReportResultDTO.builder()
                .sensorId(sensorId)
                .eventType(eventType)
                .outcome(outcome)
                .bufferedEvents(correlationEngine.bufferSize())
                .build();
    }

    public synchronized TriggerResult triggerEmergency(String typeId, String reason, Map<String, Object> details) {
        return lifecycleManager.trigger(typeId, reason, details);
    }

    public synchronized Optional<ResolutionResult> resolveEmergency(String incidentId, String resolution) {
        return lifecycleManager.resolve(incidentId, resolution);
    }

    /**
     * Sets the panic flag and raises a medical emergency, deduplicated like
     * any other trigger.
     */
    public synchronized TriggerResult triggerPanicButton(String source, Map<String, Object> details) {
        String from = source != null ? source : "unknown source";
        log.warn("🚨 PANIC BUTTON ACTIVATED - Source: {}", from);
        safetyModeController.setPanic(from);

        Map<String, Object> incidentDetails = new HashMap<>();
        incidentDetails.put("panicButton", true);
        incidentDetails.put("source", from);
        incidentDetails.put("details", details != null ? details : new HashMap<>());
        return lifecycleManager.trigger(EmergencyTypeCatalog.MEDICAL, "Panic button activated from " + from,
                incidentDetails);
    }

    public synchronized boolean deactivatePanicButton() {
        return safetyModeController.clearPanic();
    }

    public synchronized boolean activateLockdown(String reason) {
        return safetyModeController.activateLockdown(reason);
    }

    public synchronized boolean deactivateLockdown(String reason) {
        return safetyModeController.deactivateLockdown(reason);
    }

    public synchronized TriggerResult handlePowerFailure() {
        return powerBackupSupervisor.handlePowerFailure();
    }

    public synchronized Optional<ResolutionResult> handlePowerRestored() {
        return powerBackupSupervisor.handlePowerRestored();
    }

    public synchronized Optional<PowerBackupUnit> reportBackupLevel(String unitId, BackupLevelDTO dto) {
        return powerBackupSupervisor.reportBackupLevel(unitId, dto.getLevel());
    }

    public synchronized boolean respondToWellbeingCheck(String checkId, String response) {
        return wellbeingScheduler.respond(checkId, response);
    }

    public synchronized Optional<RecoveryPlan> completeRecoveryStep(String incidentId, int step) {
        return lifecycleManager.completeRecoveryStep(incidentId, step);
    }

    public synchronized Optional<DamageReport> assessDamage(String incidentId, DamageAssessmentDTO dto) {
        return damageAssessmentService.assess(incidentId, dto);
    }

    public synchronized WeatherAlert issueWeatherAlert(WeatherAlertDTO dto) {
        return weatherAlertService.issue(dto);
    }

    public synchronized Optional<WeatherAlert> clearWeatherAlert(String alertId) {
        return weatherAlertService.clear(alertId);
    }

    // ==================== PASS-THROUGH ====================

    public synchronized Optional<SensorRecord> updateSensorTelemetry(String sensorId, SensorTelemetryDTO telemetry) {
        return sensorHealthService.updateTelemetry(sensorId, telemetry);
    }

    public synchronized boolean setEvacuationRouteClearance(String routeId, boolean cleared) {
        return evacuationRouteService.setClearance(routeId, cleared);
    }

    public synchronized Optional<EmergencyContact> addEmergencyContact(EmergencyContactDTO dto) {
        return contactService.addContact(dto);
    }

    public synchronized boolean removeEmergencyContact(String contactId) {
        return contactService.removeContact(contactId);
    }

    public synchronized Optional<EmergencyEquipment> inspectEquipment(String equipmentId) {
        return equipmentService.inspect(equipmentId);
    }

    public synchronized List<EquipmentIssueDTO> checkEquipment() {
        return equipmentService.checkStatus();
    }

    public synchronized Optional<DrillRun> recordDrillRun(String drillId, DrillResultDTO result) {
        return drillService.recordRun(drillId, result);
    }

    // ==================== SCHEDULED ====================

    @Scheduled(fixedDelayString = "${emergency.correlation.tick-ms:5000}",
            initialDelayString = "${emergency.correlation.tick-ms:5000}")
    public void scheduledCorrelationTick() {
        runCorrelationTick();
    }

    /**
     * Prunes and scans the correlation buffer; every match is handed to the
     * lifecycle manager.
     *
     * @return one trigger result per matched rule, empty when stopped
     */
    public synchronized List<TriggerResult> runCorrelationTick() {
        if (!running) {
            return List.of();
        }
        List<TriggerResult> results = new ArrayList<>();
        for (CorrelationMatch match : correlationEngine.tick()) {
            log.info("🔗 CORRELATION: {} - {} confirmed", match.getRuleId(), match.getEmergencyTypeId());
            results.add(lifecycleManager.trigger(match.getEmergencyTypeId(), match.getReason(), match.getDetails()));
        }
        return results;
    }

    @Scheduled(fixedDelayString = "${emergency.power.poll-ms:10000}")
    public synchronized void pollPowerBackup() {
        if (running) {
            powerBackupSupervisor.poll();
        }
    }

    @Scheduled(fixedDelayString = "${emergency.wellbeing.poll-ms:60000}")
    public synchronized void pollWellbeingChecks() {
        if (running) {
            wellbeingScheduler.processOverdue();
        }
    }

    @Scheduled(fixedDelayString = "${emergency.sensors.health-poll-ms:60000}")
    public synchronized void pollSensorHealth() {
        if (running) {
            sensorHealthService.check();
        }
    }

    @Scheduled(fixedDelayString = "${emergency.equipment.poll-ms:3600000}")
    public synchronized void pollEquipment() {
        if (running) {
            checkEquipment();
        }
    }

    @Scheduled(fixedDelayString = "${emergency.drills.poll-ms:86400000}")
    public synchronized void pollDrillSchedule() {
        if (running) {
            drillService.checkSchedule();
        }
    }

    // ==================== QUERIES ====================

    public synchronized List<IncidentSummaryDTO> getActiveEmergencies() {
        return lifecycleManager.getActiveIncidents().stream()
                .map(IncidentSummaryDTO::from)
                .collect(Collectors.toList());
    }

    public synchronized Optional<Incident> getIncident(String incidentId) {
        return incidentLog.findById(incidentId);
    }

    // Newest first
    public synchronized List<IncidentSummaryDTO> getIncidentHistory(Integer limit) {
        return incidentLog.findRecent(limit).stream()
                .map(IncidentSummaryDTO::from)
                .collect(Collectors.toList());
    }

    public synchronized Optional<RecoveryPlan> getRecoveryPlan(String incidentId) {
        return lifecycleManager.getRecoveryPlan(incidentId);
    }

    public synchronized SensorStatusDTO getSensorStatus() {
        return sensorHealthService.getStatus();
    }

    public synchronized PowerBackupStatusDTO getPowerBackupStatus() {
        return powerBackupSupervisor.getStatus();
    }

    public synchronized List<WellbeingCheck> getPendingWellbeingChecks() {
        return wellbeingScheduler.getPending();
    }

    public synchronized List<WellbeingCheck> getCompletedWellbeingChecks() {
        return wellbeingScheduler.getCompleted();
    }

    public synchronized List<EmergencyContact> getEmergencyContacts() {
        return contactService.getContacts();
    }

    public synchronized List<EvacuationRoute> getEvacuationRoutes() {
        return evacuationRouteService.getRoutes();
    }

    public synchronized Optional<EvacuationRoute> recommendEvacuationRoute() {
        return evacuationRouteService.recommend();
    }

    public synchronized Optional<EvacuationRoute> selectPreferredEvacuationRoute(String routeId) {
        return evacuationRouteService.selectPreferred(routeId);
    }

    public synchronized boolean evacuationRouteExists(String routeId) {
        return evacuationRouteService.exists(routeId);
    }

    public synchronized List<EmergencyEquipment> getEquipmentInventory() {
        return equipmentService.getInventory();
    }

    public synchronized List<Drill> getDrillSchedule() {
        return drillService.getSchedule();
    }

    public synchronized List<DrillRun> getDrillRuns() {
        return drillService.getRuns();
    }

    public synchronized Map<String, Object> getWeatherAlerts() {
        Map<String, Object> overview = new HashMap<>();
        overview.put("region", weatherAlertService.getRegion());
        overview.put("activeAlerts", weatherAlertService.getActiveAlerts());
        overview.put("alertHistory", weatherAlertService.getHistory());
        return overview;
    }

    public synchronized LightingStatusDTO getLightingStatus() {
        List<EmergencyLight> lights = safetyModeController.getLights();
        long ready = lights.stream()
                .filter(l -> l.getStatus() == LightStatus.READY || l.getStatus() == LightStatus.ACTIVE)
                .count();
        return LightingStatusDTO.builder()
                .totalLights(lights.size())
                .readyCount(ready)
                .activeCount(lights.stream().filter(l -> l.getStatus() == LightStatus.ACTIVE).count())
                .lowBatteryCount(lights.stream().filter(l -> l.getBatteryLevel() < LIGHT_LOW_BATTERY).count())
                .coveragePercent(lights.isEmpty() ? 0 : (int) Math.round(ready * 100.0 / lights.size()))
                .lockdownActive(safetyModeController.isLockdownActive())
                .lockdownReason(safetyModeController.getLockdownReason())
                .lockdownSince(safetyModeController.getLockdownSince())
                .panicActive(safetyModeController.isPanicActive())
                .panicSource(safetyModeController.getPanicSource())
                .panicSince(safetyModeController.getPanicSince())
                .lights(lights)
                .build();
    }

    public synchronized StatisticsDTO getStatistics() {
        SensorStatusDTO sensors = sensorHealthService.getStatus();
        LightingStatusDTO lighting = getLightingStatus();
        List<Incident> resolved = incidentLog.findByStatus(IncidentStatus.RESOLVED);
        long averageResponse = Math.round(resolved.stream()
                .mapToLong(i -> i.getResponseTimeMs() != null ? i.getResponseTimeMs() : 0)
                .average()
                .orElse(0));
        List<EmergencyEquipment> equipment = equipmentService.getInventory();
        long equipmentGood = equipmentService.countGood();

        return StatisticsDTO.builder()
                .running(running)
                .emergencyTypes(typeCatalog.size())
                .totalSensors(sensors.getTotalSensors())
                .onlineSensors(sensors.getOnlineCount())
                .sensorHealthPercent(sensors.getHealthPercent())
                .averageSensorBattery(sensorHealthService.averageBattery())
                .bufferedSensorEvents(correlationEngine.bufferSize())
                .activeEmergencies(lifecycleManager.countActive())
                .totalIncidents(incidentLog.size())
                .resolvedIncidents(resolved.size())
                .averageResponseTimeMs(averageResponse)
                .evacuationRoutes(evacuationRouteService.getRoutes().size())
                .routesClear(evacuationRouteService.getRoutes().stream().filter(r -> r.isClearance()).count())
                .emergencyContacts(contactService.getContacts().size())
                .emergencyLightsTotal(lighting.getTotalLights())
                .emergencyLightsReady(lighting.getReadyCount())
                .equipmentTotal(equipment.size())
                .equipmentGood(equipmentGood)
                .equipmentIssues(equipment.size() - equipmentGood)
                .drillsScheduled(drillService.getSchedule().size())
                .averageDrillScore(drillService.averageLastScore())
                .lockdownActive(safetyModeController.isLockdownActive())
                .panicButtonActive(safetyModeController.isPanicActive())
                .powerBackupStatus(powerBackupSupervisor.getOverallStatus())
                .weatherAlertsActive(weatherAlertService.getActiveAlerts().size())
                .wellbeingChecksPending(wellbeingScheduler.getPending().size())
                .alertChannels(channelRepository.size())
                .timestamp(LocalDateTime.now(clock))
                .build();
    }
}
