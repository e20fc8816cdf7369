package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.PowerBackupStatusDTO;
import com.bmsedge.emergency.dto.ResolutionResult;
import com.bmsedge.emergency.dto.TriggerResult;
import com.bmsedge.emergency.model.PowerBackupUnit;
import com.bmsedge.emergency.model.enums.BackupOverallStatus;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.model.enums.PowerUnitStatus;
import com.bmsedge.emergency.model.enums.PowerUnitType;
import com.bmsedge.emergency.repository.EmergencyTypeCatalog;
import com.bmsedge.emergency.repository.PowerBackupRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Failover across UPS, battery and generator.
 *
 * <pre>
 * UPS        STANDBY -> ACTIVE       (failure)   -> STANDBY  (restore)
 * BATTERY    STANDBY -> DISCHARGING  (failure)   -> CHARGING (restore) -> STANDBY at 100 %
 * GENERATOR  STANDBY -> RUNNING      (auto-start after delay) -> COOLDOWN (restore) -> STANDBY
 * </pre>
 *
 * A power failure opens a {@code power-failure} incident; restoring mains
 * resolves it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PowerBackupSupervisor {

    static final double LOW_LEVEL = 20;
    static final double OPTIMAL_LEVEL = 50;

    private final PowerBackupRepository repository;
    private final IncidentLifecycleManager lifecycleManager;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    @Value("${emergency.power.generator-start-delay-seconds:10}")
    private long generatorStartDelaySeconds = 10;

    @Value("${emergency.power.generator-cooldown-seconds:300}")
    private long generatorCooldownSeconds = 300;

    @Value("${emergency.power.generator-min-fuel:5}")
    private double generatorMinFuel = 5;

    private boolean mainsAvailable = true;
    private LocalDateTime generatorStartDue;
    private LocalDateTime generatorCooldownUntil;

    // ==================== MAINS EVENTS ====================

    public TriggerResult handlePowerFailure() {
        log.warn("⚡ Power failure detected - activating backup systems");
        mainsAvailable = false;

        PowerBackupUnit ups = repository.ups();
        PowerBackupUnit battery = repository.battery();
        ups.setStatus(PowerUnitStatus.ACTIVE);
        log.info("UPS activated - estimated runtime: {} min", ups.estimatedRuntimeMinutes());
        battery.setStatus(PowerUnitStatus.DISCHARGING);
        log.info("Battery backup discharging - estimated runtime: {} min", battery.estimatedRuntimeMinutes());

        if (canAutoStartGenerator()) {
            if (generatorStartDelaySeconds <= 0) {
                startGenerator();
            } else if (generatorStartDue != null) {
                log.debug("Generator auto-start already due at {}", generatorStartDue);
            } else {
                generatorStartDue = LocalDateTime.now(clock).plusSeconds(generatorStartDelaySeconds);
                log.info("Generator auto-start scheduled in {}s", generatorStartDelaySeconds);
            }
        }

        Map<String, Object> details = new HashMap<>();
        details.put("upsStatus", ups.getStatus());
        details.put("batteryLevel", battery.getLevel());
        details.put("generatorStatus", repository.generator().getStatus());
        return lifecycleManager.trigger(EmergencyTypeCatalog.POWER_FAILURE, "Main power failure detected", details);
    }

    /**
     * @return the resolution of the open power-failure incident, if there was one
     */
    public Optional<ResolutionResult> handlePowerRestored() {
        log.info("Power restored - switching back to mains");
        mainsAvailable = true;
        generatorStartDue = null;

        repository.ups().setStatus(PowerUnitStatus.STANDBY);
        repository.battery().setStatus(PowerUnitStatus.CHARGING);

        PowerBackupUnit generator = repository.generator();
        if (generator.getStatus() == PowerUnitStatus.RUNNING) {
            generator.setStatus(PowerUnitStatus.COOLDOWN);
            generatorCooldownUntil = LocalDateTime.now(clock).plusSeconds(generatorCooldownSeconds);
        }

        Optional<ResolutionResult> resolved = lifecycleManager
                .findActiveByType(EmergencyTypeCatalog.POWER_FAILURE)
                .flatMap(incident -> lifecycleManager.resolve(incident.getId(), "Power restored to mains"));

        notificationPublisher.publish(NotificationType.POWER_RESTORED, new HashMap<>());
        return resolved;
    }

    // ==================== GENERATOR ====================

    private boolean canAutoStartGenerator() {
        PowerBackupUnit generator = repository.generator();
        return generator.isAutoStart()
                && generator.getLevel() > generatorMinFuel
                && generator.getStatus() != PowerUnitStatus.RUNNING;
    }

    private void startGenerator() {
        PowerBackupUnit generator = repository.generator();
        generator.setStatus(PowerUnitStatus.RUNNING);
        generatorStartDue = null;
        generatorCooldownUntil = null;
        log.info("🔋 Generator started - fuel {}%, runtime ~{} min",
                Math.round(generator.getLevel()), generator.estimatedRuntimeMinutes());

        Map<String, Object> payload = new HashMap<>();
        payload.put("unitId", generator.getId());
        payload.put("fuelLevel", generator.getLevel());
        payload.put("estimatedRuntimeMinutes", generator.estimatedRuntimeMinutes());
        notificationPublisher.publish(NotificationType.GENERATOR_STARTED, payload);
    }

    // ==================== TELEMETRY ====================

    public Optional<PowerBackupUnit> reportBackupLevel(String unitId, double level) {
        Optional<PowerBackupUnit> found = repository.findById(unitId);
        if (found.isEmpty()) {
            log.error("❌ Unknown power backup unit: {}", unitId);
            return Optional.empty();
        }

        PowerBackupUnit unit = found.get();
        unit.setLevel(Math.max(0, Math.min(100, level)));

        if (unit.getLevel() < LOW_LEVEL) {
            log.warn("⚠️ {} level low: {}%", unit.getName(), Math.round(unit.getLevel()));
            Map<String, Object> payload = new HashMap<>();
            payload.put("unitId", unit.getId());
            payload.put("level", unit.getLevel());
            notificationPublisher.publish(NotificationType.BACKUP_LEVEL_LOW, payload);

            if (unit.getType() == PowerUnitType.UPS && !mainsAvailable && canAutoStartGenerator()) {
                startGenerator();
            }
        }
        return Optional.of(unit);
    }

    /**
     * Periodic step: delayed generator start, generator cooldown and the end
     * of battery charging.
     */
    public void poll() {
        LocalDateTime now = LocalDateTime.now(clock);
        PowerBackupUnit generator = repository.generator();

        if (generatorStartDue != null && !now.isBefore(generatorStartDue)) {
            generatorStartDue = null;
            if (!mainsAvailable && canAutoStartGenerator()) {
                startGenerator();
            }
        }

        if (generator.getStatus() == PowerUnitStatus.COOLDOWN
                && generatorCooldownUntil != null && !now.isBefore(generatorCooldownUntil)) {
            generator.setStatus(PowerUnitStatus.STANDBY);
            generatorCooldownUntil = null;
            log.info("Generator cooled down and ready");
        }

        PowerBackupUnit battery = repository.battery();
        if (battery.getStatus() == PowerUnitStatus.CHARGING && battery.getLevel() >= 100) {
            battery.setStatus(PowerUnitStatus.STANDBY);
            log.info("Battery backup fully charged");
        }
    }

    // ==================== STATUS ====================

    public BackupOverallStatus getOverallStatus() {
        boolean allAbove = repository.findAll().stream().allMatch(u -> u.getLevel() > OPTIMAL_LEVEL);
        return allAbove ? BackupOverallStatus.OPTIMAL : BackupOverallStatus.DEGRADED;
    }

    public PowerBackupStatusDTO getStatus() {
        List<PowerBackupUnit> units = repository.findAll();
        int runtime = units.stream().mapToInt(PowerBackupUnit::estimatedRuntimeMinutes).sum();
        return PowerBackupStatusDTO.builder()
                .overallStatus(getOverallStatus())
                .mainsAvailable(mainsAvailable)
                .totalEstimatedRuntimeMinutes(runtime)
                .units(units)
                .generatorStartDue(generatorStartDue)
                .generatorCooldownUntil(generatorCooldownUntil)
                .build();
    }

    public boolean isMainsAvailable() {
        return mainsAvailable;
    }

    // Engine stop: drop the pending auto-start
    public void cancelPending() {
        generatorStartDue = null;
    }
}
