package com.bmsedge.emergency.service;

import com.bmsedge.emergency.model.EmergencyLight;
import com.bmsedge.emergency.model.enums.LightStatus;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.repository.EmergencyLightingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global safety modes (lockdown, panic) and emergency lighting.
 *
 * Lights are held by named holders, an incident id or {@link #LOCKDOWN_HOLDER}.
 * A light stays on while at least one holder keeps it and goes back to
 * READY when the last one lets go.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SafetyModeController {

    public static final String LOCKDOWN_HOLDER = "lockdown";

    private final EmergencyLightingRepository lightingRepository;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    @Value("${emergency.lighting.min-battery:5}")
    private double minBatteryLevel = 5;

    private boolean lockdownActive;
    private String lockdownReason;
    private LocalDateTime lockdownSince;

    private boolean panicActive;
    private String panicSource;
    private LocalDateTime panicSince;

    // ==================== LOCKDOWN ====================

    /**
     * @return false when lockdown was already active (nothing changes, nothing is published)
     */
    public boolean activateLockdown(String reason) {
        if (lockdownActive) {
            log.info("Lockdown already active");
            return false;
        }
        lockdownActive = true;
        lockdownReason = reason != null ? reason : "Manual activation";
        lockdownSince = LocalDateTime.now(clock);

        List<String> lights = activateLighting(LOCKDOWN_HOLDER);
        log.info("🔒 LOCKDOWN ACTIVATED: {}", lockdownReason);

        Map<String, Object> payload = new HashMap<>();
        payload.put("reason", lockdownReason);
        payload.put("lightsActivated", lights);
        notificationPublisher.publish(NotificationType.LOCKDOWN_ACTIVATED, payload);
        return true;
    }

    /**
     * @return false when no lockdown was active
     */
    public boolean deactivateLockdown(String reason) {
        if (!lockdownActive) {
            log.info("Lockdown not active");
            return false;
        }
        lockdownActive = false;
        lockdownReason = null;
        lockdownSince = null;
        releaseLighting(LOCKDOWN_HOLDER);

        String why = reason != null ? reason : "Manual deactivation";
        log.info("🔓 Lockdown deactivated: {}", why);

        Map<String, Object> payload = new HashMap<>();
        payload.put("reason", why);
        notificationPublisher.publish(NotificationType.LOCKDOWN_DEACTIVATED, payload);
        return true;
    }

    // ==================== PANIC ====================

    public void setPanic(String source) {
        panicActive = true;
        panicSource = source;
        panicSince = LocalDateTime.now(clock);

        Map<String, Object> payload = new HashMap<>();
        payload.put("source", source);
        notificationPublisher.publish(NotificationType.PANIC_BUTTON_ACTIVATED, payload);
    }

    // Clears the flag only; the medical incident stays open
    public boolean clearPanic() {
        if (!panicActive) {
            return false;
        }
        panicActive = false;
        panicSource = null;
        panicSince = null;
        log.info("Panic button deactivated");
        notificationPublisher.publish(NotificationType.PANIC_BUTTON_DEACTIVATED, new HashMap<>());
        return true;
    }

    // ==================== LIGHTING ====================

    /**
     * Turns on every auto-activating light with usable battery on behalf of
     * the holder.
     *
     * @return ids of the lights now held by {@code holder}
     */
    public List<String> activateLighting(String holder) {
        List<String> held = new ArrayList<>();
        int switchedOn = 0;
        for (EmergencyLight light : lightingRepository.findAll()) {
            if (!light.isAutoActivate() || light.getBatteryLevel() <= minBatteryLevel) {
                continue;
            }
            light.getHolders().add(holder);
            if (light.getStatus() != LightStatus.ACTIVE) {
                light.setStatus(LightStatus.ACTIVE);
                switchedOn++;
            }
            held.add(light.getId());
        }

        if (switchedOn > 0) {
            log.info("💡 Activated {} emergency lights for {}", switchedOn, holder);
            Map<String, Object> payload = new HashMap<>();
            payload.put("holder", holder);
            payload.put("count", switchedOn);
            notificationPublisher.publish(NotificationType.LIGHTING_ACTIVATED, payload);
        }
        return held;
    }

    /**
     * @return number of lights that went back to READY
     */
    public int releaseLighting(String holder) {
        int switchedOff = 0;
        for (EmergencyLight light : lightingRepository.findAll()) {
            if (!light.getHolders().remove(holder)) {
                continue;
            }
            if (light.getHolders().isEmpty() && light.getStatus() == LightStatus.ACTIVE) {
                light.setStatus(LightStatus.READY);
                switchedOff++;
            }
        }
        if (switchedOff > 0) {
            log.info("Emergency lighting released by {}: {} lights back to ready", holder, switchedOff);
        }
        return switchedOff;
    }

    public List<EmergencyLight> getLights() {
        return lightingRepository.findAll();
    }

    public List<EmergencyLight> getActiveLights() {
        return lightingRepository.findAll().stream()
                .filter(l -> l.getStatus() == LightStatus.ACTIVE)
                .collect(Collectors.toList());
    }

    // Engine stop: modes off, every light back to READY
    public void reset() {
        lockdownActive = false;
        lockdownReason = null;
        lockdownSince = null;
        panicActive = false;
        panicSource = null;
        panicSince = null;
        for (EmergencyLight light : lightingRepository.findAll()) {
            light.getHolders().clear();
            light.setStatus(LightStatus.READY);
        }
    }

    public boolean isLockdownActive() {
        return lockdownActive;
    }

    public String getLockdownReason() {
        return lockdownReason;
    }

    public LocalDateTime getLockdownSince() {
        return lockdownSince;
    }

    public boolean isPanicActive() {
        return panicActive;
    }

    public String getPanicSource() {
        return panicSource;
    }

    public LocalDateTime getPanicSince() {
        return panicSince;
    }
}
