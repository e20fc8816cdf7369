package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.EquipmentIssueDTO;
import com.bmsedge.emergency.model.EmergencyEquipment;
import com.bmsedge.emergency.model.enums.EquipmentStatus;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.repository.EquipmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class EquipmentService {

    static final int EXPIRY_WARNING_DAYS = 30;
    static final double LOW_BATTERY = 30;

    private final EquipmentRepository equipmentRepository;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    public List<EmergencyEquipment> getInventory() {
        return equipmentRepository.findAll().stream()
                .sorted(Comparator.comparing(EmergencyEquipment::getId))
                .collect(Collectors.toList());
    }

    /**
     * Records an inspection today. Expired items keep their status until replaced.
     */
    public Optional<EmergencyEquipment> inspect(String equipmentId) {
        Optional<EmergencyEquipment> found = equipmentRepository.findById(equipmentId);
        if (found.isEmpty()) {
            log.error("❌ Equipment not found: {}", equipmentId);
            return Optional.empty();
        }
        EmergencyEquipment item = found.get();
        item.setLastInspected(LocalDate.now(clock));
        if (item.getStatus() == EquipmentStatus.EXPIRED) {
            log.warn("Equipment {} needs replacement (expired)", item.getName());
        } else {
            item.setStatus(EquipmentStatus.GOOD);
        }
        log.info("Inspected equipment: {}", item.getName());
        return Optional.of(item);
    }

    /**
     * Flags expired, soon-to-expire and low-battery items and publishes one
     * notification when anything was found.
     */
    public List<EquipmentIssueDTO> checkStatus() {
        LocalDate today = LocalDate.now(clock);
        List<EquipmentIssueDTO> issues = new ArrayList<>();

        for (EmergencyEquipment item : getInventory()) {
            if (item.getExpiryDate() != null) {
                long daysUntilExpiry = ChronoUnit.DAYS.between(today, item.getExpiryDate());
                if (daysUntilExpiry < 0) {
                    item.setStatus(EquipmentStatus.EXPIRED);
                    issues.add(issue(item, "expired").days(Math.abs(daysUntilExpiry)).build());
                } else if (daysUntilExpiry < EXPIRY_WARNING_DAYS) {
                    item.setStatus(EquipmentStatus.EXPIRING_SOON);
                    issues.add(issue(item, "expiring_soon").days(daysUntilExpiry).build());
                }
            }
            if (item.getBatteryLevel() != null && item.getBatteryLevel() < LOW_BATTERY) {
                issues.add(issue(item, "low_battery").batteryLevel(item.getBatteryLevel()).build());
            }
        }

        if (!issues.isEmpty()) {
            log.warn("⚠️ Equipment issues found: {}", issues.size());
            Map<String, Object> payload = new HashMap<>();
            payload.put("issues", issues);
            notificationPublisher.publish(NotificationType.EQUIPMENT_ISSUES, payload);
        }
        return issues;
    }

    private static EquipmentIssueDTO.EquipmentIssueDTOBuilder issue(EmergencyEquipment item, String issue) {
        return EquipmentIssueDTO.builder().id(item.getId()).name(item.getName()).issue(issue);
    }

    public long countGood() {
        return equipmentRepository.findAll().stream()
                .filter(e -> e.getStatus() == EquipmentStatus.GOOD)
                .count();
    }
}
