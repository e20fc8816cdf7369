package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.DamageAssessmentDTO;
import com.bmsedge.emergency.model.DamageReport;
import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.repository.IncidentLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

@Service
@RequiredArgsConstructor
@Slf4j
public class DamageAssessmentService {

    private final IncidentLogRepository incidentLog;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    private final AtomicLong sequence = new AtomicLong();

    // Attaches to any logged incident, active or resolved; a later assessment replaces the earlier one
    public Optional<DamageReport> assess(String incidentId, DamageAssessmentDTO dto) {
        Optional<Incident> found = incidentLog.findById(incidentId);
        if (found.isEmpty()) {
            log.error("❌ Incident not found for damage assessment: {}", incidentId);
            return Optional.empty();
        }
        Incident incident = found.get();
        DamageAssessmentDTO input = dto != null ? dto : new DamageAssessmentDTO();

        DamageReport report = DamageReport.builder()
                .id("damage_" + sequence.incrementAndGet())
                .incidentId(incidentId)
                .emergencyType(incident.getTypeId())
                .assessedAt(LocalDateTime.now(clock))
                .assessor(input.getAssessor() != null ? input.getAssessor() : "Homeowner")
                .overallSeverity(input.getSeverity() != null ? input.getSeverity() : "unknown")
                .areas(input.getAreas() != null ? new ArrayList<>(input.getAreas()) : new ArrayList<>())
                .estimatedCost(input.getEstimatedCost() != null ? input.getEstimatedCost() : 0)
                .insuranceClaim(Boolean.TRUE.equals(input.getInsuranceClaim()))
                .professionalNeeded(Boolean.TRUE.equals(input.getProfessionalNeeded()))
                .habitable(input.getHabitable() == null || input.getHabitable())
                .photos(input.getPhotos() != null ? input.getPhotos() : 0)
                .notes(input.getNotes() != null ? input.getNotes() : "")
                .build();
        incident.setDamageReport(report);

        log.info("Damage assessment filed for: {} - Severity: {}", incidentId, report.getOverallSeverity());
        notificationPublisher.publish(NotificationType.DAMAGE_ASSESSED, report);
        return Optional.of(report);
    }
}
