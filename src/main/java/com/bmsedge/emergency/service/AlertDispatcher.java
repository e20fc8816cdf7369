package com.bmsedge.emergency.service;

import com.bmsedge.emergency.model.AlertChannel;
import com.bmsedge.emergency.model.AlertRecord;
import com.bmsedge.emergency.model.EmergencyContact;
import com.bmsedge.emergency.model.EmergencyType;
import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.enums.AlertDeliveryStatus;
import com.bmsedge.emergency.model.enums.AlertTemplate;
import com.bmsedge.emergency.repository.AlertChannelRepository;
import com.bmsedge.emergency.repository.EmergencyContactRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Multi-channel alerting for a new incident. Channels are walked in their
 * configured order and fire only when the incident severity reaches the
 * channel threshold.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertDispatcher {

    private static final String DEFAULT_EMERGENCY_NUMBER = "112";

    private final AlertChannelRepository channelRepository;
    private final EmergencyContactRepository contactRepository;
    private final Clock clock;

    public List<AlertRecord> dispatch(Incident incident, EmergencyType type) {
        log.info("Sending multi-channel alerts for: {}", type.getLabel());
        List<AlertRecord> sent = new ArrayList<>();

        for (AlertChannel channel : channelRepository.findAllOrdered()) {
            if (!channel.isEnabled() || incident.getSeverity() < channel.getPriorityThreshold()) {
                continue;
            }
            if (channel.getTemplate() == AlertTemplate.CONTACT) {
                sent.addAll(notifyContacts(incident, type, channel));
                continue;
            }

            sent.add(AlertRecord.builder()
                    .channelId(channel.getId())
                    .channelName(channel.getName())
                    .message(formatMessage(incident, type, channel.getTemplate()))
                    .delaySeconds(channel.getDelaySeconds())
                    .status(AlertDeliveryStatus.SENT)
                    .sentAt(LocalDateTime.now(clock))
                    .build());
            log.info("Alert via {}: {}", channel.getName(), type.getLabel());
        }
        return sent;
    }

    private List<AlertRecord> notifyContacts(Incident incident, EmergencyType type, AlertChannel channel) {
        List<AlertRecord> notified = new ArrayList<>();
        String message = "EMERGENCY at home: " + type.getLabel() + ". " + incident.getReason();

        for (EmergencyContact contact : contactRepository.findAllByPriority()) {
            log.info("📞 Notifying contact: {} ({})", contact.getName(), contact.getNumber());
            notified.add(AlertRecord.builder()
                    .channelId(channel.getId())
                    .channelName(channel.getName())
                    .message(message)
                    .delaySeconds(channel.getDelaySeconds())
                    .status(contact.isAutoCall() ? AlertDeliveryStatus.AUTO_CALLED : AlertDeliveryStatus.NOTIFIED)
                    .contactId(contact.getId())
                    .contactName(contact.getName())
                    .contactNumber(contact.getNumber())
                    .sentAt(LocalDateTime.now(clock))
                    .build());
        }
        return notified;
    }

    String formatMessage(Incident incident, EmergencyType type, AlertTemplate template) {
        String base = "EMERGENCY: " + type.getLabel() + " (Severity " + incident.getSeverity() + "/5) - ";
        String reason = "Reason: " + incident.getReason();

        switch (template) {
            case SMS:
                String number = type.getEmergencyNumber() != null ? type.getEmergencyNumber() : DEFAULT_EMERGENCY_NUMBER;
                return base + reason + " Call " + number + " if needed.";
            case VOICE:
                return "Attention! " + type.getLabel() + " emergency detected. " + incident.getReason()
                        + ". Please follow evacuation procedures.";
            case DISPLAY:
                return base + reason + " Time: " + incident.getTriggeredAt() + " Color: " + type.getColorCode()
                        + " Evacuation routes displayed.";
            default:
                return base + reason + " Time: " + incident.getTriggeredAt() + " Follow emergency protocol.";
        }
    }
}
