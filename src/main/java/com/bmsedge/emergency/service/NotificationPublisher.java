package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.EmergencyNotificationDTO;
import com.bmsedge.emergency.model.enums.NotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Broadcasts engine notifications to WebSocket subscribers on
 * {@code /topic/emergency/<topic>} and keeps the most recent ones for queries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationPublisher {

    public static final String DESTINATION_PREFIX = "/topic/emergency/";
    private static final int RECENT_LIMIT = 200;

    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    private final Deque<EmergencyNotificationDTO> recent = new ArrayDeque<>();

    public EmergencyNotificationDTO publish(NotificationType type, Object payload) {
        EmergencyNotificationDTO notification = EmergencyNotificationDTO.builder()
                .type(type)
                .payload(payload)
                .timestamp(LocalDateTime.now(clock))
                .build();

        recent.addFirst(notification);
        while (recent.size() > RECENT_LIMIT) {
            recent.removeLast();
        }

        String destination = DESTINATION_PREFIX + type.getTopic();
        log.info("📡 {} → {}", type, destination);

        // Delivery failures stay local to the broadcast
        try {
            messagingTemplate.convertAndSend(destination, notification);
        } catch (Exception e) {
            log.error("❌ Error broadcasting {} to {}: {}", type, destination, e.getMessage());
        }
        return notification;
    }

    // Newest first
    public List<EmergencyNotificationDTO> getRecent() {
        return new ArrayList<>(recent);
    }

    public List<EmergencyNotificationDTO> getRecent(NotificationType type) {
        return recent.stream()
                .filter(n -> n.getType() == type)
                .collect(Collectors.toList());
    }

    public long count(NotificationType type) {
        return getRecent(type).size();
    }
}
