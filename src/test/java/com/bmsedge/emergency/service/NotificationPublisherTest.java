package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.EmergencyNotificationDTO;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationPublisherTest {

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    private NotificationPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new NotificationPublisher(messagingTemplate, new MutableClock(Instant.parse("2026-03-10T10:00:00Z")));
    }

    @Test
    void shouldBroadcastOnTheTypeTopic() {
        EmergencyNotificationDTO sent = publisher.publish(NotificationType.PANIC_BUTTON_ACTIVATED, Map.of("source", "app"));

        verify(messagingTemplate).convertAndSend("/topic/emergency/panic-button", (Object) sent);
        assertThat(publisher.getRecent()).containsExactly(sent);
    }

    @Test
    void shouldKeepRecordingWhenBrokerFails() {
        doThrow(new MessageDeliveryException("broker down"))
                .when(messagingTemplate).convertAndSend(anyString(), any(Object.class));

        publisher.publish(NotificationType.POWER_RESTORED, Map.of());

        assertThat(publisher.count(NotificationType.POWER_RESTORED)).isEqualTo(1);
    }

    @Test
    void shouldListNewestFirst() {
        publisher.publish(NotificationType.CONTACT_ADDED, "first");
        publisher.publish(NotificationType.CONTACT_REMOVED, "second");

        assertThat(publisher.getRecent()).extracting(EmergencyNotificationDTO::getPayload)
                .containsExactly("second", "first");
    }
}
