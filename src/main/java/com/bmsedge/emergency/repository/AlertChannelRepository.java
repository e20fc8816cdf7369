package com.bmsedge.emergency.repository;

import com.bmsedge.emergency.model.AlertChannel;
import com.bmsedge.emergency.model.enums.AlertTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Alert channels in dispatch order. Thresholds follow the escalation levels:
 * in-home channels fire for everything, remote channels from severity 2,
 * phone calls from 3 and contact notification from 4.
 */
@Repository
public class AlertChannelRepository {

    public static final String CONTACT_NOTIFICATION = "contact_notification";

    private final List<AlertChannel> channels = new ArrayList<>();

    public AlertChannelRepository() {
        channels.add(channel("push", "Push Notification", 1, 0, AlertTemplate.STANDARD));
        channels.add(channel("siren", "Indoor Siren", 1, 0, AlertTemplate.STANDARD));
        channels.add(channel("voice", "Voice Announcement", 1, 2, AlertTemplate.VOICE));
        channels.add(channel("smart_display", "Smart Display Alert", 1, 0, AlertTemplate.DISPLAY));
        channels.add(channel("sms", "SMS Message", 2, 20, AlertTemplate.SMS));
        channels.add(channel("email", "Email Alert", 2, 25, AlertTemplate.STANDARD));
        channels.add(channel("phone_call", "Phone Call", 3, 90, AlertTemplate.STANDARD));
        channels.add(channel(CONTACT_NOTIFICATION, "Emergency Contacts", 4, 0, AlertTemplate.CONTACT));
    }

    private static AlertChannel channel(String id, String name, int threshold, int delay, AlertTemplate template) {
        return AlertChannel.builder()
                .id(id)
                .name(name)
                .priorityThreshold(threshold)
                .delaySeconds(delay)
                .enabled(true)
                .template(template)
                .build();
    }

    public List<AlertChannel> findAllOrdered() {
        return new ArrayList<>(channels);
    }

    public int size() {
        return channels.size();
    }
}
