package com.bmsedge.emergency.service;

import com.bmsedge.emergency.model.AlertRecord;
import com.bmsedge.emergency.model.EmergencyType;
import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.enums.AlertDeliveryStatus;
import com.bmsedge.emergency.model.enums.AlertTemplate;
import com.bmsedge.emergency.repository.AlertChannelRepository;
import com.bmsedge.emergency.repository.EmergencyTypeCatalog;
import com.bmsedge.emergency.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class AlertDispatcherTest {

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
    }

    private List<AlertRecord> alertsFor(String typeId) {
        return fixture.lifecycleManager.trigger(typeId, "Test reason", null).getIncident().getAlertsSent();
    }

    @Test
    void shouldUseOnlyLowThresholdChannelsForPowerFailure() {
        List<AlertRecord> alerts = alertsFor(EmergencyTypeCatalog.POWER_FAILURE);

        assertThat(alerts).extracting(AlertRecord::getChannelId)
                .containsExactly("push", "siren", "voice", "smart_display", "sms", "email");
    }

    @Test
    void shouldAddPhoneCallButNoContactsAtSeverityThree() {
        List<AlertRecord> alerts = alertsFor(EmergencyTypeCatalog.STORM);

        assertThat(alerts).extracting(AlertRecord::getChannelId)
                .contains("phone_call")
                .doesNotContain(AlertChannelRepository.CONTACT_NOTIFICATION);
    }

    @Test
    void shouldNotifyEveryContactByPriorityAtHighSeverity() {
        List<AlertRecord> contacts = alertsFor(EmergencyTypeCatalog.FIRE).stream()
                .filter(a -> AlertChannelRepository.CONTACT_NOTIFICATION.equals(a.getChannelId()))
                .collect(Collectors.toList());

        assertThat(contacts).hasSize(fixture.contactRepository.size());
        assertThat(contacts.get(0).getContactId()).isEqualTo("sos");
        assertThat(contacts.get(0).getStatus()).isEqualTo(AlertDeliveryStatus.AUTO_CALLED);
        assertThat(contacts.get(contacts.size() - 1).getStatus()).isEqualTo(AlertDeliveryStatus.NOTIFIED);
        assertThat(contacts.get(0).getMessage()).isEqualTo("EMERGENCY at home: Fire. Test reason");
    }

    @Test
    void shouldSkipDisabledChannels() {
        fixture.channelRepository.findAllOrdered().stream()
                .filter(c -> c.getId().equals("siren"))
                .forEach(c -> c.setEnabled(false));

        List<AlertRecord> alerts = alertsFor(EmergencyTypeCatalog.FLOOD);

        assertThat(alerts).extracting(AlertRecord::getChannelId).doesNotContain("siren");
    }

    @Test
    void shouldFormatChannelMessages() {
        EmergencyType powerFailure = fixture.typeCatalog.findById(EmergencyTypeCatalog.POWER_FAILURE).get();
        Incident incident = Incident.builder()
                .severity(2)
                .reason("Main power failure detected")
                .build();

        assertThat(fixture.alertDispatcher.formatMessage(incident, powerFailure, AlertTemplate.SMS))
                .isEqualTo("EMERGENCY: Power Failure (Severity 2/5) - Reason: Main power failure detected"
                        + " Call 112 if needed.");
        assertThat(fixture.alertDispatcher.formatMessage(incident, powerFailure, AlertTemplate.VOICE))
                .isEqualTo("Attention! Power Failure emergency detected. Main power failure detected."
                        + " Please follow evacuation procedures.");
        assertThat(fixture.alertDispatcher.formatMessage(incident, powerFailure, AlertTemplate.DISPLAY))
                .contains("Color: #333333");
    }
}
