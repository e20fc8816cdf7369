package com.bmsedge.emergency.service;

import com.bmsedge.emergency.dto.EmergencyContactDTO;
import com.bmsedge.emergency.model.EmergencyContact;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.repository.EmergencyContactRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

@Service
@RequiredArgsConstructor
@Slf4j
public class EmergencyContactService {

    private static final int DEFAULT_PRIORITY = 5;

    private final EmergencyContactRepository contactRepository;
    private final NotificationPublisher notificationPublisher;

    private final AtomicLong sequence = new AtomicLong();

    // Ascending priority, lowest contacted first
    public List<EmergencyContact> getContacts() {
        return contactRepository.findAllByPriority();
    }

    /**
     * @return empty when name, number or type is missing; nothing is stored then
     */
    public Optional<EmergencyContact> addContact(EmergencyContactDTO dto) {
        if (dto == null || isBlank(dto.getName()) || isBlank(dto.getNumber()) || isBlank(dto.getType())) {
            log.error("❌ Invalid contact: missing required fields");
            return Optional.empty();
        }

        EmergencyContact contact = EmergencyContact.builder()
                .id("contact_" + sequence.incrementAndGet())
                .name(dto.getName())
                .number(dto.getNumber())
                .type(dto.getType())
                .priority(dto.getPriority() != null ? dto.getPriority() : DEFAULT_PRIORITY)
                .autoCall(Boolean.TRUE.equals(dto.getAutoCall()))
                .build();
        contactRepository.save(contact);

        log.info("Added emergency contact: {}", contact.getName());
        notificationPublisher.publish(NotificationType.CONTACT_ADDED, contact);
        return Optional.of(contact);
    }

    public boolean removeContact(String contactId) {
        Optional<EmergencyContact> existing = contactRepository.findById(contactId);
        if (existing.isEmpty()) {
            log.error("❌ Contact not found: {}", contactId);
            return false;
        }
        contactRepository.deleteById(contactId);

        log.info("Removed emergency contact: {}", existing.get().getName());
        notificationPublisher.publish(NotificationType.CONTACT_REMOVED, existing.get());
        return true;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
