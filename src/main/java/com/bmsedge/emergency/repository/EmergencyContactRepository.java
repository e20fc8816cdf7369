package com.bmsedge.emergency.repository;

import com.bmsedge.emergency.model.EmergencyContact;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class EmergencyContactRepository {

    private final List<EmergencyContact> contacts = new ArrayList<>();

    public EmergencyContactRepository() {
        contacts.add(contact("sos", "SOS Alarm", "112", "emergency", 1, true));
        contacts.add(contact("police", "Polisen", "114 14", "police", 2, false));
        contacts.add(contact("fire_dept", "Brandkaaren", "112", "fire", 1, true));
        contacts.add(contact("ambulance", "Ambulans", "112", "medical", 1, true));
        contacts.add(contact("poison", "Giftinformationscentralen", "010-456 67 00", "poison", 3, false));
        contacts.add(contact("hospital", "Karolinska Universitetssjukhuset", "08-517 700 00", "hospital", 3, false));
        contacts.add(contact("family1", "Erik Johansson (Brother)", "+46-70-123-4567", "family", 2, false));
        contacts.add(contact("family2", "Anna Lindstroem (Mother)", "+46-73-987-6543", "family", 2, false));
        contacts.add(contact("neighbor1", "Lars Nilsson (Neighbor)", "+46-70-555-1234", "neighbor", 4, false));
        contacts.add(contact("neighbor2", "Maria Svensson (Neighbor)", "+46-70-555-5678", "neighbor", 4, false));
    }

    private static EmergencyContact contact(String id, String name, String number, String type,
                                            int priority, boolean autoCall) {
        return EmergencyContact.builder()
                .id(id)
                .name(name)
                .number(number)
                .type(type)
                .priority(priority)
                .autoCall(autoCall)
                .build();
    }

    // Stable sort keeps insertion order within a priority
    public List<EmergencyContact> findAllByPriority() {
        return contacts.stream()
                .sorted(Comparator.comparingInt(EmergencyContact::getPriority))
                .collect(Collectors.toList());
    }

    public Optional<EmergencyContact> findById(String id) {
        return contacts.stream().filter(c -> c.getId().equals(id)).findFirst();
    }

    public EmergencyContact save(EmergencyContact contact) {
        contacts.add(contact);
        return contact;
    }

    public boolean deleteById(String id) {
        return contacts.removeIf(c -> c.getId().equals(id));
    }

    public int size() {
        return contacts.size();
    }
}
