package com.bmsedge.emergency.controllers;

import com.bmsedge.emergency.dto.EmergencyContactDTO;
import com.bmsedge.emergency.model.EmergencyContact;
import com.bmsedge.emergency.service.EmergencyResponseService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

import static com.bmsedge.emergency.exception.GlobalExceptionHandler.notFound;

@RestController
@RequestMapping("/api/contacts")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ContactController {

    private final EmergencyResponseService emergencyResponseService;

    // Ascending priority
    @GetMapping
    public ResponseEntity<List<EmergencyContact>> getContacts() {
        return ResponseEntity.ok(emergencyResponseService.getEmergencyContacts());
    }

    @PostMapping
    public ResponseEntity<?> addContact(@Valid @RequestBody EmergencyContactDTO dto) {
        Optional<EmergencyContact> contact = emergencyResponseService.addEmergencyContact(dto);
        if (contact.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(contact.get());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> removeContact(@PathVariable String id) {
        if (!emergencyResponseService.removeEmergencyContact(id)) {
            return notFound("Contact not found: " + id);
        }
        return ResponseEntity.noContent().build();
    }
}
