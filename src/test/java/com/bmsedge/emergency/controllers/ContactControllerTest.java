package com.bmsedge.emergency.controllers;

import com.bmsedge.emergency.model.EmergencyContact;
import com.bmsedge.emergency.service.EmergencyResponseService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ContactController.class)
class ContactControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EmergencyResponseService emergencyResponseService;

    @Test
    void shouldListContacts() throws Exception {
        when(emergencyResponseService.getEmergencyContacts()).thenReturn(List.of(
                EmergencyContact.builder().id("sos").name("SOS Alarm").number("112").type("emergency").priority(1).build()));

        mockMvc.perform(get("/api/contacts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("sos"));
    }

    @Test
    void shouldCreateContact() throws Exception {
        when(emergencyResponseService.addEmergencyContact(any())).thenReturn(Optional.of(
                EmergencyContact.builder().id("contact_1").name("Sofia").number("+46-70-222-3344")
                        .type("family").priority(5).build()));

        mockMvc.perform(post("/api/contacts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Sofia\",\"number\":\"+46-70-222-3344\",\"type\":\"family\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("contact_1"));
    }

    @Test
    void shouldRejectContactWithPriorityOutOfRange() throws Exception {
        mockMvc.perform(post("/api/contacts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Sofia\",\"number\":\"1\",\"type\":\"family\",\"priority\":11}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void shouldDeleteContactOrReportMissing() throws Exception {
        when(emergencyResponseService.removeEmergencyContact("neighbor1")).thenReturn(true);
        when(emergencyResponseService.removeEmergencyContact("nobody")).thenReturn(false);

        mockMvc.perform(delete("/api/contacts/{id}", "neighbor1"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/contacts/{id}", "nobody"))
                .andExpect(status().isNotFound());
    }
}
