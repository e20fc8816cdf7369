package com.bmsedge.emergency.controllers;

import com.bmsedge.emergency.dto.PowerBackupStatusDTO;
import com.bmsedge.emergency.model.enums.BackupOverallStatus;
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

@WebMvcTest(PowerBackupController.class)
class PowerBackupControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EmergencyResponseService emergencyResponseService;

    @Test
    void shouldReportRestoreWithoutOpenIncident() throws Exception {
        when(emergencyResponseService.handlePowerRestored()).thenReturn(Optional.empty());
        when(emergencyResponseService.getPowerBackupStatus()).thenReturn(PowerBackupStatusDTO.builder()
                .overallStatus(BackupOverallStatus.OPTIMAL)
                .mainsAvailable(true)
                .units(List.of())
                .build());

        mockMvc.perform(post("/api/power/restored"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.incidentResolved").value(false))
                .andExpect(jsonPath("$.status.mainsAvailable").value(true));
    }

    @Test
    void shouldRejectMissingLevel() throws Exception {
        mockMvc.perform(put("/api/power/units/{id}/level", "ups_main")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verify(emergencyResponseService, never()).reportBackupLevel(any(), any());
    }

    @Test
    void shouldReturnNotFoundForUnknownUnit() throws Exception {
        when(emergencyResponseService.reportBackupLevel(eq("solar_roof"), any())).thenReturn(Optional.empty());

        mockMvc.perform(put("/api/power/units/{id}/level", "solar_roof")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"level\":40}"))
                .andExpect(status().isNotFound());
    }
}
