package com.keyaccess.presentation.controller;

import com.keyaccess.application.service.ScheduleSyncService;
import com.keyaccess.domain.exception.LookupException;
import com.keyaccess.domain.model.AcademicTerm;
import com.keyaccess.domain.model.KeyAction;
import com.keyaccess.domain.model.LedgerEntry;
import com.keyaccess.domain.model.TransactionRecord;
import com.keyaccess.domain.port.TermProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ScheduleSyncController.class)
@Import(ScheduleSyncControllerTest.FixedClockConfig.class)
class ScheduleSyncControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScheduleSyncService scheduleSyncService;

    @MockBean
    private TermProvider termProvider;

    @Test
    @DisplayName("La consulta de cambios informa el periodo vigente")
    void checkUpdates() throws Exception {
        when(scheduleSyncService.needsUpdate("203", "2025-01-06T08:00:00")).thenReturn(true);
        when(termProvider.currentTerm()).thenReturn(new AcademicTerm("2025-2026", "1st"));

        mockMvc.perform(get("/api/esp32/check-updates").param("room", "203").param("last_sync", "2025-01-06T08:00:00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.needs_update").value(true))
                .andExpect(jsonPath("$.current_semester").value("1st"))
                .andExpect(jsonPath("$.current_ay").value("2025-2026"))
                .andExpect(jsonPath("$.server_time").value("2025-01-06T09:00"));
    }

    @Test
    @DisplayName("El registro sin conexión devuelve el id y la acción aplicada")
    void logOffline() throws Exception {
        when(scheduleSyncService.logOfflineAccess(any())).thenReturn(
                new LedgerEntry(KeyAction.RETURN, TransactionRecord.builder().id(42L).build()));

        mockMvc.perform(post("/api/esp32/log-offline")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"room_code\":\"203\",\"rfid_code\":\"RFID-001\",\"access_granted\":true,"
                                + "\"timestamp\":\"2025-01-06T08:30:00\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.transaction_id").value(42))
                .andExpect(jsonPath("$.action").value("return"));
    }

    @Test
    @DisplayName("Un laboratorio desconocido responde 404")
    void unknownRoom() throws Exception {
        when(scheduleSyncService.downloadSchedule("999")).thenThrow(LookupException.roomUnknown("999"));

        mockMvc.perform(get("/api/esp32/schedules").param("room", "999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ROOM_UNKNOWN"));
    }

    @TestConfiguration
    static class FixedClockConfig {

        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2025-01-06T09:00:00Z"), ZoneOffset.UTC);
        }
    }
}
