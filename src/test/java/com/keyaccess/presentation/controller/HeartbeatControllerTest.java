package com.keyaccess.presentation.controller;

import com.keyaccess.application.service.DeviceHeartbeatService;
import com.keyaccess.domain.exception.LookupException;
import com.keyaccess.domain.model.Device;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HeartbeatController.class)
class HeartbeatControllerTest {

    private static final String MAC = "AA:BB:CC:DD:EE:FF";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DeviceHeartbeatService heartbeatService;

    @Test
    @DisplayName("Latido por parámetros de consulta")
    void queryParameters() throws Exception {
        when(heartbeatService.heartbeat(eq(MAC), eq("1.2.0"), anyString())).thenReturn(device());

        mockMvc.perform(get("/api/esp32/heartbeat").param("device_id", MAC).param("firmware_version", "1.2.0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.device_name").value("ESP32-203"))
                .andExpect(jsonPath("$.room").value("203"))
                .andExpect(jsonPath("$.timestamp").value("2025-01-06T09:00"));
    }

    @Test
    @DisplayName("Latido por formulario POST")
    void formEncoded() throws Exception {
        when(heartbeatService.heartbeat(eq(MAC), isNull(), anyString())).thenReturn(device());

        mockMvc.perform(post("/api/esp32/heartbeat")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("device_id", MAC))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));
    }

    @Test
    @DisplayName("Latido por cuerpo JSON con IP reenviada")
    void jsonBody() throws Exception {
        when(heartbeatService.heartbeat(MAC, "1.3.0", "203.0.113.5")).thenReturn(device());

        mockMvc.perform(post("/api/esp32/heartbeat")
                        .header("X-Forwarded-For", "203.0.113.5, 10.0.0.1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"device_id\":\"" + MAC + "\",\"firmware_version\":\"1.3.0\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.device_name").value("ESP32-203"));

        verify(heartbeatService).heartbeat(MAC, "1.3.0", "203.0.113.5");
    }

    @Test
    @DisplayName("Sin device_id responde 400 con sugerencia")
    void missingDeviceId() throws Exception {
        mockMvc.perform(post("/api/esp32/heartbeat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"firmware_version\":\"1.3.0\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.hint").exists());

        verify(heartbeatService, never()).heartbeat(any(), any(), any());
    }

    @Test
    @DisplayName("Un dispositivo no registrado responde 404 con el identificador recibido")
    void unregisteredDevice() throws Exception {
        when(heartbeatService.heartbeat(eq("11:22:33:44:55:66"), isNull(), anyString()))
                .thenThrow(LookupException.deviceUnregistered("11:22:33:44:55:66"));

        mockMvc.perform(get("/api/esp32/heartbeat").param("device_id", "11:22:33:44:55:66"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("DEVICE_UNREGISTERED"))
                .andExpect(jsonPath("$.device_id_received").value("11:22:33:44:55:66"));
    }

    private Device device() {
        return Device.builder()
                .id(1L)
                .deviceId(MAC)
                .deviceName("ESP32-203")
                .roomCode("203")
                .lastHeartbeat(LocalDateTime.of(2025, 1, 6, 9, 0))
                .active(true)
                .build();
    }
}
