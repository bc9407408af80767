package com.keyaccess.application.scheduler;

import com.keyaccess.application.dto.DeviceStatusDto;
import com.keyaccess.application.service.DeviceHeartbeatService;
import com.keyaccess.presentation.websocket.AccessWebSocketHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeviceStatusMonitorTest {

    @Mock
    private DeviceHeartbeatService heartbeatService;

    @Mock
    private AccessWebSocketHandler webSocketHandler;

    private DeviceStatusMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new DeviceStatusMonitor(heartbeatService, webSocketHandler);
    }

    @Test
    @DisplayName("La primera evaluación solo registra el estado, sin notificar")
    void firstCheckRecordsWithoutBroadcast() {
        when(heartbeatService.deviceStatuses()).thenReturn(List.of(status(true)));

        monitor.checkDeviceStatus();

        assertThat(monitor.lastKnownStatus("AA")).isTrue();
        verify(webSocketHandler, never()).broadcastDeviceStatus(any());
    }

    @Test
    @DisplayName("Se notifica solo cuando el dispositivo cambia de estado")
    void broadcastsOnlyOnTransition() {
        DeviceStatusDto offline = status(false);
        when(heartbeatService.deviceStatuses())
                .thenReturn(List.of(status(true)))
                .thenReturn(List.of(status(true)))
                .thenReturn(List.of(offline))
                .thenReturn(List.of(status(false)));

        monitor.checkDeviceStatus();
        monitor.checkDeviceStatus();
        monitor.checkDeviceStatus();
        monitor.checkDeviceStatus();

        verify(webSocketHandler, times(1)).broadcastDeviceStatus(any());
        verify(webSocketHandler).broadcastDeviceStatus(offline);
        assertThat(monitor.lastKnownStatus("AA")).isFalse();
    }

    @Test
    @DisplayName("Un error al consultar no detiene el job")
    void failureIsLogged() {
        when(heartbeatService.deviceStatuses()).thenThrow(new IllegalStateException("sin conexión"));

        monitor.checkDeviceStatus();

        assertThat(monitor.lastKnownStatus("AA")).isNull();
    }

    private DeviceStatusDto status(boolean online) {
        return DeviceStatusDto.builder()
                .deviceId("AA")
                .deviceName("ESP32-203")
                .roomCode("203")
                .online(online)
                .statusText(online ? "En línea" : "Fuera de línea")
                .build();
    }
}
