package com.keyaccess.application.scheduler;

import com.keyaccess.application.dto.DeviceStatusDto;
import com.keyaccess.application.service.DeviceHeartbeatService;
import com.keyaccess.presentation.websocket.AccessWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Job programado que recalcula el estado de los controladores y notifica al
 * panel solo cuando uno cambia entre en línea y fuera de línea.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeviceStatusMonitor {

    private final DeviceHeartbeatService heartbeatService;
    private final AccessWebSocketHandler webSocketHandler;

    // Último estado conocido por identificador de hardware
    private final Map<String, Boolean> lastKnownStatus = new ConcurrentHashMap<>();

    @Scheduled(fixedDelayString = "${devices.status-check-interval-ms:10000}",
            initialDelayString = "${devices.status-check-interval-ms:10000}")
    public void checkDeviceStatus() {
        try {
            List<DeviceStatusDto> statuses = heartbeatService.deviceStatuses();
            int transitions = 0;
            for (DeviceStatusDto status : statuses) {
                Boolean previous = lastKnownStatus.put(status.getDeviceId(), status.isOnline());
                if (previous != null && previous != status.isOnline()) {
                    transitions++;
                    log.info("Dispositivo {} ({}) ahora está {}", status.getDeviceName(), status.getRoomCode(),
                            status.getStatusText());
                    webSocketHandler.broadcastDeviceStatus(status);
                }
            }
            lastKnownStatus.keySet().retainAll(statuses.stream()
                    .map(DeviceStatusDto::getDeviceId)
                    .collect(Collectors.toList()));
            log.debug("Estado de {} dispositivos verificado ({} cambios)", statuses.size(), transitions);
        } catch (Exception e) {
            log.error("Error verificando estado de dispositivos: {}", e.getMessage(), e);
        }
    }

    /**
     * Último estado conocido de un dispositivo, o null si aún no se evaluó.
     */
    public Boolean lastKnownStatus(String deviceId) {
        return lastKnownStatus.get(deviceId);
    }
}
