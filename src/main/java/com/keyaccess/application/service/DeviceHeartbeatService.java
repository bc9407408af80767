package com.keyaccess.application.service;

import com.keyaccess.application.dto.DeviceStatusDto;
import com.keyaccess.domain.exception.InvalidRequestException;
import com.keyaccess.domain.exception.LookupException;
import com.keyaccess.domain.model.AcademicTerm;
import com.keyaccess.domain.model.Device;
import com.keyaccess.domain.port.DeviceRegistry;
import com.keyaccess.domain.port.ScheduleStore;
import com.keyaccess.domain.port.TermProvider;
import com.keyaccess.presentation.websocket.AccessWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Recepción de latidos de los controladores ESP32 y cálculo de su estado.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceHeartbeatService {

    private final DeviceRegistry deviceRegistry;
    private final ScheduleStore scheduleStore;
    private final TermProvider termProvider;
    private final AccessWebSocketHandler webSocketHandler;
    private final Clock clock;

    /**
     * Registra un latido. Solo se escriben el último latido y la IP; la
     * versión de firmware únicamente cuando llega y es distinta.
     *
     * @param deviceId        identificador de hardware (MAC)
     * @param firmwareVersion versión informada, opcional
     * @param ipAddress       dirección de origen
     * @return dispositivo actualizado
     * @throws LookupException si el dispositivo no está registrado o activo
     */
    public Device heartbeat(String deviceId, String firmwareVersion, String ipAddress) {
        if (deviceId == null || deviceId.isBlank()) {
            throw InvalidRequestException.missingParameter("device_id");
        }
        String hardwareId = deviceId.trim();

        Device device = deviceRegistry.findActiveByDeviceId(hardwareId).orElseThrow(() -> {
            log.warn("Latido de dispositivo no registrado: {} desde {}", hardwareId, ipAddress);
            webSocketHandler.broadcastUnregisteredDevice(hardwareId, ipAddress);
            return LookupException.deviceUnregistered(hardwareId);
        });

        LocalDateTime now = LocalDateTime.now(clock);
        deviceRegistry.touchHeartbeat(device.getId(), now, ipAddress);
        device.setLastHeartbeat(now);
        device.setIpAddress(ipAddress);

        if (firmwareVersion != null && !firmwareVersion.isBlank()
                && !Objects.equals(firmwareVersion.trim(), device.getFirmwareVersion())) {
            deviceRegistry.updateFirmwareVersion(device.getId(), firmwareVersion.trim());
            log.info("Firmware de {} actualizado: {} -> {}", device.getDeviceName(),
                    device.getFirmwareVersion(), firmwareVersion.trim());
            device.setFirmwareVersion(firmwareVersion.trim());
        }

        log.debug("Latido de {} ({}) - IP: {}", device.getDeviceName(), hardwareId, ipAddress);
        return device;
    }

    /**
     * Estado de todos los dispositivos activos, con el número de franjas de su
     * laboratorio en el semestre vigente.
     */
    public List<DeviceStatusDto> deviceStatuses() {
        LocalDateTime now = LocalDateTime.now(clock);
        AcademicTerm term = termProvider.currentTerm();

        return deviceRegistry.findAllActive()
                .stream()
                .map(device -> DeviceStatusDto.fromDomain(device, now,
                        device.getRoomId() != null
                                ? scheduleStore.countActiveWindows(device.getRoomId(), term.semester())
                                : 0))
                .collect(Collectors.toList());
    }
}
