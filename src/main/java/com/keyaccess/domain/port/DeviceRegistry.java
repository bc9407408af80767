package com.keyaccess.domain.port;

import com.keyaccess.domain.model.Device;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Puerto del registro de controladores ESP32.
 */
public interface DeviceRegistry {

    Optional<Device> findActiveByDeviceId(String deviceId);

    List<Device> findAllActive();

    /**
     * Actualiza solo el último latido y la dirección de red.
     */
    void touchHeartbeat(Long id, LocalDateTime heartbeatAt, String ipAddress);

    void updateFirmwareVersion(Long id, String firmwareVersion);
}
