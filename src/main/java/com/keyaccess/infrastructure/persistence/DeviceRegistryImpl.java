package com.keyaccess.infrastructure.persistence;

import com.keyaccess.domain.model.Device;
import com.keyaccess.domain.port.DeviceRegistry;
import com.keyaccess.infrastructure.persistence.entity.DeviceEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Implementación del puerto DeviceRegistry usando JPA.
 */
@Component
@RequiredArgsConstructor
public class DeviceRegistryImpl implements DeviceRegistry {

    private final JpaDeviceRepository deviceRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Device> findActiveByDeviceId(String deviceId) {
        return deviceRepository.findActiveByDeviceId(deviceId).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Device> findAllActive() {
        return deviceRepository.findAllActive()
                .stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public void touchHeartbeat(Long id, LocalDateTime heartbeatAt, String ipAddress) {
        deviceRepository.touchHeartbeat(id, heartbeatAt, ipAddress);
    }

    @Override
    @Transactional
    public void updateFirmwareVersion(Long id, String firmwareVersion) {
        deviceRepository.updateFirmwareVersion(id, firmwareVersion);
    }

    private Device toDomain(DeviceEntity entity) {
        return Device.builder()
                .id(entity.getId())
                .deviceId(entity.getDeviceId())
                .deviceName(entity.getDeviceName())
                .roomId(entity.getRoom() != null ? entity.getRoom().getId() : null)
                .roomCode(entity.getRoom() != null ? entity.getRoom().getCode() : null)
                .ipAddress(entity.getIpAddress())
                .lastHeartbeat(entity.getLastHeartbeat())
                .firmwareVersion(entity.getFirmwareVersion())
                .active(Boolean.TRUE.equals(entity.getActive()))
                .build();
    }
}
