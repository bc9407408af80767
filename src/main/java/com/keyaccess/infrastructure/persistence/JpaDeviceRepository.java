package com.keyaccess.infrastructure.persistence;

import com.keyaccess.infrastructure.persistence.entity.DeviceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repositorio JPA para operaciones con esp32_devices.
 */
@Repository
public interface JpaDeviceRepository extends JpaRepository<DeviceEntity, Long> {

    @Query("SELECT d FROM DeviceEntity d LEFT JOIN FETCH d.room WHERE d.deviceId = :deviceId AND d.active = true")
    Optional<DeviceEntity> findActiveByDeviceId(@Param("deviceId") String deviceId);

    @Query("SELECT d FROM DeviceEntity d LEFT JOIN FETCH d.room WHERE d.active = true ORDER BY d.deviceName ASC")
    List<DeviceEntity> findAllActive();

    /**
     * Actualiza solo latido e IP, sin tocar el resto de la fila.
     */
    @Modifying
    @Query("UPDATE DeviceEntity d SET d.lastHeartbeat = :heartbeat, d.ipAddress = :ip WHERE d.id = :id")
    int touchHeartbeat(@Param("id") Long id,
            @Param("heartbeat") LocalDateTime heartbeat,
            @Param("ip") String ipAddress);

    @Modifying
    @Query("UPDATE DeviceEntity d SET d.firmwareVersion = :version WHERE d.id = :id")
    int updateFirmwareVersion(@Param("id") Long id, @Param("version") String firmwareVersion);
}
