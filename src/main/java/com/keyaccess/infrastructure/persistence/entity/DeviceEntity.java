package com.keyaccess.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entidad JPA que mapea a la tabla esp32_devices.
 */
@Entity
@Table(name = "esp32_devices")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "device_name", unique = true, nullable = false, length = 50)
    private String deviceName;

    @Column(name = "device_id", unique = true, nullable = false, length = 100)
    private String deviceId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "room_id")
    private RoomEntity room;

    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "last_heartbeat")
    private LocalDateTime lastHeartbeat;

    @Column(name = "is_active", nullable = false)
    private Boolean active;

    @Column(name = "firmware_version", length = 20)
    private String firmwareVersion;
}
