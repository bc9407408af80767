package com.keyaccess.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keyaccess.domain.model.Device;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Estado de un controlador para el panel del personal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceStatusDto {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @JsonProperty("device_id")
    private String deviceId;

    @JsonProperty("device_name")
    private String deviceName;

    @JsonProperty("room_code")
    private String roomCode;

    private boolean online;

    @JsonProperty("status_text")
    private String statusText;

    @JsonProperty("last_seen")
    private String lastSeen;

    @JsonProperty("ip_address")
    private String ipAddress;

    @JsonProperty("firmware_version")
    private String firmwareVersion;

    @JsonProperty("schedule_count")
    private long scheduleCount;

    /**
     * Crea un DTO desde el dispositivo evaluado en el instante dado.
     */
    public static DeviceStatusDto fromDomain(Device device, LocalDateTime now, long scheduleCount) {
        boolean online = device.isOnline(now);
        return DeviceStatusDto.builder()
                .deviceId(device.getDeviceId())
                .deviceName(device.getDeviceName())
                .roomCode(device.getRoomCode() != null ? device.getRoomCode() : "Sin asignar")
                .online(online)
                .statusText(online ? "En línea" : "Fuera de línea")
                .lastSeen(device.getLastHeartbeat() != null
                        ? device.getLastHeartbeat().format(TIMESTAMP_FORMAT)
                        : "Nunca")
                .ipAddress(device.getIpAddress())
                .firmwareVersion(device.getFirmwareVersion())
                .scheduleCount(scheduleCount)
                .build();
    }
}
