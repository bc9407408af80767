package com.keyaccess.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Controlador ESP32 registrado en el sistema.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Device {

    /** Umbral fijo de vida: un latido dentro de este intervalo indica en línea */
    public static final Duration ONLINE_THRESHOLD = Duration.ofSeconds(30);

    private Long id;

    /** Identificador de hardware (MAC) */
    private String deviceId;

    private String deviceName;

    private Long roomId;

    private String roomCode;

    private String ipAddress;

    private LocalDateTime lastHeartbeat;

    private String firmwareVersion;

    private boolean active;

    /**
     * Un dispositivo está en línea si su último latido ocurrió hace 30 segundos
     * o menos. Sin latido, está fuera de línea.
     *
     * @param now instante de referencia
     * @return true si está en línea
     */
    public boolean isOnline(LocalDateTime now) {
        if (lastHeartbeat == null) {
            return false;
        }
        return Duration.between(lastHeartbeat, now).compareTo(ONLINE_THRESHOLD) <= 0;
    }
}
