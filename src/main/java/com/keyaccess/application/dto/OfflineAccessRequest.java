package com.keyaccess.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Evento de acceso decidido por un controlador sin conexión, enviado al
 * recuperar la red.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OfflineAccessRequest {

    @JsonProperty("room_code")
    private String roomCode;

    @JsonProperty("rfid_code")
    private String rfidCode;

    @JsonProperty("access_granted")
    private Boolean accessGranted;

    /** Momento en que ocurrió el acceso, en formato ISO-8601 */
    private String timestamp;
}
