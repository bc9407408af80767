package com.keyaccess.domain.exception;

import lombok.Getter;

/**
 * Excepción lanzada cuando una tarjeta, laboratorio o dispositivo no existe.
 * Se informa al llamador con un código específico y no se escribe en el libro
 * de transacciones.
 */
@Getter
public class LookupException extends RuntimeException {

    public static final String CREDENTIAL_UNKNOWN = "CREDENTIAL_UNKNOWN";
    public static final String ROOM_UNKNOWN = "ROOM_UNKNOWN";
    public static final String DEVICE_UNREGISTERED = "DEVICE_UNREGISTERED";

    private final String code;

    /** Valor recibido que no se pudo resolver */
    private final String value;

    public LookupException(String code, String value, String message) {
        super(message);
        this.code = code;
        this.value = value;
    }

    /**
     * Excepción cuando la tarjeta no está registrada.
     */
    public static LookupException credentialUnknown(String badgeCode) {
        return new LookupException(CREDENTIAL_UNKNOWN, badgeCode, "Tarjeta RFID no registrada");
    }

    /**
     * Excepción cuando el laboratorio no existe.
     */
    public static LookupException roomUnknown(String roomCode) {
        return new LookupException(ROOM_UNKNOWN, roomCode,
                "Laboratorio " + roomCode + " no encontrado o inactivo");
    }

    /**
     * Excepción cuando el dispositivo no está registrado o está desactivado.
     */
    public static LookupException deviceUnregistered(String deviceId) {
        return new LookupException(DEVICE_UNREGISTERED, deviceId, "Dispositivo no registrado o inactivo");
    }
}
