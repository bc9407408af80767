package com.keyaccess.domain.model;

/**
 * Copia inmutable de los datos de docente, laboratorio y tarjeta tomada al
 * momento de escribir un registro. Conserva el historial aunque la tarjeta o el
 * laboratorio se eliminen después; nunca se recalcula.
 */
public record TransactionSnapshot(String facultyName, String roomCode, String badgeCode) {

    public static TransactionSnapshot of(Credential credential, Room room, String requestedRoomCode) {
        return new TransactionSnapshot(
                credential.facultyDisplayName(),
                room != null ? room.getCode() : requestedRoomCode,
                credential.getBadgeCode());
    }
}
