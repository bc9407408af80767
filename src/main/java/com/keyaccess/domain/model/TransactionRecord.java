package com.keyaccess.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Registro del libro de transacciones: una sesión de préstamo (abierta o
 * cerrada) o un intento denegado.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionRecord {

    private Long id;

    /** Referencia viva a la tarjeta; puede quedar null si se elimina */
    private Long credentialId;

    /** Referencia viva al laboratorio; puede quedar null si se elimina */
    private Long roomId;

    private TransactionSnapshot snapshot;

    private AcademicTerm term;

    private LocalDateTime openTime;

    private LocalDateTime closeTime;

    private boolean accessGranted;

    private DenialReason denialCode;

    private String denialReason;

    /** Franja que autorizó el acceso, si lo hubo */
    private Long scheduleWindowId;

    /**
     * Una sesión abierta significa que la llave está fuera del gabinete.
     */
    public boolean isOpen() {
        return accessGranted && closeTime == null;
    }

    public static TransactionRecord opened(Credential credential, Room room, AcademicTerm term,
            LocalDateTime openTime, Long scheduleWindowId) {
        return TransactionRecord.builder()
                .credentialId(credential.getId())
                .roomId(room.getId())
                .snapshot(TransactionSnapshot.of(credential, room, room.getCode()))
                .term(term)
                .openTime(openTime)
                .accessGranted(true)
                .scheduleWindowId(scheduleWindowId)
                .build();
    }

    public static TransactionRecord denied(Credential credential, Room room, String requestedRoomCode,
            AcademicTerm term, LocalDateTime attemptTime, DenialReason code, String reason) {
        return TransactionRecord.builder()
                .credentialId(credential.getId())
                .roomId(room != null ? room.getId() : null)
                .snapshot(TransactionSnapshot.of(credential, room, requestedRoomCode))
                .term(term)
                .openTime(attemptTime)
                .accessGranted(false)
                .denialCode(code)
                .denialReason(reason)
                .build();
    }
}
