package com.keyaccess.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entidad JPA que mapea a la tabla transaction_logs.
 *
 * <p>open_slot vale 1 únicamente en la sesión abierta de una tarjeta; en el
 * resto de filas es NULL. Como los NULL no colisionan en un índice único, la
 * restricción uq_transaction_open_session impide dos sesiones abiertas para la
 * misma tarjeta, laboratorio y periodo.
 */
@Entity
@Table(name = "transaction_logs",
        uniqueConstraints = @UniqueConstraint(name = "uq_transaction_open_session",
                columnNames = { "credential_id", "room_id", "academic_year", "semester", "open_slot" }),
        indexes = @Index(name = "idx_transaction_session",
                columnList = "credential_id, room_id, academic_year, semester, close_time"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionLogEntity {

    public static final Integer OPEN_SLOT = 1;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "credential_id")
    private Long credentialId;

    @Column(name = "room_id")
    private Long roomId;

    @Column(name = "faculty_name", length = 150)
    private String facultyName;

    @Column(name = "room_code", length = 10)
    private String roomCode;

    @Column(name = "rfid_code", length = 50)
    private String badgeCode;

    @Column(name = "academic_year", nullable = false, length = 20)
    private String academicYear;

    @Column(name = "semester", nullable = false, length = 10)
    private String semester;

    @Column(name = "open_time")
    private LocalDateTime openTime;

    @Column(name = "close_time")
    private LocalDateTime closeTime;

    @Column(name = "access_granted", nullable = false)
    private Boolean accessGranted;

    @Column(name = "denial_code", length = 40)
    private String denialCode;

    @Column(name = "denial_reason", length = 200)
    private String denialReason;

    @Column(name = "schedule_id")
    private Long scheduleWindowId;

    @Column(name = "open_slot")
    private Integer openSlot;
}
