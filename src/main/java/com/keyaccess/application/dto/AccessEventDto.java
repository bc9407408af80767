package com.keyaccess.application.dto;

import com.keyaccess.domain.model.AccessDecision;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Evento de acceso enviado al panel en tiempo real.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessEventDto {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private Long transactionId;
    private String badgeCode;
    private String roomCode;
    private String facultyName;
    private boolean granted;
    private String action;
    private String message;
    private String denialCode;
    private String timestamp;
    private String time;

    public static AccessEventDto fromDecision(AccessDecision decision, String badgeCode, String roomCode,
            LocalDateTime at) {
        return AccessEventDto.builder()
                .transactionId(decision.getTransactionId())
                .badgeCode(badgeCode)
                .roomCode(roomCode)
                .facultyName(decision.getFacultyName())
                .granted(decision.isGranted())
                .action(decision.getAction().getWireValue())
                .message(decision.getMessage())
                .denialCode(decision.getDenialCode() != null ? decision.getDenialCode().name() : null)
                .timestamp(at.toString())
                .time(at.format(TIME_FORMAT))
                .build();
    }
}
