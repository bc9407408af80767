package com.keyaccess.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keyaccess.domain.model.AccessDecision;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Respuesta al controlador ESP32 para un pase de tarjeta. Conserva la misma
 * forma en todos los códigos de estado.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwipeResponseDto {

    private String status;

    @JsonProperty("access_granted")
    private boolean accessGranted;

    private String action;

    private String faculty;

    private String message;

    @JsonProperty("denial_code")
    private String denialCode;

    @JsonProperty("denial_reason")
    private String denialReason;

    /**
     * Crea la respuesta desde una decisión (concedida o denegada).
     */
    public static SwipeResponseDto fromDecision(AccessDecision decision) {
        return SwipeResponseDto.builder()
                .status(decision.isGranted() ? "ok" : "error")
                .accessGranted(decision.isGranted())
                .action(decision.getAction().getWireValue())
                .faculty(decision.getFacultyName() != null ? decision.getFacultyName() : "")
                .message(decision.getMessage())
                .denialCode(decision.getDenialCode() != null ? decision.getDenialCode().name() : "")
                .denialReason(decision.getDenialReason() != null ? decision.getDenialReason() : "")
                .build();
    }

    /**
     * Crea una respuesta de error (solicitud inválida, búsqueda fallida o
     * fallo del servidor).
     */
    public static SwipeResponseDto error(String code, String message) {
        return SwipeResponseDto.builder()
                .status("error")
                .accessGranted(false)
                .action("")
                .faculty("")
                .message(message)
                .denialCode(code)
                .denialReason(message)
                .build();
    }
}
