package com.keyaccess.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resultado de evaluar un pase de tarjeta.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessDecision {

    private boolean granted;

    @Builder.Default
    private KeyAction action = KeyAction.NONE;

    private String facultyName;

    private String message;

    /** Código del motivo de denegación; null si se concedió */
    private DenialReason denialCode;

    /** Texto legible del motivo de denegación; null si se concedió */
    private String denialReason;

    private Long authorizingWindowId;

    /** Registro del libro creado o cerrado por esta decisión */
    private Long transactionId;
}
