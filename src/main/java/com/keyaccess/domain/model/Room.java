package com.keyaccess.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Modelo de dominio que representa un laboratorio cuyo gabinete de llaves
 * está controlado por el sistema.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Room {

    private Long id;

    /** Código único del laboratorio (ej: "203") */
    private String code;

    private String description;

    /** Un laboratorio inactivo bloquea todas las decisiones de acceso */
    private boolean active;
}
