package com.keyaccess.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Modelo de dominio que representa a un docente.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Faculty {

    private Long id;

    /** Identificador institucional único */
    private String schoolId;

    private String fullName;

    private String department;

    private boolean active;
}
