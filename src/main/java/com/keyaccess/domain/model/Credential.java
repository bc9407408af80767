package com.keyaccess.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registro de una tarjeta RFID: vincula un código de tarjeta con exactamente
 * un par (docente, laboratorio).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Credential {

    private Long id;

    /** Código de la tarjeta, único en todo el sistema */
    private String badgeCode;

    private Faculty faculty;

    private Room room;

    private boolean active;

    /**
     * Nombre del docente para mostrar en respuestas y registros.
     *
     * @return nombre completo, o el id institucional si no tiene nombre
     */
    public String facultyDisplayName() {
        if (faculty == null) {
            return "";
        }
        String name = faculty.getFullName();
        return name != null && !name.isBlank() ? name : faculty.getSchoolId();
    }
}
