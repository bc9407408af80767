package com.keyaccess.domain.port;

import com.keyaccess.domain.model.AcademicTerm;

import java.time.LocalDateTime;

/**
 * Acceso de solo lectura al periodo académico vigente. Cada decisión lo lee una
 * vez al comenzar.
 */
public interface TermProvider {

    /**
     * @return periodo vigente (se crea con valores por defecto si no existe)
     */
    AcademicTerm currentTerm();

    /**
     * @return instante del último cambio de periodo
     */
    LocalDateTime lastChangedAt();
}
