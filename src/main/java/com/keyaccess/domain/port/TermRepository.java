package com.keyaccess.domain.port;

import com.keyaccess.domain.model.AcademicTerm;
import com.keyaccess.domain.model.TermState;

/**
 * Puerto de persistencia del registro único de periodo.
 */
public interface TermRepository {

    /**
     * Obtiene el registro único, creándolo con los valores dados si no existe.
     *
     * @param defaults periodo inicial si hay que crearlo
     * @return estado actual
     */
    TermState getOrCreate(AcademicTerm defaults);

    /**
     * Reemplaza el periodo vigente en una sola escritura atómica.
     *
     * @param term nuevo periodo
     * @return estado resultante
     */
    TermState update(AcademicTerm term);
}
