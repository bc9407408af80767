package com.keyaccess.domain.port;

import com.keyaccess.domain.model.KeyAction;
import com.keyaccess.domain.model.TransactionRecord;

/**
 * Puerto para el espejo de auditoría de las escrituras del libro.
 */
public interface AuditTrailWriter {

    /**
     * Agrega una línea por cada registro insertado o cerrado.
     *
     * @param record registro tal como quedó guardado
     * @param action acción aplicada (borrow, return o ninguna)
     */
    void append(TransactionRecord record, KeyAction action);
}
