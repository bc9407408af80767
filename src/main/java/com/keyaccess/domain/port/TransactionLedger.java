package com.keyaccess.domain.port;

import com.keyaccess.domain.model.AcademicTerm;
import com.keyaccess.domain.model.TransactionRecord;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Puerto de persistencia del libro de transacciones. Las operaciones de
 * escritura deben ejecutarse dentro de una transacción abierta por el llamador.
 */
public interface TransactionLedger {

    /**
     * Bloquea la fila de la tarjeta hasta el fin de la transacción para
     * serializar los pases concurrentes de la misma tarjeta.
     *
     * @param credentialId id de la tarjeta
     */
    void lockSession(Long credentialId);

    /**
     * Busca la sesión abierta (concedida y sin cierre) de una tarjeta en un
     * laboratorio y periodo.
     */
    Optional<TransactionRecord> findOpen(Long credentialId, Long roomId, AcademicTerm term);

    /**
     * Verifica si una sesión concedida se abrió después del instante dado o se
     * cerró en él o después.
     */
    boolean existsGrantedActivityAfter(Long credentialId, Long roomId, AcademicTerm term, LocalDateTime instant);

    /**
     * Inserta un registro nuevo.
     *
     * @return registro guardado con su id
     */
    TransactionRecord insert(TransactionRecord record);

    /**
     * Cierra una sesión abierta. Es la única mutación permitida sobre registros
     * existentes.
     *
     * @return registro cerrado
     */
    TransactionRecord close(Long transactionId, LocalDateTime closeTime);

    /**
     * Cuenta las sesiones abiertas en todo el sistema (llaves fuera).
     */
    long countOpenSessions();
}
