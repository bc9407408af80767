package com.keyaccess.domain.model;

/**
 * Resultado de una escritura en el libro: la acción aplicada y el registro
 * insertado o cerrado.
 */
public record LedgerEntry(KeyAction action, TransactionRecord record) {
}
