package com.keyaccess.domain.exception;

/**
 * Excepción lanzada cuando falla la escritura del espejo CSV de auditoría.
 */
public class CsvProcessingException extends RuntimeException {

    public CsvProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Excepción cuando no se puede escribir al archivo.
     */
    public static CsvProcessingException cannotWrite(String filePath, Throwable cause) {
        return new CsvProcessingException("No se puede escribir al archivo: " + filePath, cause);
    }
}
