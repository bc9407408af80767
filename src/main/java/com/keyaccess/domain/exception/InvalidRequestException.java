package com.keyaccess.domain.exception;

/**
 * Excepción lanzada cuando una solicitud llega incompleta o mal formada. Nunca
 * se registra como intento de acceso.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }

    /**
     * Excepción cuando falta un parámetro obligatorio.
     */
    public static InvalidRequestException missingParameter(String name) {
        return new InvalidRequestException("Falta el parámetro '" + name + "'");
    }

    /**
     * Excepción cuando un parámetro tiene un valor no admitido.
     */
    public static InvalidRequestException invalidValue(String name, String value) {
        return new InvalidRequestException(
                String.format("Valor inválido para '%s': %s", name, value));
    }
}
