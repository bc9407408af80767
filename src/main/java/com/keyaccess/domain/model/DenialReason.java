package com.keyaccess.domain.model;

/**
 * Códigos de motivo de una decisión de acceso denegada o fallida.
 */
public enum DenialReason {

    /** La tarjeta no existe (fallo de búsqueda, no se registra en el libro) */
    CREDENTIAL_UNKNOWN,

    /** La tarjeta existe pero está desactivada */
    CREDENTIAL_INACTIVE,

    /** El laboratorio no existe (fallo de búsqueda, no se registra en el libro) */
    ROOM_UNKNOWN,

    /** El laboratorio existe pero está desactivado */
    ROOM_INACTIVE,

    /** Hay horario para hoy pero la hora actual queda fuera de él */
    OUTSIDE_SCHEDULED_TIME,

    /** Ningún horario del docente en este laboratorio cubre el día de hoy */
    NO_SCHEDULE_TODAY,

    /** Acceso denegado por el controlador mientras estaba sin conexión */
    DENIED_OFFLINE
}
