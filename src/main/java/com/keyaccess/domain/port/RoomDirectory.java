package com.keyaccess.domain.port;

import com.keyaccess.domain.model.Room;

import java.util.Optional;

/**
 * Puerto para la búsqueda de laboratorios.
 */
public interface RoomDirectory {

    /**
     * Busca un laboratorio por su código, esté activo o no.
     *
     * @param code código del laboratorio
     * @return Optional con el laboratorio si existe
     */
    Optional<Room> findByCode(String code);
}
