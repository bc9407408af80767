package com.keyaccess.domain.port;

import com.keyaccess.domain.model.Credential;

import java.util.List;
import java.util.Optional;

/**
 * Puerto (interfaz) del directorio de tarjetas RFID.
 */
public interface CredentialDirectory {

    /**
     * Busca una tarjeta por su código, con su docente y laboratorio.
     *
     * @param badgeCode código de la tarjeta
     * @return Optional con la tarjeta si existe (activa o no)
     */
    Optional<Credential> findByBadgeCode(String badgeCode);

    /**
     * Obtiene los códigos de tarjetas activas que un docente tiene para un
     * laboratorio.
     *
     * @param facultyId id del docente
     * @param roomId    id del laboratorio
     * @return códigos ordenados
     */
    List<String> findActiveBadgeCodes(Long facultyId, Long roomId);
}
