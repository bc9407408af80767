package com.keyaccess.domain.port;

import com.keyaccess.domain.model.ManualCommand;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Puerto del almacén de comandos manuales (solo inserciones).
 */
public interface ManualCommandStore {

    ManualCommand append(ManualCommand command);

    /**
     * Comando más reciente de un laboratorio creado en o después del instante
     * dado.
     */
    Optional<ManualCommand> findLatestSince(String roomCode, LocalDateTime since);
}
