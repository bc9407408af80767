package com.keyaccess.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Comando manual de apertura/cierre emitido por el personal. No se marca como
 * consumido: los controladores lo leen mientras sea reciente.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualCommand {

    private Long id;

    private Long roomId;

    private String roomCode;

    private String staffName;

    private DoorAction action;

    private String notes;

    private LocalDateTime createdAt;
}
