package com.keyaccess.application.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Solicitud del personal para abrir o cerrar una puerta.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualCommandRequest {

    private String room;

    private String staff;

    private String action;

    private String notes;
}
