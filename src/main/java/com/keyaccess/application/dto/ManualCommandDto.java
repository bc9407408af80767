package com.keyaccess.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keyaccess.domain.model.ManualCommand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO de un comando manual emitido por el personal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualCommandDto {

    private Long id;

    private String room;

    private String staff;

    private String action;

    private String notes;

    @JsonProperty("created_at")
    private String createdAt;

    public static ManualCommandDto fromDomain(ManualCommand command) {
        return ManualCommandDto.builder()
                .id(command.getId())
                .room(command.getRoomCode())
                .staff(command.getStaffName())
                .action(command.getAction().getWireValue())
                .notes(command.getNotes())
                .createdAt(command.getCreatedAt().toString())
                .build();
    }
}
