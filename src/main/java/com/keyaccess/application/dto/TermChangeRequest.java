package com.keyaccess.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Solicitud de cambio del periodo académico vigente.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TermChangeRequest {

    @JsonProperty("academic_year")
    private String academicYear;

    private String semester;
}
