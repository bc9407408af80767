package com.keyaccess.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Horario completo de un laboratorio para el periodo vigente, en el formato que
 * el controlador guarda en caché.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleDownloadDto {

    private String status;

    @JsonProperty("room_code")
    private String roomCode;

    private String semester;

    @JsonProperty("academic_year")
    private String academicYear;

    @JsonProperty("schedule_count")
    private int scheduleCount;

    private List<ScheduleEntryDto> schedules;

    @JsonProperty("last_updated")
    private String lastUpdated;

    @JsonProperty("server_time")
    private String serverTime;

    /** Día actual del servidor ("monday") */
    @JsonProperty("day_of_week")
    private String dayOfWeek;
}
