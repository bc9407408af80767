package com.keyaccess.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keyaccess.domain.model.ScheduleWindow;
import com.keyaccess.domain.model.Weekdays;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Una fila del horario descargado por el controlador: una franja en un día.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleEntryDto {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private Long id;

    private String day;

    @JsonProperty("start_time")
    private String startTime;

    @JsonProperty("end_time")
    private String endTime;

    private String subject;

    @JsonProperty("faculty_name")
    private String facultyName;

    @JsonProperty("faculty_rfids")
    private List<String> facultyRfids;

    @JsonProperty("instructor_display")
    private String instructorDisplay;

    public static ScheduleEntryDto of(ScheduleWindow window, DayOfWeek day, List<String> badgeCodes) {
        return ScheduleEntryDto.builder()
                .id(window.getId())
                .day(Weekdays.wireName(day))
                .startTime(window.getStartTime().format(TIME_FORMAT))
                .endTime(window.getEndTime().format(TIME_FORMAT))
                .subject(window.getSubject() != null ? window.getSubject() : "")
                .facultyName(window.getFacultyName() != null ? window.getFacultyName() : "")
                .facultyRfids(badgeCodes)
                .instructorDisplay(window.getInstructorName() != null ? window.getInstructorName() : "")
                .build();
    }
}
