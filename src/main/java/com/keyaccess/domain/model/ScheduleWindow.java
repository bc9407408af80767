package com.keyaccess.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Franja semanal recurrente durante la cual un docente puede retirar la llave
 * de un laboratorio. Varios días en una misma franja equivalen a una franja por
 * día.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleWindow {

    private Long id;

    private Long roomId;

    private String roomCode;

    /** Semestre al que pertenece (ej: "1st") */
    private String semester;

    @Builder.Default
    private Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);

    private LocalTime startTime;

    private LocalTime endTime;

    private String subject;

    private String instructorName;

    /** Docente asignado; null para horarios solo informativos */
    private Long facultyId;

    private String facultyName;

    private boolean active;

    private LocalDateTime updatedAt;

    public boolean coversDay(DayOfWeek day) {
        return days != null && days.contains(day);
    }

    /**
     * Verifica si la hora cae dentro de [inicio, fin], ambos inclusive.
     */
    public boolean coversTime(LocalTime time) {
        return !time.isBefore(startTime) && !time.isAfter(endTime);
    }

    /**
     * Verifica si el instante cae dentro de la franja (día y hora).
     */
    public boolean covers(LocalDateTime instant) {
        return coversDay(instant.getDayOfWeek()) && coversTime(instant.toLocalTime());
    }

    /**
     * Solo las franjas con docente asignado pueden autorizar accesos.
     */
    public boolean grantsAccess() {
        return active && facultyId != null;
    }
}
