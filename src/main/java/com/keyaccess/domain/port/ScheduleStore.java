package com.keyaccess.domain.port;

import com.keyaccess.domain.model.ScheduleWindow;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Puerto del almacén de horarios.
 */
public interface ScheduleStore {

    /**
     * Franjas activas de un docente en un laboratorio para un semestre, en
     * orden ascendente de id.
     */
    List<ScheduleWindow> findActiveWindows(Long roomId, Long facultyId, String semester);

    /**
     * Todas las franjas activas de un laboratorio para un semestre, incluidas
     * las que no tienen docente asignado.
     */
    List<ScheduleWindow> findActiveWindowsForRoom(Long roomId, String semester);

    /**
     * Verifica si alguna franja del laboratorio y semestre (activa o no) se
     * modificó después del instante dado.
     */
    boolean hasChangesSince(Long roomId, String semester, LocalDateTime since);

    long countActiveWindows(Long roomId, String semester);
}
