package com.keyaccess.infrastructure.persistence;

import com.keyaccess.domain.model.ScheduleWindow;
import com.keyaccess.domain.port.ScheduleStore;
import com.keyaccess.infrastructure.persistence.entity.ScheduleWindowEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Implementación del puerto ScheduleStore usando JPA.
 */
@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ScheduleStoreImpl implements ScheduleStore {

    private final JpaScheduleWindowRepository scheduleRepository;

    @Override
    public List<ScheduleWindow> findActiveWindows(Long roomId, Long facultyId, String semester) {
        return scheduleRepository.findActiveForFaculty(roomId, facultyId, semester)
                .stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public List<ScheduleWindow> findActiveWindowsForRoom(Long roomId, String semester) {
        return scheduleRepository.findActiveForRoom(roomId, semester)
                .stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public boolean hasChangesSince(Long roomId, String semester, LocalDateTime since) {
        return scheduleRepository.countUpdatedAfter(roomId, semester, since) > 0;
    }

    @Override
    public long countActiveWindows(Long roomId, String semester) {
        return scheduleRepository.countByRoom_IdAndSemesterAndActiveTrue(roomId, semester);
    }

    /**
     * Convierte una entidad JPA a una franja de dominio.
     */
    private ScheduleWindow toDomain(ScheduleWindowEntity entity) {
        ScheduleWindow.ScheduleWindowBuilder builder = ScheduleWindow.builder()
                .id(entity.getId())
                .roomId(entity.getRoom().getId())
                .roomCode(entity.getRoom().getCode())
                .semester(entity.getSemester())
                .days(copyDays(entity.getDays()))
                .startTime(entity.getStartTime())
                .endTime(entity.getEndTime())
                .subject(entity.getSubject())
                .instructorName(entity.getInstructorName())
                .active(Boolean.TRUE.equals(entity.getActive()))
                .updatedAt(entity.getUpdatedAt());

        if (entity.getFaculty() != null) {
            builder.facultyId(entity.getFaculty().getId())
                    .facultyName(entity.getFaculty().getFullName());
        }
        return builder.build();
    }

    private Set<DayOfWeek> copyDays(Set<DayOfWeek> stored) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (stored != null) {
            days.addAll(stored);
        }
        return days;
    }
}
