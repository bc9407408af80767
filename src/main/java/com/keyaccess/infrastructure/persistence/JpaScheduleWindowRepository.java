package com.keyaccess.infrastructure.persistence;

import com.keyaccess.infrastructure.persistence.entity.ScheduleWindowEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repositorio JPA para operaciones con room_schedules.
 */
@Repository
public interface JpaScheduleWindowRepository extends JpaRepository<ScheduleWindowEntity, Long> {

    @Query("SELECT s FROM ScheduleWindowEntity s JOIN FETCH s.room LEFT JOIN FETCH s.faculty " +
            "WHERE s.room.id = :roomId AND s.faculty.id = :facultyId AND s.semester = :semester " +
            "AND s.active = true ORDER BY s.id ASC")
    List<ScheduleWindowEntity> findActiveForFaculty(
            @Param("roomId") Long roomId,
            @Param("facultyId") Long facultyId,
            @Param("semester") String semester);

    @Query("SELECT s FROM ScheduleWindowEntity s JOIN FETCH s.room LEFT JOIN FETCH s.faculty " +
            "WHERE s.room.id = :roomId AND s.semester = :semester AND s.active = true " +
            "ORDER BY s.startTime ASC, s.id ASC")
    List<ScheduleWindowEntity> findActiveForRoom(
            @Param("roomId") Long roomId,
            @Param("semester") String semester);

    /**
     * Cuenta franjas (activas o no) modificadas después del instante dado.
     */
    @Query("SELECT COUNT(s) FROM ScheduleWindowEntity s " +
            "WHERE s.room.id = :roomId AND s.semester = :semester AND s.updatedAt > :since")
    long countUpdatedAfter(
            @Param("roomId") Long roomId,
            @Param("semester") String semester,
            @Param("since") LocalDateTime since);

    long countByRoom_IdAndSemesterAndActiveTrue(Long roomId, String semester);
}
