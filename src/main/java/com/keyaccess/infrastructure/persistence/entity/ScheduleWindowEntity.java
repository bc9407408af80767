package com.keyaccess.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Set;

/**
 * Entidad JPA que mapea a la tabla room_schedules. Las marcas de creación y
 * modificación salen del reloj de la aplicación, igual que last_sync.
 */
@Entity
@EntityListeners(AuditingEntityListener.class)
@Table(name = "room_schedules", indexes = {
        @Index(name = "idx_schedule_room_semester", columnList = "room_id, semester, is_active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleWindowEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "room_id", nullable = false)
    private RoomEntity room;

    @Column(name = "semester", nullable = false, length = 10)
    private String semester;

    @Convert(converter = WeekdaySetConverter.class)
    @Column(name = "day_of_week", nullable = false, length = 100)
    private Set<DayOfWeek> days;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "subject", length = 100)
    private String subject;

    @Column(name = "instructor_name", length = 100)
    private String instructorName;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "faculty_id")
    private FacultyEntity faculty;

    @Column(name = "is_active", nullable = false)
    private Boolean active;

    @CreatedDate
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
