package com.keyaccess.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entidad JPA que mapea a la tabla manual_door_logs.
 */
@Entity
@Table(name = "manual_door_logs", indexes = {
        @Index(name = "idx_manual_room_timestamp", columnList = "room_id, timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualCommandEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "room_id", nullable = false)
    private RoomEntity room;

    @Column(name = "staff_name", length = 150)
    private String staffName;

    @Column(name = "action", nullable = false, length = 10)
    private String action;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "timestamp", nullable = false)
    private LocalDateTime createdAt;
}
