package com.keyaccess.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entidad JPA que mapea a la tabla system_settings. Solo existe la fila con
 * id = 1.
 */
@Entity
@Table(name = "system_settings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TermSettingsEntity {

    public static final Integer SINGLETON_ID = 1;

    @Id
    private Integer id;

    @Column(name = "current_academic_year", nullable = false, length = 20)
    private String currentAcademicYear;

    @Column(name = "current_semester", nullable = false, length = 10)
    private String currentSemester;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
