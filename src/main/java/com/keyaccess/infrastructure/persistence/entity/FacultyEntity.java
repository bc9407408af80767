package com.keyaccess.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entidad JPA que mapea a la tabla faculty.
 */
@Entity
@Table(name = "faculty")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FacultyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "school_id", unique = true, nullable = false, length = 50)
    private String schoolId;

    @Column(name = "full_name", length = 150)
    private String fullName;

    @Column(name = "department", length = 10)
    private String department;

    @Column(name = "is_active", nullable = false)
    private Boolean active;
}
