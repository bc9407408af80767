package com.keyaccess.domain.model;

/**
 * Periodo académico vigente: año académico (ej: "2025-2026") y semestre
 * (ej: "1st").
 */
public record AcademicTerm(String academicYear, String semester) {

    @Override
    public String toString() {
        return semester + " " + academicYear;
    }
}
