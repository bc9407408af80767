package com.keyaccess.domain.model;

import java.time.LocalDateTime;

/**
 * Estado del registro único de periodo: el periodo vigente y cuándo cambió por
 * última vez.
 */
public record TermState(AcademicTerm term, LocalDateTime updatedAt) {
}
