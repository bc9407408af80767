package com.keyaccess.application.service;

import com.keyaccess.domain.exception.InvalidRequestException;
import com.keyaccess.domain.model.AcademicTerm;
import com.keyaccess.domain.model.TermState;
import com.keyaccess.domain.port.TermProvider;
import com.keyaccess.domain.port.TermRepository;
import com.keyaccess.presentation.websocket.AccessWebSocketHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Registro del periodo académico vigente. Es la única fuente del periodo para
 * decisiones, sincronización y registros del libro.
 */
@Service
@Slf4j
public class TermRegistryService implements TermProvider {

    /** Semestres admitidos */
    public static final Set<String> SEMESTERS = Set.of("1st", "2nd", "summer", "summer2");

    private static final Pattern ACADEMIC_YEAR = Pattern.compile("\\d{4}-\\d{4}");

    private final TermRepository termRepository;
    private final AccessWebSocketHandler webSocketHandler;
    private final AcademicTerm defaultTerm;

    public TermRegistryService(
            TermRepository termRepository,
            AccessWebSocketHandler webSocketHandler,
            @Value("${keybox.term.default-academic-year:2025-2026}") String defaultAcademicYear,
            @Value("${keybox.term.default-semester:1st}") String defaultSemester) {
        this.termRepository = termRepository;
        this.webSocketHandler = webSocketHandler;
        this.defaultTerm = new AcademicTerm(defaultAcademicYear, defaultSemester);
    }

    @Override
    public AcademicTerm currentTerm() {
        return currentState().term();
    }

    @Override
    public LocalDateTime lastChangedAt() {
        return currentState().updatedAt();
    }

    /**
     * Obtiene el registro único del periodo, creándolo si aún no existe.
     */
    public TermState currentState() {
        return termRepository.getOrCreate(defaultTerm);
    }

    /**
     * Cambia el periodo vigente. Las decisiones en curso siguen usando el
     * periodo que leyeron al comenzar.
     *
     * @param academicYear año académico con formato AAAA-AAAA
     * @param semester     uno de 1st, 2nd, summer, summer2
     * @return estado resultante
     * @throws InvalidRequestException si algún valor es inválido
     */
    public TermState changeTerm(String academicYear, String semester) {
        if (academicYear == null || academicYear.isBlank()) {
            throw InvalidRequestException.missingParameter("academic_year");
        }
        if (semester == null || semester.isBlank()) {
            throw InvalidRequestException.missingParameter("semester");
        }
        String year = academicYear.trim();
        String sem = semester.trim();
        if (!ACADEMIC_YEAR.matcher(year).matches()) {
            throw InvalidRequestException.invalidValue("academic_year", year);
        }
        if (!SEMESTERS.contains(sem)) {
            throw InvalidRequestException.invalidValue("semester", sem);
        }

        AcademicTerm previous = currentTerm();
        TermState updated = termRepository.update(new AcademicTerm(year, sem));
        log.info("Periodo académico cambiado: {} -> {}", previous, updated.term());

        webSocketHandler.broadcastTermChanged(updated.term(), updated.updatedAt().toString());
        return updated;
    }
}
