package com.keyaccess.infrastructure.persistence;

import com.keyaccess.domain.model.AcademicTerm;
import com.keyaccess.domain.model.TermState;
import com.keyaccess.domain.port.TermRepository;
import com.keyaccess.infrastructure.persistence.entity.TermSettingsEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Implementación del puerto TermRepository usando JPA sobre la fila única
 * de system_settings.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TermRepositoryImpl implements TermRepository {

    private final JpaTermSettingsRepository settingsRepository;
    private final Clock clock;

    @Override
    public TermState getOrCreate(AcademicTerm defaults) {
        return settingsRepository.findById(TermSettingsEntity.SINGLETON_ID)
                .map(this::toDomain)
                .orElseGet(() -> create(defaults));
    }

    @Override
    @Transactional
    public TermState update(AcademicTerm term) {
        TermSettingsEntity entity = settingsRepository.findById(TermSettingsEntity.SINGLETON_ID)
                .orElseGet(() -> TermSettingsEntity.builder().id(TermSettingsEntity.SINGLETON_ID).build());

        entity.setCurrentAcademicYear(term.academicYear());
        entity.setCurrentSemester(term.semester());
        entity.setUpdatedAt(LocalDateTime.now(clock));

        return toDomain(settingsRepository.save(entity));
    }

    /**
     * Crea la fila con el periodo por defecto. Si otro hilo la creó primero,
     * se relee la existente.
     */
    private TermState create(AcademicTerm defaults) {
        log.info("Inicializando periodo académico por defecto: {}", defaults);
        TermSettingsEntity entity = TermSettingsEntity.builder()
                .id(TermSettingsEntity.SINGLETON_ID)
                .currentAcademicYear(defaults.academicYear())
                .currentSemester(defaults.semester())
                .updatedAt(LocalDateTime.now(clock))
                .build();
        try {
            return toDomain(settingsRepository.saveAndFlush(entity));
        } catch (DataIntegrityViolationException e) {
            log.debug("Periodo creado concurrentemente, releyendo: {}", e.getMessage());
            return settingsRepository.findById(TermSettingsEntity.SINGLETON_ID)
                    .map(this::toDomain)
                    .orElseThrow(() -> e);
        }
    }

    private TermState toDomain(TermSettingsEntity entity) {
        return new TermState(
                new AcademicTerm(entity.getCurrentAcademicYear(), entity.getCurrentSemester()),
                entity.getUpdatedAt());
    }
}
