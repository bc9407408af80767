package com.keyaccess.infrastructure.persistence;

import com.keyaccess.infrastructure.persistence.entity.TermSettingsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repositorio JPA para el registro único de system_settings.
 */
@Repository
public interface JpaTermSettingsRepository extends JpaRepository<TermSettingsEntity, Integer> {
}
