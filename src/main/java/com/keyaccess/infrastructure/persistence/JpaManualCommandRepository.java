package com.keyaccess.infrastructure.persistence;

import com.keyaccess.infrastructure.persistence.entity.ManualCommandEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Repositorio JPA para operaciones con manual_door_logs.
 */
@Repository
public interface JpaManualCommandRepository extends JpaRepository<ManualCommandEntity, Long> {

    Optional<ManualCommandEntity> findFirstByRoom_CodeAndCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(
            String roomCode, LocalDateTime since);
}
