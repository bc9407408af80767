package com.keyaccess.infrastructure.persistence;

import com.keyaccess.infrastructure.persistence.entity.CredentialEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repositorio JPA para operaciones con rfid_registrations.
 */
@Repository
public interface JpaCredentialRepository extends JpaRepository<CredentialEntity, Long> {

    /**
     * Busca una tarjeta por código cargando docente y laboratorio.
     */
    @Query("SELECT c FROM CredentialEntity c JOIN FETCH c.faculty JOIN FETCH c.room WHERE c.badgeCode = :badgeCode")
    Optional<CredentialEntity> findByBadgeCodeWithRelations(@Param("badgeCode") String badgeCode);

    /**
     * Bloquea la fila de la tarjeta (SELECT ... FOR UPDATE).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CredentialEntity c WHERE c.id = :id")
    Optional<CredentialEntity> findByIdForUpdate(@Param("id") Long id);

    /**
     * Códigos de tarjetas activas de un docente en un laboratorio.
     */
    @Query("SELECT c.badgeCode FROM CredentialEntity c " +
            "WHERE c.faculty.id = :facultyId AND c.room.id = :roomId AND c.active = true " +
            "ORDER BY c.badgeCode")
    List<String> findActiveBadgeCodes(@Param("facultyId") Long facultyId, @Param("roomId") Long roomId);
}
