package com.keyaccess.infrastructure.persistence;

import com.keyaccess.infrastructure.persistence.entity.TransactionLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repositorio JPA para operaciones con transaction_logs.
 */
@Repository
public interface JpaTransactionLogRepository extends JpaRepository<TransactionLogEntity, Long> {

    /**
     * Sesiones concedidas sin cierre de una tarjeta en un laboratorio y periodo.
     */
    @Query("SELECT t FROM TransactionLogEntity t " +
            "WHERE t.credentialId = :credentialId AND t.roomId = :roomId " +
            "AND t.academicYear = :academicYear AND t.semester = :semester " +
            "AND t.accessGranted = true AND t.closeTime IS NULL " +
            "ORDER BY t.openTime DESC")
    List<TransactionLogEntity> findOpenSessions(
            @Param("credentialId") Long credentialId,
            @Param("roomId") Long roomId,
            @Param("academicYear") String academicYear,
            @Param("semester") String semester);

    @Query("SELECT COUNT(t) FROM TransactionLogEntity t " +
            "WHERE t.credentialId = :credentialId AND t.roomId = :roomId " +
            "AND t.academicYear = :academicYear AND t.semester = :semester " +
            "AND t.accessGranted = true " +
            "AND (t.openTime > :instant OR t.closeTime >= :instant)")
    long countGrantedActivityAfter(
            @Param("credentialId") Long credentialId,
            @Param("roomId") Long roomId,
            @Param("academicYear") String academicYear,
            @Param("semester") String semester,
            @Param("instant") LocalDateTime instant);

    /**
     * Cuenta las llaves actualmente fuera del gabinete.
     */
    @Query("SELECT COUNT(t) FROM TransactionLogEntity t WHERE t.accessGranted = true AND t.closeTime IS NULL")
    long countOpenSessions();
}
