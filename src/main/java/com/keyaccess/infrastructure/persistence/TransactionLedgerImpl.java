package com.keyaccess.infrastructure.persistence;

import com.keyaccess.domain.model.AcademicTerm;
import com.keyaccess.domain.model.DenialReason;
import com.keyaccess.domain.model.TransactionRecord;
import com.keyaccess.domain.model.TransactionSnapshot;
import com.keyaccess.domain.port.TransactionLedger;
import com.keyaccess.infrastructure.persistence.entity.TransactionLogEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Implementación del puerto TransactionLedger usando JPA.
 *
 * <p>Las inserciones usan saveAndFlush para que una violación de
 * uq_transaction_open_session aparezca dentro de la transacción del llamador.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionLedgerImpl implements TransactionLedger {

    private final JpaTransactionLogRepository transactionRepository;
    private final JpaCredentialRepository credentialRepository;

    @Override
    public void lockSession(Long credentialId) {
        credentialRepository.findByIdForUpdate(credentialId);
    }

    @Override
    public Optional<TransactionRecord> findOpen(Long credentialId, Long roomId, AcademicTerm term) {
        List<TransactionLogEntity> open = transactionRepository.findOpenSessions(
                credentialId, roomId, term.academicYear(), term.semester());
        if (open.size() > 1) {
            log.warn("Tarjeta {} tiene {} sesiones abiertas en el laboratorio {} ({})",
                    credentialId, open.size(), roomId, term);
        }
        return open.stream().findFirst().map(this::toDomain);
    }

    @Override
    public boolean existsGrantedActivityAfter(Long credentialId, Long roomId, AcademicTerm term,
            LocalDateTime instant) {
        return transactionRepository.countGrantedActivityAfter(
                credentialId, roomId, term.academicYear(), term.semester(), instant) > 0;
    }

    @Override
    public TransactionRecord insert(TransactionRecord record) {
        TransactionLogEntity saved = transactionRepository.saveAndFlush(toEntity(record));
        return toDomain(saved);
    }

    @Override
    public TransactionRecord close(Long transactionId, LocalDateTime closeTime) {
        TransactionLogEntity entity = transactionRepository.findById(transactionId)
                .orElseThrow(() -> new NoSuchElementException("Transacción no encontrada: " + transactionId));
        entity.setCloseTime(closeTime);
        entity.setOpenSlot(null);
        return toDomain(transactionRepository.saveAndFlush(entity));
    }

    @Override
    public long countOpenSessions() {
        return transactionRepository.countOpenSessions();
    }

    /**
     * Convierte un registro de dominio a una entidad JPA.
     */
    private TransactionLogEntity toEntity(TransactionRecord record) {
        TransactionSnapshot snapshot = record.getSnapshot();
        return TransactionLogEntity.builder()
                .credentialId(record.getCredentialId())
                .roomId(record.getRoomId())
                .facultyName(snapshot != null ? snapshot.facultyName() : null)
                .roomCode(snapshot != null ? snapshot.roomCode() : null)
                .badgeCode(snapshot != null ? snapshot.badgeCode() : null)
                .academicYear(record.getTerm().academicYear())
                .semester(record.getTerm().semester())
                .openTime(record.getOpenTime())
                .closeTime(record.getCloseTime())
                .accessGranted(record.isAccessGranted())
                .denialCode(record.getDenialCode() != null ? record.getDenialCode().name() : null)
                .denialReason(record.getDenialReason())
                .scheduleWindowId(record.getScheduleWindowId())
                .openSlot(record.isOpen() ? TransactionLogEntity.OPEN_SLOT : null)
                .build();
    }

    /**
     * Convierte una entidad JPA a un registro de dominio.
     */
    private TransactionRecord toDomain(TransactionLogEntity entity) {
        return TransactionRecord.builder()
                .id(entity.getId())
                .credentialId(entity.getCredentialId())
                .roomId(entity.getRoomId())
                .snapshot(new TransactionSnapshot(entity.getFacultyName(), entity.getRoomCode(),
                        entity.getBadgeCode()))
                .term(new AcademicTerm(entity.getAcademicYear(), entity.getSemester()))
                .openTime(entity.getOpenTime())
                .closeTime(entity.getCloseTime())
                .accessGranted(Boolean.TRUE.equals(entity.getAccessGranted()))
                .denialCode(entity.getDenialCode() != null ? DenialReason.valueOf(entity.getDenialCode()) : null)
                .denialReason(entity.getDenialReason())
                .scheduleWindowId(entity.getScheduleWindowId())
                .build();
    }
}
