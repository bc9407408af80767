package com.keyaccess.support;

import com.keyaccess.domain.model.AcademicTerm;
import com.keyaccess.domain.model.TransactionRecord;
import com.keyaccess.domain.port.TransactionLedger;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Libro en memoria que reproduce la restricción única de sesión abierta.
 */
public class InMemoryTransactionLedger implements TransactionLedger {

    private final List<TransactionRecord> records = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final List<Long> lockedCredentials = new ArrayList<>();

    /** Simula que otra petición abre una sesión justo antes del próximo insert */
    private TransactionRecord racingInsert;

    @Override
    public void lockSession(Long credentialId) {
        lockedCredentials.add(credentialId);
    }

    @Override
    public Optional<TransactionRecord> findOpen(Long credentialId, Long roomId, AcademicTerm term) {
        return records.stream()
                .filter(r -> sameSession(r, credentialId, roomId, term))
                .filter(TransactionRecord::isOpen)
                .findFirst()
                .map(this::copy);
    }

    @Override
    public boolean existsGrantedActivityAfter(Long credentialId, Long roomId, AcademicTerm term,
            LocalDateTime instant) {
        return records.stream()
                .filter(r -> sameSession(r, credentialId, roomId, term))
                .filter(TransactionRecord::isAccessGranted)
                .anyMatch(r -> r.getOpenTime().isAfter(instant)
                        || (r.getCloseTime() != null && !r.getCloseTime().isBefore(instant)));
    }

    @Override
    public TransactionRecord insert(TransactionRecord record) {
        if (racingInsert != null) {
            TransactionRecord racing = racingInsert;
            racingInsert = null;
            store(racing);
        }
        if (record.isOpen() && findOpen(record.getCredentialId(), record.getRoomId(), record.getTerm()).isPresent()) {
            throw new DataIntegrityViolationException("Duplicate entry for key 'uq_transaction_open_session'");
        }
        return copy(store(record));
    }

    @Override
    public TransactionRecord close(Long transactionId, LocalDateTime closeTime) {
        TransactionRecord stored = records.stream()
                .filter(r -> r.getId().equals(transactionId))
                .findFirst()
                .orElseThrow(NoSuchElementException::new);
        stored.setCloseTime(closeTime);
        return copy(stored);
    }

    @Override
    public long countOpenSessions() {
        return records.stream().filter(TransactionRecord::isOpen).count();
    }

    public void simulateConcurrentBorrow(TransactionRecord record) {
        this.racingInsert = record;
    }

    public List<TransactionRecord> all() {
        return records.stream().map(this::copy).collect(Collectors.toList());
    }

    public long openCount(Long credentialId, Long roomId, AcademicTerm term) {
        return records.stream()
                .filter(r -> sameSession(r, credentialId, roomId, term))
                .filter(TransactionRecord::isOpen)
                .count();
    }

    public List<Long> lockedCredentials() {
        return lockedCredentials;
    }

    private TransactionRecord store(TransactionRecord record) {
        TransactionRecord stored = copy(record);
        stored.setId(sequence.incrementAndGet());
        records.add(stored);
        return stored;
    }

    private boolean sameSession(TransactionRecord r, Long credentialId, Long roomId, AcademicTerm term) {
        return Objects.equals(r.getCredentialId(), credentialId)
                && Objects.equals(r.getRoomId(), roomId)
                && Objects.equals(r.getTerm(), term);
    }

    private TransactionRecord copy(TransactionRecord r) {
        return TransactionRecord.builder()
                .id(r.getId())
                .credentialId(r.getCredentialId())
                .roomId(r.getRoomId())
                .snapshot(r.getSnapshot())
                .term(r.getTerm())
                .openTime(r.getOpenTime())
                .closeTime(r.getCloseTime())
                .accessGranted(r.isAccessGranted())
                .denialCode(r.getDenialCode())
                .denialReason(r.getDenialReason())
                .scheduleWindowId(r.getScheduleWindowId())
                .build();
    }
}
