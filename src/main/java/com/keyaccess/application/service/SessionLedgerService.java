package com.keyaccess.application.service;

import com.keyaccess.domain.exception.CsvProcessingException;
import com.keyaccess.domain.model.AcademicTerm;
import com.keyaccess.domain.model.AccessDecision;
import com.keyaccess.domain.model.Credential;
import com.keyaccess.domain.model.DenialReason;
import com.keyaccess.domain.model.KeyAction;
import com.keyaccess.domain.model.LedgerEntry;
import com.keyaccess.domain.model.Room;
import com.keyaccess.domain.model.TransactionRecord;
import com.keyaccess.domain.port.AuditTrailWriter;
import com.keyaccess.domain.port.TransactionLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Libro de sesiones de préstamo de llaves.
 *
 * <p>Cada tarjeta tiene como máximo una sesión abierta por laboratorio y
 * periodo. La verificación y la escritura corren en una sola transacción con
 * la fila de la tarjeta bloqueada; si aun así dos préstamos chocan en la
 * restricción única, el perdedor se reintenta una vez y se convierte en
 * devolución.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionLedgerService {

    private final TransactionLedger ledger;
    private final AuditTrailWriter auditTrailWriter;
    private final TransactionOperations transactions;

    /**
     * Registra el resultado de una decisión y completa en ella la acción y el
     * id del registro afectado.
     *
     * @param credential tarjeta resuelta
     * @param room       laboratorio resuelto; puede ser null solo en denegaciones
     * @param roomCode   código de laboratorio recibido
     * @param term       periodo leído al comenzar la decisión
     * @param now        instante de la decisión
     * @param decision   decisión a registrar
     * @return la misma decisión con acción e id de transacción
     */
    public AccessDecision recordAttempt(Credential credential, Room room, String roomCode, AcademicTerm term,
            LocalDateTime now, AccessDecision decision) {
        LedgerEntry entry = decision.isGranted()
                ? recordGrant(credential, room, term, now, decision.getAuthorizingWindowId())
                : recordDenial(credential, room, roomCode, term, now, decision.getDenialCode(),
                        decision.getDenialReason());

        decision.setAction(entry.action());
        decision.setTransactionId(entry.record().getId());
        return decision;
    }

    /**
     * Acceso concedido: cierra la sesión abierta (devolución) o abre una nueva
     * (préstamo).
     */
    public LedgerEntry recordGrant(Credential credential, Room room, AcademicTerm term, LocalDateTime now,
            Long windowId) {
        return writeWithRetry(() -> applyGrant(credential, room, term, now, windowId));
    }

    /**
     * Acceso denegado: inserta un registro terminal que nunca se cierra.
     */
    public LedgerEntry recordDenial(Credential credential, Room room, String roomCode, AcademicTerm term,
            LocalDateTime now, DenialReason code, String reason) {
        TransactionRecord denied = TransactionRecord.denied(credential, room, roomCode, term, now, code, reason);
        TransactionRecord saved = transactions.execute(status -> ledger.insert(denied));
        LedgerEntry entry = new LedgerEntry(KeyAction.NONE, saved);
        mirror(entry);
        return entry;
    }

    /**
     * Incorpora un acceso decidido por el controlador sin conexión usando la
     * hora informada. Un préstamo anterior a la última actividad concedida de
     * la llave (una sesión abierta después, o cerrada en ese momento o después)
     * se guarda ya cerrado para no dejar una sesión abierta fantasma.
     *
     * @param credential tarjeta
     * @param room       laboratorio
     * @param term       periodo vigente
     * @param at         momento del acceso según el controlador
     * @param granted    si el controlador concedió el acceso
     * @return entrada escrita
     */
    public LedgerEntry mergeOffline(Credential credential, Room room, AcademicTerm term, LocalDateTime at,
            boolean granted) {
        if (!granted) {
            return recordDenial(credential, room, room.getCode(), term, at, DenialReason.DENIED_OFFLINE,
                    "Acceso denegado por el controlador sin conexión");
        }
        return writeWithRetry(() -> applyOfflineGrant(credential, room, term, at));
    }

    /**
     * Indica si la llave está fuera del gabinete para esta tarjeta.
     */
    public boolean isKeyOut(Long credentialId, Long roomId, AcademicTerm term) {
        return ledger.findOpen(credentialId, roomId, term).isPresent();
    }

    public long countKeysOut() {
        return ledger.countOpenSessions();
    }

    private LedgerEntry writeWithRetry(Supplier<LedgerEntry> write) {
        LedgerEntry entry;
        try {
            entry = transactions.execute(status -> write.get());
        } catch (DataIntegrityViolationException e) {
            log.warn("Conflicto de sesión abierta, reintentando en una transacción nueva: {}", e.getMessage());
            entry = transactions.execute(status -> write.get());
        }
        mirror(entry);
        return entry;
    }

    private LedgerEntry applyGrant(Credential credential, Room room, AcademicTerm term, LocalDateTime now,
            Long windowId) {
        ledger.lockSession(credential.getId());
        Optional<TransactionRecord> open = ledger.findOpen(credential.getId(), room.getId(), term);
        if (open.isPresent()) {
            TransactionRecord closed = ledger.close(open.get().getId(), now);
            log.info("Llave del laboratorio {} devuelta por {} (transacción {})",
                    room.getCode(), credential.facultyDisplayName(), closed.getId());
            return new LedgerEntry(KeyAction.RETURN, closed);
        }

        TransactionRecord opened = ledger.insert(TransactionRecord.opened(credential, room, term, now, windowId));
        log.info("Llave del laboratorio {} prestada a {} (transacción {})",
                room.getCode(), credential.facultyDisplayName(), opened.getId());
        return new LedgerEntry(KeyAction.BORROW, opened);
    }

    private LedgerEntry applyOfflineGrant(Credential credential, Room room, AcademicTerm term, LocalDateTime at) {
        ledger.lockSession(credential.getId());
        if (ledger.existsGrantedActivityAfter(credential.getId(), room.getId(), term, at)) {
            TransactionRecord point = TransactionRecord.opened(credential, room, term, at, null);
            point.setCloseTime(at);
            TransactionRecord saved = ledger.insert(point);
            log.info("Acceso sin conexión de {} en {} anterior a la última sesión; guardado cerrado ({})",
                    credential.facultyDisplayName(), room.getCode(), at);
            return new LedgerEntry(KeyAction.NONE, saved);
        }
        return applyGrant(credential, room, term, at, null);
    }

    private void mirror(LedgerEntry entry) {
        try {
            auditTrailWriter.append(entry.record(), entry.action());
        } catch (CsvProcessingException e) {
            log.error("Error escribiendo el espejo CSV de auditoría: {}", e.getMessage());
        }
    }
}
