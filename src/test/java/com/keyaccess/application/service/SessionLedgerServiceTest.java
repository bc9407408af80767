package com.keyaccess.application.service;

import com.keyaccess.domain.exception.CsvProcessingException;
import com.keyaccess.domain.model.AccessDecision;
import com.keyaccess.domain.model.Credential;
import com.keyaccess.domain.model.DenialReason;
import com.keyaccess.domain.model.KeyAction;
import com.keyaccess.domain.model.LedgerEntry;
import com.keyaccess.domain.model.Room;
import com.keyaccess.domain.model.TransactionRecord;
import com.keyaccess.domain.port.AuditTrailWriter;
import com.keyaccess.support.InMemoryTransactionLedger;
import com.keyaccess.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionOperations;

import java.io.IOException;
import java.time.LocalDateTime;

import static com.keyaccess.support.TestData.TERM;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SessionLedgerServiceTest {

    private static final LocalDateTime MONDAY_0830 = LocalDateTime.of(2025, 1, 6, 8, 30);

    @Mock
    private AuditTrailWriter auditTrailWriter;

    private InMemoryTransactionLedger ledger;
    private SessionLedgerService service;

    private Room room;
    private Credential credential;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryTransactionLedger();
        service = new SessionLedgerService(ledger, auditTrailWriter, TransactionOperations.withoutTransaction());

        room = TestData.room(3L, "203");
        credential = TestData.credential(11L, "RFID-001", TestData.faculty(5L, "Ana Torres"), room);
    }

    @Test
    @DisplayName("Un préstamo inserta exactamente una sesión abierta con la franja que lo autorizó")
    void borrowInsertsOneOpenRow() {
        LedgerEntry entry = service.recordGrant(credential, room, TERM, MONDAY_0830, 42L);

        assertThat(entry.action()).isEqualTo(KeyAction.BORROW);
        assertThat(ledger.all()).hasSize(1);
        TransactionRecord stored = ledger.all().get(0);
        assertThat(stored.isOpen()).isTrue();
        assertThat(stored.getScheduleWindowId()).isEqualTo(42L);
        assertThat(stored.getSnapshot().facultyName()).isEqualTo("Ana Torres");
        assertThat(stored.getSnapshot().roomCode()).isEqualTo("203");
        assertThat(stored.getSnapshot().badgeCode()).isEqualTo("RFID-001");
        assertThat(ledger.lockedCredentials()).containsExactly(11L);
        verify(auditTrailWriter).append(any(TransactionRecord.class), eq(KeyAction.BORROW));
    }

    @Test
    @DisplayName("Una devolución cierra la sesión abierta y no inserta filas")
    void returnClosesWithoutInserting() {
        LedgerEntry borrow = service.recordGrant(credential, room, TERM, MONDAY_0830, 42L);
        LedgerEntry giveBack = service.recordGrant(credential, room, TERM, MONDAY_0830.plusMinutes(30), 42L);

        assertThat(giveBack.action()).isEqualTo(KeyAction.RETURN);
        assertThat(giveBack.record().getId()).isEqualTo(borrow.record().getId());
        assertThat(giveBack.record().getCloseTime()).isEqualTo(MONDAY_0830.plusMinutes(30));
        assertThat(ledger.all()).hasSize(1);
        assertThat(ledger.openCount(11L, 3L, TERM)).isZero();
    }

    @Test
    @DisplayName("Nunca hay más de una sesión abierta por tarjeta, laboratorio y periodo")
    void atMostOneOpenSession() {
        for (int i = 0; i < 5; i++) {
            service.recordGrant(credential, room, TERM, MONDAY_0830.plusMinutes(i), null);
            assertThat(ledger.openCount(11L, 3L, TERM)).isLessThanOrEqualTo(1);
        }
        // préstamo, devolución, préstamo, devolución, préstamo
        assertThat(ledger.all()).hasSize(3);
        assertThat(ledger.openCount(11L, 3L, TERM)).isEqualTo(1);
        assertThat(service.isKeyOut(11L, 3L, TERM)).isTrue();
    }

    @Test
    @DisplayName("Un préstamo concurrente que choca con la restricción única se reintenta como devolución")
    void conflictingBorrowIsRetriedAsReturn() {
        ledger.simulateConcurrentBorrow(TransactionRecord.opened(credential, room, TERM, MONDAY_0830, 42L));

        LedgerEntry entry = service.recordGrant(credential, room, TERM, MONDAY_0830.plusSeconds(1), 42L);

        assertThat(entry.action()).isEqualTo(KeyAction.RETURN);
        assertThat(ledger.all()).hasSize(1);
        assertThat(ledger.openCount(11L, 3L, TERM)).isZero();
    }

    @Test
    @DisplayName("Una denegación inserta un único registro terminal con motivo")
    void denialInsertsTerminalRow() {
        AccessDecision decision = AccessDecision.builder()
                .granted(false)
                .denialCode(DenialReason.NO_SCHEDULE_TODAY)
                .denialReason("Sin horario para tuesday en el semestre 1st")
                .build();

        service.recordAttempt(credential, room, "203", TERM, MONDAY_0830, decision);

        assertThat(decision.getAction()).isEqualTo(KeyAction.NONE);
        assertThat(decision.getTransactionId()).isNotNull();
        TransactionRecord stored = ledger.all().get(0);
        assertThat(stored.isAccessGranted()).isFalse();
        assertThat(stored.isOpen()).isFalse();
        assertThat(stored.getDenialReason()).isNotBlank();
        assertThat(stored.getDenialCode()).isEqualTo(DenialReason.NO_SCHEDULE_TODAY);
    }

    @Test
    @DisplayName("Una denegación sin laboratorio resuelto conserva el código recibido en la copia")
    void denialWithoutRoomKeepsRequestedCode() {
        service.recordDenial(credential, null, "999", TERM, MONDAY_0830, DenialReason.CREDENTIAL_INACTIVE,
                "La tarjeta está desactivada");

        TransactionRecord stored = ledger.all().get(0);
        assertThat(stored.getRoomId()).isNull();
        assertThat(stored.getSnapshot().roomCode()).isEqualTo("999");
    }

    @Test
    @DisplayName("Un préstamo sin conexión anterior a la última sesión se guarda cerrado")
    void olderOfflineBorrowIsStoredClosed() {
        service.recordGrant(credential, room, TERM, MONDAY_0830.plusHours(1), 42L);

        LedgerEntry entry = service.mergeOffline(credential, room, TERM, MONDAY_0830, true);

        assertThat(entry.action()).isEqualTo(KeyAction.NONE);
        assertThat(entry.record().getOpenTime()).isEqualTo(MONDAY_0830);
        assertThat(entry.record().getCloseTime()).isEqualTo(MONDAY_0830);
        assertThat(ledger.openCount(11L, 3L, TERM)).isEqualTo(1);
        assertThat(ledger.all()).hasSize(2);
    }

    @Test
    @DisplayName("Un préstamo sin conexión dentro de una sesión ya devuelta no deja la llave fuera")
    void offlineBorrowInsideReturnedSessionIsStoredClosed() {
        service.recordGrant(credential, room, TERM, MONDAY_0830.minusMinutes(30), 42L);
        service.recordGrant(credential, room, TERM, MONDAY_0830.plusMinutes(30), 42L);

        LedgerEntry entry = service.mergeOffline(credential, room, TERM, MONDAY_0830, true);

        assertThat(entry.action()).isEqualTo(KeyAction.NONE);
        assertThat(entry.record().getCloseTime()).isEqualTo(MONDAY_0830);
        assertThat(service.isKeyOut(11L, 3L, TERM)).isFalse();
        assertThat(ledger.openCount(11L, 3L, TERM)).isZero();
        assertThat(ledger.all()).hasSize(2);
    }

    @Test
    @DisplayName("Eventos sin conexión en orden siguen la regla de préstamo y devolución con su hora")
    void offlineEventsFollowOpenCloseRule() {
        LedgerEntry borrow = service.mergeOffline(credential, room, TERM, MONDAY_0830, true);
        LedgerEntry giveBack = service.mergeOffline(credential, room, TERM, MONDAY_0830.plusMinutes(45), true);
        LedgerEntry denied = service.mergeOffline(credential, room, TERM, MONDAY_0830.plusHours(2), false);

        assertThat(borrow.action()).isEqualTo(KeyAction.BORROW);
        assertThat(giveBack.action()).isEqualTo(KeyAction.RETURN);
        assertThat(giveBack.record().getCloseTime()).isEqualTo(MONDAY_0830.plusMinutes(45));
        assertThat(denied.record().getDenialCode()).isEqualTo(DenialReason.DENIED_OFFLINE);
        assertThat(ledger.all()).hasSize(2);
    }

    @Test
    @DisplayName("Un fallo del espejo CSV no interrumpe el registro")
    void csvFailureDoesNotFailTheWrite() {
        doThrow(CsvProcessingException.cannotWrite("audit.csv", new IOException("disco lleno")))
                .when(auditTrailWriter).append(any(), any());

        LedgerEntry entry = service.recordGrant(credential, room, TERM, MONDAY_0830, 42L);

        assertThat(entry.action()).isEqualTo(KeyAction.BORROW);
        assertThat(ledger.all()).hasSize(1);
    }
}
