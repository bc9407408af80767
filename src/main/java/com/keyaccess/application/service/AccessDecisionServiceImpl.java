package com.keyaccess.application.service;

import com.keyaccess.application.dto.AccessEventDto;
import com.keyaccess.domain.exception.InvalidRequestException;
import com.keyaccess.domain.exception.LookupException;
import com.keyaccess.domain.model.AcademicTerm;
import com.keyaccess.domain.model.AccessDecision;
import com.keyaccess.domain.model.Credential;
import com.keyaccess.domain.model.DenialReason;
import com.keyaccess.domain.model.KeyAction;
import com.keyaccess.domain.model.Room;
import com.keyaccess.domain.model.ScheduleWindow;
import com.keyaccess.domain.model.Weekdays;
import com.keyaccess.domain.port.CredentialDirectory;
import com.keyaccess.domain.port.RoomDirectory;
import com.keyaccess.domain.port.ScheduleStore;
import com.keyaccess.domain.port.TermProvider;
import com.keyaccess.presentation.websocket.AccessWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Implementación del motor de decisión.
 *
 * <p>Orden de verificación: tarjeta, laboratorio, periodo vigente y franjas
 * del docente. Toda decisión que llega a evaluarse escribe exactamente un
 * registro en el libro (inserción o cierre).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessDecisionServiceImpl implements AccessDecisionService {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final CredentialDirectory credentialDirectory;
    private final RoomDirectory roomDirectory;
    private final ScheduleStore scheduleStore;
    private final TermProvider termProvider;
    private final SessionLedgerService sessionLedger;
    private final AccessWebSocketHandler webSocketHandler;
    private final Clock clock;

    @Override
    public AccessDecision decide(String badgeCode, String roomCode) {
        if (badgeCode == null || badgeCode.isBlank()) {
            throw InvalidRequestException.missingParameter("code");
        }
        if (roomCode == null || roomCode.isBlank()) {
            throw InvalidRequestException.missingParameter("room");
        }
        String badge = badgeCode.trim();
        String requestedRoom = roomCode.trim();

        LocalDateTime now = LocalDateTime.now(clock);
        AcademicTerm term = termProvider.currentTerm();

        Credential credential = credentialDirectory.findByBadgeCode(badge)
                .orElseThrow(() -> lookupFailure(LookupException.credentialUnknown(badge), badge, requestedRoom));

        AccessDecision decision;
        Room room;
        if (!credential.isActive()) {
            room = roomDirectory.findByCode(requestedRoom).orElse(null);
            decision = denial(credential, DenialReason.CREDENTIAL_INACTIVE, "La tarjeta está desactivada");
        } else {
            room = roomDirectory.findByCode(requestedRoom)
                    .orElseThrow(() -> lookupFailure(LookupException.roomUnknown(requestedRoom), badge, requestedRoom));
            decision = room.isActive()
                    ? evaluateSchedule(credential, room, term, now)
                    : denial(credential, DenialReason.ROOM_INACTIVE,
                            "El laboratorio " + room.getCode() + " está desactivado");
        }

        sessionLedger.recordAttempt(credential, room, requestedRoom, term, now, decision);
        if (decision.isGranted()) {
            decision.setMessage(decision.getAction() == KeyAction.RETURN
                    ? "Llave devuelta correctamente"
                    : "Acceso concedido - Llave liberada");
        }

        log.info("Pase {} en {} ({}): {} {}", badge, requestedRoom, term,
                decision.isGranted() ? "CONCEDIDO" : "DENEGADO",
                decision.isGranted() ? decision.getAction().getWireValue() : decision.getDenialCode());
        webSocketHandler.broadcastDecision(AccessEventDto.fromDecision(decision, badge, requestedRoom, now));
        return decision;
    }

    /**
     * Busca la primera franja activa (por id ascendente) del docente en el
     * laboratorio que cubra el día y la hora actuales.
     */
    private AccessDecision evaluateSchedule(Credential credential, Room room, AcademicTerm term,
            LocalDateTime now) {
        List<ScheduleWindow> windows = scheduleStore.findActiveWindows(
                room.getId(), credential.getFaculty().getId(), term.semester());

        List<ScheduleWindow> matching = windows.stream()
                .filter(ScheduleWindow::grantsAccess)
                .filter(window -> window.covers(now))
                .collect(Collectors.toList());

        for (ScheduleWindow window : windows) {
            log.debug("Franja {} ({} {}-{}): cubre={}", window.getId(), window.getDays(),
                    window.getStartTime(), window.getEndTime(), window.covers(now));
        }

        if (!matching.isEmpty()) {
            if (matching.size() > 1) {
                log.warn("Franjas superpuestas para {} en {}: {}; se usa la franja {}",
                        credential.facultyDisplayName(), room.getCode(),
                        matching.stream().map(ScheduleWindow::getId).collect(Collectors.toList()),
                        matching.get(0).getId());
            }
            return AccessDecision.builder()
                    .granted(true)
                    .facultyName(credential.facultyDisplayName())
                    .authorizingWindowId(matching.get(0).getId())
                    .build();
        }

        boolean scheduledToday = windows.stream()
                .filter(ScheduleWindow::grantsAccess)
                .anyMatch(window -> window.coversDay(now.getDayOfWeek()));
        if (scheduledToday) {
            return denial(credential, DenialReason.OUTSIDE_SCHEDULED_TIME,
                    "Fuera del horario asignado (hora actual " + now.toLocalTime().format(TIME_FORMAT) + ")");
        }
        return denial(credential, DenialReason.NO_SCHEDULE_TODAY,
                "Sin horario para " + Weekdays.wireName(now.getDayOfWeek())
                        + " en el semestre " + term.semester());
    }

    private AccessDecision denial(Credential credential, DenialReason code, String reason) {
        return AccessDecision.builder()
                .granted(false)
                .facultyName(credential.facultyDisplayName())
                .message("Acceso denegado: " + reason)
                .denialCode(code)
                .denialReason(reason)
                .build();
    }

    private LookupException lookupFailure(LookupException failure, String badge, String roomCode) {
        log.warn("Pase rechazado ({}): tarjeta={}, laboratorio={}", failure.getCode(), badge, roomCode);
        webSocketHandler.broadcastLookupFailure(failure.getCode(), badge, roomCode, failure.getMessage());
        return failure;
    }
}
