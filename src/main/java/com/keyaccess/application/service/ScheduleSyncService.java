package com.keyaccess.application.service;

import com.keyaccess.application.dto.OfflineAccessRequest;
import com.keyaccess.application.dto.ScheduleDownloadDto;
import com.keyaccess.application.dto.ScheduleEntryDto;
import com.keyaccess.domain.exception.InvalidRequestException;
import com.keyaccess.domain.exception.LookupException;
import com.keyaccess.domain.model.AcademicTerm;
import com.keyaccess.domain.model.Credential;
import com.keyaccess.domain.model.LedgerEntry;
import com.keyaccess.domain.model.Room;
import com.keyaccess.domain.model.ScheduleWindow;
import com.keyaccess.domain.model.Weekdays;
import com.keyaccess.domain.port.CredentialDirectory;
import com.keyaccess.domain.port.RoomDirectory;
import com.keyaccess.domain.port.ScheduleStore;
import com.keyaccess.domain.port.TermProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Protocolo de sincronización con los controladores: descarga del horario,
 * verificación de cambios e ingreso de accesos decididos sin conexión.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleSyncService {

    private static final DateTimeFormatter SERVER_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final RoomDirectory roomDirectory;
    private final CredentialDirectory credentialDirectory;
    private final ScheduleStore scheduleStore;
    private final TermProvider termProvider;
    private final SessionLedgerService sessionLedger;
    private final Clock clock;

    /**
     * Genera el horario del laboratorio para el periodo vigente, con una fila
     * por franja y día.
     *
     * @param roomCode código del laboratorio
     * @return horario listo para la caché del controlador
     */
    public ScheduleDownloadDto downloadSchedule(String roomCode) {
        Room room = resolveActiveRoom(roomCode);
        AcademicTerm term = termProvider.currentTerm();
        LocalDateTime now = LocalDateTime.now(clock);

        List<ScheduleEntryDto> entries = new ArrayList<>();
        for (ScheduleWindow window : scheduleStore.findActiveWindowsForRoom(room.getId(), term.semester())) {
            List<String> badgeCodes = window.getFacultyId() != null
                    ? credentialDirectory.findActiveBadgeCodes(window.getFacultyId(), room.getId())
                    : Collections.emptyList();
            for (DayOfWeek day : new TreeSet<>(window.getDays())) {
                entries.add(ScheduleEntryDto.of(window, day, badgeCodes));
            }
        }

        log.info("Horario descargado para {} ({}): {} filas", room.getCode(), term, entries.size());

        return ScheduleDownloadDto.builder()
                .status("success")
                .roomCode(room.getCode())
                .semester(term.semester())
                .academicYear(term.academicYear())
                .scheduleCount(entries.size())
                .schedules(entries)
                .lastUpdated(now.toString())
                .serverTime(now.format(SERVER_TIME_FORMAT))
                .dayOfWeek(Weekdays.wireName(now.getDayOfWeek()))
                .build();
    }

    /**
     * Indica si el controlador debe volver a descargar el horario: sin
     * sincronización previa legible, con franjas modificadas después de ella
     * o con un cambio de periodo posterior.
     *
     * @param roomCode código del laboratorio
     * @param lastSync instante de la última sincronización (ISO-8601)
     * @return true si la caché está desactualizada
     */
    public boolean needsUpdate(String roomCode, String lastSync) {
        Room room = resolveActiveRoom(roomCode);

        Optional<LocalDateTime> since = parseTimestamp(lastSync);
        if (since.isEmpty()) {
            log.debug("Sincronización previa ausente o ilegible para {}: '{}'", room.getCode(), lastSync);
            return true;
        }

        LocalDateTime termChangedAt = termProvider.lastChangedAt();
        if (termChangedAt != null && termChangedAt.isAfter(since.get())) {
            return true;
        }
        return scheduleStore.hasChangesSince(room.getId(), termProvider.currentTerm().semester(), since.get());
    }

    /**
     * Incorpora al libro un acceso decidido sin conexión.
     *
     * @param request evento informado por el controlador
     * @return entrada escrita en el libro
     */
    public LedgerEntry logOfflineAccess(OfflineAccessRequest request) {
        if (request == null || isBlank(request.getRoomCode())) {
            throw InvalidRequestException.missingParameter("room_code");
        }
        if (isBlank(request.getRfidCode())) {
            throw InvalidRequestException.missingParameter("rfid_code");
        }
        if (request.getAccessGranted() == null) {
            throw InvalidRequestException.missingParameter("access_granted");
        }
        if (isBlank(request.getTimestamp())) {
            throw InvalidRequestException.missingParameter("timestamp");
        }
        LocalDateTime at = parseTimestamp(request.getTimestamp())
                .orElseThrow(() -> InvalidRequestException.invalidValue("timestamp", request.getTimestamp()));

        String badge = request.getRfidCode().trim();
        String roomCode = request.getRoomCode().trim();
        Credential credential = credentialDirectory.findByBadgeCode(badge)
                .orElseThrow(() -> LookupException.credentialUnknown(badge));
        Room room = roomDirectory.findByCode(roomCode)
                .orElseThrow(() -> LookupException.roomUnknown(roomCode));

        LedgerEntry entry = sessionLedger.mergeOffline(credential, room, termProvider.currentTerm(), at,
                request.getAccessGranted());
        log.info("Acceso sin conexión registrado: {} en {} a las {} ({})",
                credential.facultyDisplayName(), room.getCode(), at, entry.action());
        return entry;
    }

    private Room resolveActiveRoom(String roomCode) {
        if (isBlank(roomCode)) {
            throw InvalidRequestException.missingParameter("room");
        }
        String code = roomCode.trim();
        return roomDirectory.findByCode(code)
                .filter(Room::isActive)
                .orElseThrow(() -> LookupException.roomUnknown(code));
    }

    /**
     * Interpreta una marca de tiempo ISO-8601 local, con zona, o con espacio
     * en lugar de la T. Las marcas con zona se llevan a la zona del reloj.
     */
    Optional<LocalDateTime> parseTimestamp(String text) {
        if (isBlank(text)) {
            return Optional.empty();
        }
        String value = text.trim();
        List<Function<String, LocalDateTime>> parsers = List.of(
                LocalDateTime::parse,
                v -> OffsetDateTime.parse(v).atZoneSameInstant(clock.getZone()).toLocalDateTime(),
                v -> LocalDateTime.parse(v, SERVER_TIME_FORMAT));

        for (Function<String, LocalDateTime> parser : parsers) {
            try {
                return Optional.of(parser.apply(value));
            } catch (DateTimeParseException e) {
                log.trace("Formato no reconocido para '{}': {}", value, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
