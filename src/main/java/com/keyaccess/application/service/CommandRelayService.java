package com.keyaccess.application.service;

import com.keyaccess.application.dto.ManualCommandDto;
import com.keyaccess.domain.exception.InvalidRequestException;
import com.keyaccess.domain.exception.LookupException;
import com.keyaccess.domain.model.DoorAction;
import com.keyaccess.domain.model.ManualCommand;
import com.keyaccess.domain.model.Room;
import com.keyaccess.domain.port.ManualCommandStore;
import com.keyaccess.domain.port.RoomDirectory;
import com.keyaccess.presentation.websocket.AccessWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Relevo de comandos manuales de puerta. Los controladores consultan cada
 * pocos segundos y reciben el comando más reciente creado dentro de la
 * ventana; no hay confirmación ni marca de consumo.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommandRelayService {

    /** Antigüedad máxima (inclusive) de un comando entregable */
    public static final Duration COMMAND_WINDOW = Duration.ofSeconds(5);

    private final ManualCommandStore commandStore;
    private final RoomDirectory roomDirectory;
    private final AccessWebSocketHandler webSocketHandler;
    private final Clock clock;

    /**
     * Registra un comando de apertura o cierre para un laboratorio.
     *
     * @param roomCode código del laboratorio (debe existir y estar activo)
     * @param staff    nombre del personal que lo emite
     * @param action   "open" o "close"
     * @param notes    nota opcional
     * @return comando guardado
     */
    public ManualCommandDto issueCommand(String roomCode, String staff, String action, String notes) {
        if (roomCode == null || roomCode.isBlank()) {
            throw InvalidRequestException.missingParameter("room");
        }
        if (action == null || action.isBlank()) {
            throw InvalidRequestException.missingParameter("action");
        }
        DoorAction doorAction = DoorAction.fromWireValue(action)
                .orElseThrow(() -> InvalidRequestException.invalidValue("action", action));

        String code = roomCode.trim();
        Room room = roomDirectory.findByCode(code)
                .filter(Room::isActive)
                .orElseThrow(() -> LookupException.roomUnknown(code));

        ManualCommand saved = commandStore.append(ManualCommand.builder()
                .roomId(room.getId())
                .roomCode(room.getCode())
                .staffName(staff != null && !staff.isBlank() ? staff.trim() : "Desconocido")
                .action(doorAction)
                .notes(notes)
                .createdAt(LocalDateTime.now(clock))
                .build());

        log.info("Comando manual '{}' para {} emitido por {}", doorAction.getWireValue(), room.getCode(),
                saved.getStaffName());
        ManualCommandDto dto = ManualCommandDto.fromDomain(saved);
        webSocketHandler.broadcastManualCommand(dto);
        return dto;
    }

    /**
     * Comando más reciente del laboratorio creado hace 5 segundos o menos.
     *
     * @param roomCode código del laboratorio
     * @return comando pendiente, o vacío
     */
    public Optional<ManualCommand> pollCommands(String roomCode) {
        if (roomCode == null || roomCode.isBlank()) {
            throw InvalidRequestException.missingParameter("room");
        }
        LocalDateTime since = LocalDateTime.now(clock).minus(COMMAND_WINDOW);
        Optional<ManualCommand> command = commandStore.findLatestSince(roomCode.trim(), since);
        command.ifPresent(c -> log.debug("Entregando comando '{}' a {}", c.getAction().getWireValue(), c.getRoomCode()));
        return command;
    }
}
