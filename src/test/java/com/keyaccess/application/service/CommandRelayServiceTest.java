package com.keyaccess.application.service;

import com.keyaccess.application.dto.ManualCommandDto;
import com.keyaccess.domain.exception.InvalidRequestException;
import com.keyaccess.domain.exception.LookupException;
import com.keyaccess.domain.model.DoorAction;
import com.keyaccess.domain.model.ManualCommand;
import com.keyaccess.domain.port.ManualCommandStore;
import com.keyaccess.domain.port.RoomDirectory;
import com.keyaccess.presentation.websocket.AccessWebSocketHandler;
import com.keyaccess.support.MutableClock;
import com.keyaccess.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CommandRelayServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 1, 6, 9, 0, 0);

    @Mock
    private RoomDirectory roomDirectory;

    @Mock
    private AccessWebSocketHandler webSocketHandler;

    private MutableClock clock;
    private CommandRelayService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        service = new CommandRelayService(new InMemoryCommandStore(), roomDirectory, webSocketHandler, clock);
        lenient().when(roomDirectory.findByCode("203")).thenReturn(Optional.of(TestData.room(3L, "203")));
    }

    @Test
    @DisplayName("Un comando se entrega mientras tenga 5 segundos o menos y luego deja de entregarse")
    void commandRoundTripWithinWindow() {
        service.issueCommand("203", "Luis Pérez", "open", "Mantenimiento");

        clock.advance(Duration.ofSeconds(3));
        Optional<ManualCommand> within = service.pollCommands("203");
        assertThat(within).isPresent();
        assertThat(within.get().getAction()).isEqualTo(DoorAction.OPEN);
        assertThat(within.get().getStaffName()).isEqualTo("Luis Pérez");

        clock.advance(Duration.ofSeconds(2));
        assertThat(service.pollCommands("203")).isPresent();

        clock.advance(Duration.ofSeconds(1));
        assertThat(service.pollCommands("203")).isEmpty();
    }

    @Test
    @DisplayName("Sin confirmación: consultas repetidas dentro de la ventana reciben el mismo comando")
    void repeatedPollsSeeSameCommand() {
        service.issueCommand("203", "Luis Pérez", "close", null);

        assertThat(service.pollCommands("203")).isPresent();
        assertThat(service.pollCommands("203")).isPresent();
    }

    @Test
    @DisplayName("Gana el comando más reciente de la ventana")
    void latestCommandWins() {
        service.issueCommand("203", "Luis Pérez", "open", null);
        clock.advance(Duration.ofSeconds(1));
        service.issueCommand("203", "Luis Pérez", "close", null);

        assertThat(service.pollCommands("203")).get()
                .extracting(ManualCommand::getAction).isEqualTo(DoorAction.CLOSE);
    }

    @Test
    @DisplayName("La emisión notifica al panel")
    void issuingBroadcasts() {
        ManualCommandDto dto = service.issueCommand("203", "Luis Pérez", "OPEN", null);

        assertThat(dto.getAction()).isEqualTo("open");
        verify(webSocketHandler).broadcastManualCommand(any(ManualCommandDto.class));
    }

    @Test
    @DisplayName("Acción inválida o laboratorio desconocido se rechazan")
    void invalidCommandsAreRejected() {
        lenient().when(roomDirectory.findByCode("999")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.issueCommand("203", "Luis", "toggle", null))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.issueCommand("999", "Luis", "open", null))
                .isInstanceOf(LookupException.class);
        assertThatThrownBy(() -> service.pollCommands(""))
                .isInstanceOf(InvalidRequestException.class);
    }

    /**
     * Almacén en memoria con la misma consulta que el repositorio JPA.
     */
    private static class InMemoryCommandStore implements ManualCommandStore {

        private final List<ManualCommand> commands = new ArrayList<>();

        @Override
        public ManualCommand append(ManualCommand command) {
            command.setId((long) commands.size() + 1);
            commands.add(command);
            return command;
        }

        @Override
        public Optional<ManualCommand> findLatestSince(String roomCode, LocalDateTime since) {
            return commands.stream()
                    .filter(c -> c.getRoomCode().equals(roomCode))
                    .filter(c -> !c.getCreatedAt().isBefore(since))
                    .max(Comparator.comparing(ManualCommand::getCreatedAt).thenComparing(ManualCommand::getId));
        }
    }
}
