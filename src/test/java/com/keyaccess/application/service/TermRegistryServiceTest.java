package com.keyaccess.application.service;

import com.keyaccess.domain.exception.InvalidRequestException;
import com.keyaccess.domain.model.AcademicTerm;
import com.keyaccess.domain.model.TermState;
import com.keyaccess.domain.port.TermRepository;
import com.keyaccess.presentation.websocket.AccessWebSocketHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TermRegistryServiceTest {

    private static final LocalDateTime CHANGED_AT = LocalDateTime.of(2025, 6, 1, 7, 0);

    @Mock
    private TermRepository termRepository;

    @Mock
    private AccessWebSocketHandler webSocketHandler;

    private TermRegistryService service;

    @BeforeEach
    void setUp() {
        service = new TermRegistryService(termRepository, webSocketHandler, "2025-2026", "1st");
    }

    @Test
    @DisplayName("El periodo se crea con los valores por defecto si no existe")
    void currentTermUsesConfiguredDefaults() {
        AcademicTerm defaults = new AcademicTerm("2025-2026", "1st");
        when(termRepository.getOrCreate(defaults)).thenReturn(new TermState(defaults, CHANGED_AT));

        assertThat(service.currentTerm()).isEqualTo(defaults);
        assertThat(service.lastChangedAt()).isEqualTo(CHANGED_AT);
    }

    @Test
    @DisplayName("Un cambio válido se guarda y se notifica")
    void validChangeIsStoredAndBroadcast() {
        AcademicTerm next = new AcademicTerm("2025-2026", "2nd");
        when(termRepository.getOrCreate(any())).thenReturn(
                new TermState(new AcademicTerm("2025-2026", "1st"), CHANGED_AT.minusMonths(5)));
        when(termRepository.update(next)).thenReturn(new TermState(next, CHANGED_AT));

        TermState state = service.changeTerm("2025-2026", " 2nd ");

        assertThat(state.term()).isEqualTo(next);
        verify(webSocketHandler).broadcastTermChanged(eq(next), eq(CHANGED_AT.toString()));
    }

    @Test
    @DisplayName("Formato de año o semestre inválido se rechaza sin escribir")
    void invalidValuesAreRejected() {
        assertThatThrownBy(() -> service.changeTerm("2025/2026", "1st")).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.changeTerm("2025-2026", "3rd")).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.changeTerm(null, "1st")).isInstanceOf(InvalidRequestException.class);

        verify(termRepository, never()).update(any());
    }
}
