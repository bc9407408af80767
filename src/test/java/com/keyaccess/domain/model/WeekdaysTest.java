package com.keyaccess.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.DayOfWeek;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class WeekdaysTest {

    @ParameterizedTest
    @ValueSource(strings = { "monday", "Monday", "MON", "mon", " Mon " })
    @DisplayName("Nombres completos y abreviaturas se normalizan en cualquier capitalización")
    void parsesFullNamesAndAbbreviations(String text) {
        assertThat(Weekdays.parse(text)).contains(DayOfWeek.MONDAY);
    }

    @Test
    @DisplayName("Texto no reconocible no produce día")
    void rejectsUnknownNames() {
        assertThat(Weekdays.parse("lunes")).isEmpty();
        assertThat(Weekdays.parse(null)).isEmpty();
    }

    @Test
    @DisplayName("Listas mixtas se convierten a conjunto y se guardan en forma canónica")
    void parsesAndStoresLists() {
        assertThat(Weekdays.parseList("Wed, monday,FRI,xyz"))
                .containsExactlyInAnyOrder(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY);
        assertThat(Weekdays.parseList("")).isEmpty();

        assertThat(Weekdays.toStorage(EnumSet.of(DayOfWeek.FRIDAY, DayOfWeek.MONDAY)))
                .isEqualTo("monday,friday");
    }
}
