package com.keyaccess.domain.model;

import java.time.DayOfWeek;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Normalización de los nombres de día guardados como texto libre. Acepta
 * nombres completos y abreviaturas de tres letras en cualquier capitalización;
 * dentro del núcleo solo circula {@link DayOfWeek}.
 */
public final class Weekdays {

    private static final Map<String, DayOfWeek> ALIASES = Map.ofEntries(
            Map.entry("monday", DayOfWeek.MONDAY), Map.entry("mon", DayOfWeek.MONDAY),
            Map.entry("tuesday", DayOfWeek.TUESDAY), Map.entry("tue", DayOfWeek.TUESDAY),
            Map.entry("wednesday", DayOfWeek.WEDNESDAY), Map.entry("wed", DayOfWeek.WEDNESDAY),
            Map.entry("thursday", DayOfWeek.THURSDAY), Map.entry("thu", DayOfWeek.THURSDAY),
            Map.entry("friday", DayOfWeek.FRIDAY), Map.entry("fri", DayOfWeek.FRIDAY),
            Map.entry("saturday", DayOfWeek.SATURDAY), Map.entry("sat", DayOfWeek.SATURDAY),
            Map.entry("sunday", DayOfWeek.SUNDAY), Map.entry("sun", DayOfWeek.SUNDAY));

    private Weekdays() {
    }

    /**
     * Convierte un nombre de día ("Monday", "mon", "WED") a {@link DayOfWeek}.
     *
     * @param text texto del día
     * @return el día, o vacío si el texto no es reconocible
     */
    public static Optional<DayOfWeek> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ALIASES.get(text.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Convierte una lista separada por comas ("monday,wed") a un conjunto de
     * días. Los elementos no reconocibles se ignoran.
     */
    public static Set<DayOfWeek> parseList(String text) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (text == null || text.isBlank()) {
            return days;
        }
        for (String part : text.split(",")) {
            parse(part).ifPresent(days::add);
        }
        return days;
    }

    /**
     * Nombre en minúsculas usado en el protocolo con los controladores
     * ("monday").
     */
    public static String wireName(DayOfWeek day) {
        return day.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Forma canónica de almacenamiento: nombres completos en orden de semana.
     */
    public static String toStorage(Collection<DayOfWeek> days) {
        return days.stream()
                .sorted()
                .map(Weekdays::wireName)
                .collect(Collectors.joining(","));
    }
}
