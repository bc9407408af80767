package com.keyaccess.infrastructure.persistence.entity;

import com.keyaccess.domain.model.Weekdays;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Set;

/**
 * Convierte la columna day_of_week ("monday,wed,Fri") a un conjunto de días.
 * Al escribir siempre usa nombres completos en minúsculas.
 */
@Converter
public class WeekdaySetConverter implements AttributeConverter<Set<DayOfWeek>, String> {

    @Override
    public String convertToDatabaseColumn(Set<DayOfWeek> days) {
        if (days == null || days.isEmpty()) {
            return "";
        }
        return Weekdays.toStorage(days);
    }

    @Override
    public Set<DayOfWeek> convertToEntityAttribute(String column) {
        if (column == null) {
            return EnumSet.noneOf(DayOfWeek.class);
        }
        return Weekdays.parseList(column);
    }
}
