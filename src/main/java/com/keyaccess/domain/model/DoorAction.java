package com.keyaccess.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Acción de un comando manual de puerta. El controlador debe aplicarla como
 * "fijar estado", nunca como alternar.
 */
public enum DoorAction {

    OPEN,
    CLOSE;

    public String getWireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<DoorAction> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "open" -> Optional.of(OPEN);
            case "close" -> Optional.of(CLOSE);
            default -> Optional.empty();
        };
    }
}
