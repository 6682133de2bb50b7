package io.cronhive.core;

import java.util.Locale;

public enum Priority {

    HIGHEST(20),
    HIGH(10),
    NORMAL(0),
    LOW(-10),
    LOWEST(-20);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * Parses a named level ("low", "high", ...) or a raw integer.
     */
    public static int parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("priority must not be blank");
        }
        String s = text.trim();
        if (s.matches("^[+-]?\\d+$")) {
            try {
                return Integer.parseInt(s);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("priority out of range: " + text);
            }
        }
        try {
            return Priority.valueOf(s.toUpperCase(Locale.ROOT)).value();
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown priority: " + text);
        }
    }
}
