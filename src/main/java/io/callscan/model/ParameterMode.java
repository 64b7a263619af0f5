package io.callscan.model;

import java.util.Locale;

/**
 * How a library function accesses one of its parameters.
 */
public enum ParameterMode {
    IN("in"),
    OUT("out"),
    INOUT("inout");

    private final String label;

    ParameterMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean reads() {
        return this != OUT;
    }

    public boolean writes() {
        return this != IN;
    }

    /**
     * Parses "in", "out" or "inout", case-insensitively.
     *
     * @throws IllegalArgumentException for an unrecognized value
     */
    public static ParameterMode fromLabel(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ParameterMode mode : values()) {
            if (mode.label.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown parameter mode: " + value);
    }
}
