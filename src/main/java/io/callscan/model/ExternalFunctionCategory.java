package io.callscan.model;

import java.util.Locale;

/**
 * Categories of functions defined outside the analyzed program.
 */
public enum ExternalFunctionCategory {
    STDLIB("stdlib", "C standard library"),
    CPP_STDLIB("cstdlib", "C++ standard library"),
    POSIX("posix", "POSIX"),
    SYSTEM("system", "System call"),
    UNKNOWN("unknown", "Unknown external");

    private final String label;
    private final String displayName;

    ExternalFunctionCategory(String label, String displayName) {
        this.label = label;
        this.displayName = displayName;
    }

    public String label() {
        return label;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Parses a label ("stdlib", "posix", ...) or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException for an unrecognized value
     */
    public static ExternalFunctionCategory fromLabel(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExternalFunctionCategory category : values()) {
            if (category.label.equals(normalized) || category.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown external function category: " + value);
    }
}
