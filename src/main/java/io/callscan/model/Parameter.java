package io.callscan.model;

/**
 * A formal parameter of a function.
 *
 * @param name Parameter name as declared (e.g., "buf")
 * @param type Declared type text (e.g., "char*"), may be empty when unknown
 */
public record Parameter(String name, String type) {
    public Parameter {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name cannot be null or blank");
        }
        if (type == null) {
            type = "";
        }
    }

    public static Parameter of(String name) {
        return new Parameter(name, "");
    }
}
