package io.callscan.model;

/**
 * Information about a function called by, but not defined in, the program.
 *
 * @param name           Function name
 * @param category       Library family the function belongs to
 * @param description    Human-readable description
 * @param safe           Security assessment; false unless the function is known to be safe
 * @param parameterCount Declared parameter count, or -1 for variadic/unknown
 * @param returnType     Return type label ("auto" when unresolved)
 * @param summary        Parameter and return effects, or null when the function is not summarized
 */
public record ExternalFunctionInfo(
    String name,
    ExternalFunctionCategory category,
    String description,
    boolean safe,
    int parameterCount,
    String returnType,
    FunctionSummary summary
) {
    public static final int VARIADIC = -1;

    public ExternalFunctionInfo {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("External function name cannot be null or blank");
        }
        if (category == null) {
            category = ExternalFunctionCategory.UNKNOWN;
        }
        if (description == null) {
            description = "";
        }
        if (returnType == null || returnType.isBlank()) {
            returnType = "auto";
        }
    }

    public ExternalFunctionInfo(String name, ExternalFunctionCategory category, String description,
                                boolean safe, int parameterCount, String returnType) {
        this(name, category, description, safe, parameterCount, returnType, null);
    }

    /**
     * Generic, conservatively unsafe record for a function missing from the catalog.
     */
    public static ExternalFunctionInfo unknown(String name, ExternalFunctionCategory category) {
        return new ExternalFunctionInfo(name, category, "Unknown external function", false, VARIADIC, "auto");
    }

    public boolean isVariadic() {
        return parameterCount == VARIADIC;
    }

    public boolean hasSummary() {
        return summary != null;
    }

    public ExternalFunctionInfo withSummary(FunctionSummary summary) {
        return new ExternalFunctionInfo(name, category, description, safe, parameterCount, returnType, summary);
    }
}
