package io.callscan.model;

import java.util.List;
import java.util.Optional;

/**
 * Effect summary of a library function whose body is not available: which
 * parameters it reads or writes, what its return value depends on, and which
 * globals it touches.
 *
 * @param name          Function name
 * @param category      Functional group ("string", "memory", "io", ...)
 * @param description   What the function does
 * @param parameters    Parameter summaries, indexed from 0; variadic tails are not listed
 * @param returnValue   Return value summary
 * @param globalEffects Globals the function reads or modifies
 */
public record FunctionSummary(
    String name,
    String category,
    String description,
    List<ParameterSummary> parameters,
    ReturnSummary returnValue,
    List<GlobalEffect> globalEffects
) {
    public FunctionSummary {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Summary name cannot be null or blank");
        }
        category = category == null ? "" : category;
        description = description == null ? "" : description;
        parameters = List.copyOf(parameters);
        globalEffects = List.copyOf(globalEffects);
        if (returnValue == null) {
            returnValue = ReturnSummary.VOID;
        }
    }

    public Optional<ParameterSummary> parameter(int index) {
        return parameters.stream().filter(p -> p.index() == index).findFirst();
    }

    /**
     * Indices of parameters the function writes through (OUT or INOUT).
     */
    public List<Integer> writtenParameters() {
        return parameters.stream()
                .filter(p -> p.mode().writes())
                .map(ParameterSummary::index)
                .toList();
    }

    /**
     * Indices of parameters whose contents flow into the return value.
     */
    public List<Integer> taintingParameters() {
        return parameters.stream()
                .filter(ParameterSummary::taintPropagation)
                .map(ParameterSummary::index)
                .toList();
    }

    public boolean hasSideEffects() {
        return !writtenParameters().isEmpty()
                || globalEffects.stream().anyMatch(GlobalEffect::modified);
    }

    /**
     * @param index            Zero-based position
     * @param name             Parameter name
     * @param mode             Read, write, or both
     * @param taintPropagation Whether the parameter's contents reach the return value
     * @param description      Purpose of the parameter
     */
    public record ParameterSummary(int index, String name, ParameterMode mode, boolean taintPropagation,
                                   String description) {
        public ParameterSummary {
            if (index < 0) {
                throw new IllegalArgumentException("Parameter index cannot be negative: " + index);
            }
            mode = mode == null ? ParameterMode.IN : mode;
            description = description == null ? "" : description;
        }
    }

    /**
     * @param type        Return type label
     * @param tainted     Whether any parameter taints the return value
     * @param depends     Indices of parameters the return value depends on
     * @param description What is returned
     */
    public record ReturnSummary(String type, boolean tainted, List<Integer> depends, String description) {
        public static final ReturnSummary VOID = new ReturnSummary("void", false, List.of(), "No return value");

        public ReturnSummary {
            type = type == null || type.isBlank() ? "auto" : type;
            depends = List.copyOf(depends);
            description = description == null ? "" : description;
        }
    }

    /**
     * @param variable    Global variable name
     * @param modified    Whether the function writes it
     * @param tainted     Whether the written value is externally controlled
     * @param description Nature of the effect
     */
    public record GlobalEffect(String variable, boolean modified, boolean tainted, String description) {
        public GlobalEffect {
            description = description == null ? "" : description;
        }
    }
}
