package io.callscan.model;

/**
 * Pairs a callee's formal parameter with the caller's actual argument.
 *
 * @param formalParam Formal parameter name
 * @param actualArg   Actual argument text, trimmed
 * @param derivation  How the argument is derived
 * @param position    Zero-based argument position
 */
public record ParameterMapping(
    String formalParam,
    String actualArg,
    ArgumentDerivation derivation,
    int position
) {}
