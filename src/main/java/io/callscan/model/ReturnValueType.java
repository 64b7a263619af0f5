package io.callscan.model;

/**
 * Shape of the value returned by a return statement.
 */
public enum ReturnValueType {
    VARIABLE,
    EXPRESSION,
    CALL,
    CONSTANT,
    CONDITIONAL,
    VOID
}
