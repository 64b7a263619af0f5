package io.callscan.model;

import java.util.List;

/**
 * A value returned from a function.
 *
 * @param value         Returned expression text (empty for a void return)
 * @param blockId       Block holding the return statement
 * @param statementId   Statement identifier, may be null
 * @param type          Shape of the returned value
 * @param usedVariables Variables the value reads
 * @param inferredType  Best-effort type label ("auto" when it needs the call graph)
 */
public record ReturnValueInfo(
    String value,
    String blockId,
    String statementId,
    ReturnValueType type,
    List<String> usedVariables,
    String inferredType
) {
    public ReturnValueInfo {
        usedVariables = List.copyOf(usedVariables);
    }
}
