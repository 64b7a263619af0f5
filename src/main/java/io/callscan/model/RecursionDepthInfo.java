package io.callscan.model;

import java.util.List;

/**
 * Recursion facts about one function, computed fresh on every analysis run.
 *
 * @param functionId             Function identifier
 * @param directRecursionDepth   Size of the function's recursive SCC, or 0 when not in a cycle
 * @param indirectRecursionDepth Depth along the deepest call path at which a function repeats;
 *                               only computed for functions outside a cycle and capped (a capped
 *                               value means "at least this deep")
 * @param recursiveCallees       Distinct callees that are themselves recursive
 * @param cycleFunctions         Members of the function's recursive SCC (empty when not recursive)
 */
public record RecursionDepthInfo(
    String functionId,
    int directRecursionDepth,
    int indirectRecursionDepth,
    List<String> recursiveCallees,
    List<String> cycleFunctions
) {
    public RecursionDepthInfo {
        recursiveCallees = List.copyOf(recursiveCallees);
        cycleFunctions = List.copyOf(cycleFunctions);
    }

    public boolean isRecursive() {
        return directRecursionDepth > 0;
    }

    /**
     * True when the function itself is not recursive but calls into a recursive cycle.
     */
    public boolean callsIntoRecursion() {
        return !isRecursive() && !recursiveCallees.isEmpty();
    }
}
