package io.callscan.model;

/**
 * Aggregate metrics over a call graph snapshot.
 *
 * @param totalFunctions          Number of function nodes
 * @param totalCalls              Number of call sites
 * @param externalFunctions       Function nodes flagged external
 * @param recursiveFunctions      Function nodes flagged recursive
 * @param averageCallsPerFunction Call sites divided by function count (0 for an empty graph)
 * @param maxCallsPerFunction     Largest outgoing call count of any function
 * @param mostCalledFunction      Function with the most incoming calls, or null for an empty graph
 * @param deepestCallChain        Length of the longest acyclic call chain
 * @param averageRecursionDepth   Mean direct recursion depth over recursive functions (0 when none)
 */
public record CallGraphStatistics(
    int totalFunctions,
    int totalCalls,
    int externalFunctions,
    int recursiveFunctions,
    double averageCallsPerFunction,
    int maxCallsPerFunction,
    MostCalled mostCalledFunction,
    int deepestCallChain,
    double averageRecursionDepth
) {
    /**
     * A function and its incoming call count.
     */
    public record MostCalled(String name, int count) {}

    public static CallGraphStatistics empty() {
        return new CallGraphStatistics(0, 0, 0, 0, 0.0, 0, null, 0, 0.0);
    }
}
