package io.callscan.model;

import java.util.List;

/**
 * A call site in the call graph from caller to callee.
 *
 * @param caller    Identifier of the calling function
 * @param callee    Identifier of the called function (may have no node in the graph)
 * @param arguments Literal actual-argument expressions, in call-site order
 * @param line      Source line of the call site, or -1 when unknown
 */
public record CallEdge(
    String caller,
    String callee,
    List<String> arguments,
    int line
) {
    public CallEdge {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public CallEdge(String caller, String callee, List<String> arguments) {
        this(caller, callee, arguments, -1);
    }

    /**
     * Key identifying the caller/callee pair, shared by repeated calls.
     */
    public String pairKey() {
        return caller + " -> " + callee;
    }

    /**
     * Check if this is a call from a function to itself.
     */
    public boolean isSelfCall() {
        return caller.equals(callee);
    }
}
