package io.callscan.model;

/**
 * Thrown when caller-supplied call graph data violates a structural invariant,
 * such as a call edge whose caller is not a function of the graph.
 */
public class MalformedCallGraphException extends RuntimeException {

    public MalformedCallGraphException(String message) {
        super(message);
    }
}
