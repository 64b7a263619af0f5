package io.callscan.model;

import java.util.*;

/**
 * The call graph of an analyzed program: function nodes plus the call sites
 * between them.
 * <p>
 * Calls are exposed three ways: the flat list in discovery order, an index from
 * caller to its outgoing calls and an index from callee to its incoming calls.
 * All three are built together by {@link Builder} and are never mutated
 * afterwards, so they always agree. Only the {@code external}/{@code recursive}
 * flags on the nodes change after construction.
 */
public class CallGraph {

    private final Map<String, FunctionNode> functions;
    private final List<CallEdge> calls;

    // Derived indexes
    private final Map<String, List<CallEdge>> callsFrom;  // caller -> outgoing calls
    private final Map<String, List<CallEdge>> callsTo;    // callee -> incoming calls

    private CallGraph(Map<String, FunctionNode> functions, List<CallEdge> calls) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.calls = List.copyOf(calls);

        Map<String, List<CallEdge>> from = new LinkedHashMap<>();
        Map<String, List<CallEdge>> to = new LinkedHashMap<>();
        for (CallEdge call : this.calls) {
            from.computeIfAbsent(call.caller(), k -> new ArrayList<>()).add(call);
            to.computeIfAbsent(call.callee(), k -> new ArrayList<>()).add(call);
        }
        this.callsFrom = freeze(from);
        this.callsTo = freeze(to);
    }

    private static Map<String, List<CallEdge>> freeze(Map<String, List<CallEdge>> index) {
        Map<String, List<CallEdge>> frozen = new LinkedHashMap<>();
        index.forEach((key, edges) -> frozen.put(key, List.copyOf(edges)));
        return Collections.unmodifiableMap(frozen);
    }

    /**
     * Returns all function nodes keyed by identifier, in insertion order.
     */
    public Map<String, FunctionNode> functions() {
        return functions;
    }

    /**
     * Returns the function node for the given identifier, or empty if not in the graph.
     */
    public Optional<FunctionNode> getFunction(String id) {
        return Optional.ofNullable(functions.get(id));
    }

    public boolean hasFunction(String id) {
        return functions.containsKey(id);
    }

    /**
     * Checks if the function has a node with a body in this graph.
     */
    public boolean isDefined(String id) {
        FunctionNode node = functions.get(id);
        return node != null && !node.isDeclarationOnly();
    }

    /**
     * Returns every call site in discovery order.
     */
    public List<CallEdge> calls() {
        return calls;
    }

    /**
     * Returns the calls made by the given function.
     */
    public List<CallEdge> callsFrom(String caller) {
        return callsFrom.getOrDefault(caller, List.of());
    }

    /**
     * Returns the calls targeting the given function.
     */
    public List<CallEdge> callsTo(String callee) {
        return callsTo.getOrDefault(callee, List.of());
    }

    /**
     * Returns the outgoing-call index.
     */
    public Map<String, List<CallEdge>> callsFromIndex() {
        return callsFrom;
    }

    /**
     * Returns the incoming-call index.
     */
    public Map<String, List<CallEdge>> callsToIndex() {
        return callsTo;
    }

    /**
     * Returns the distinct functions calling the given function.
     */
    public List<String> callers(String callee) {
        Set<String> callers = new LinkedHashSet<>();
        for (CallEdge call : callsTo(callee)) {
            callers.add(call.caller());
        }
        return List.copyOf(callers);
    }

    /**
     * Returns the distinct functions called by the given function.
     */
    public List<String> callees(String caller) {
        Set<String> callees = new LinkedHashSet<>();
        for (CallEdge call : callsFrom(caller)) {
            callees.add(call.callee());
        }
        return List.copyOf(callees);
    }

    /**
     * Checks if the function calls itself directly.
     */
    public boolean hasSelfLoop(String id) {
        return callsFrom(id).stream().anyMatch(CallEdge::isSelfCall);
    }

    public int functionCount() {
        return functions.size();
    }

    public int callCount() {
        return calls.size();
    }

    public boolean isEmpty() {
        return functions.isEmpty() && calls.isEmpty();
    }

    /**
     * Create an empty call graph.
     */
    public static CallGraph empty() {
        return new CallGraph(Map.of(), List.of());
    }

    /**
     * Builder for constructing a CallGraph.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, FunctionNode> functions = new LinkedHashMap<>();
        private final List<CallEdge> calls = new ArrayList<>();
        private boolean validate = true;

        public Builder addFunction(FunctionNode function) {
            functions.put(function.name(), function);
            return this;
        }

        /**
         * Adds functions without parameters, one per name.
         */
        public Builder addFunctions(String... names) {
            for (String name : names) {
                addFunction(FunctionNode.of(name));
            }
            return this;
        }

        public Builder addCall(CallEdge call) {
            calls.add(call);
            return this;
        }

        public Builder addCall(String caller, String callee, String... arguments) {
            return addCall(new CallEdge(caller, callee, Arrays.asList(arguments)));
        }

        /**
         * Skips caller validation in {@link #build()}, for partial graphs handed
         * over by extractors that only know some callers.
         */
        public Builder lenient() {
            this.validate = false;
            return this;
        }

        /**
         * Builds the graph and its call indexes.
         *
         * @throws MalformedCallGraphException if a call originates from a function that is not in the graph
         */
        public CallGraph build() {
            if (validate) {
                for (CallEdge call : calls) {
                    if (!functions.containsKey(call.caller())) {
                        throw new MalformedCallGraphException(
                            "Call " + call.pairKey() + " originates from unknown function '" + call.caller() + "'");
                    }
                }
            }
            return new CallGraph(functions, calls);
        }
    }
}
