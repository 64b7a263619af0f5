package io.callscan.graph;

import io.callscan.model.CallEdge;
import io.callscan.model.CallGraph;

import java.util.*;

/**
 * Tarjan's strongly connected components over the call graph.
 * <p>
 * Nodes are function identifiers; edges are outgoing calls. Callees without a
 * node in the graph are visited too and end up as singleton components.
 * Roots are taken in function insertion order, so the result is deterministic.
 * The walk keeps its own frame stack, so chain length is not bounded by the JVM stack.
 */
public final class StronglyConnectedComponents {

    private final CallGraph graph;

    private final Map<String, Integer> index = new HashMap<>();
    private final Map<String, Integer> lowLink = new HashMap<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private final Set<String> onStack = new HashSet<>();
    private final List<List<String>> components = new ArrayList<>();
    private int nextIndex;

    private StronglyConnectedComponents(CallGraph graph) {
        this.graph = graph;
    }

    /**
     * Partitions every function reachable in the graph into strongly connected components.
     * Components come out in reverse topological order (callees before callers).
     */
    public static List<List<String>> find(CallGraph graph) {
        StronglyConnectedComponents tarjan = new StronglyConnectedComponents(graph);
        for (String function : graph.functions().keySet()) {
            if (!tarjan.index.containsKey(function)) {
                tarjan.strongConnect(function);
            }
        }
        return List.copyOf(tarjan.components);
    }

    /**
     * Checks if a component forms a recursive cycle: more than one member, or a
     * single member calling itself.
     */
    public static boolean isRecursiveCycle(CallGraph graph, List<String> component) {
        return component.size() > 1 || (component.size() == 1 && graph.hasSelfLoop(component.get(0)));
    }

    private void strongConnect(String root) {
        Deque<Frame> callStack = new ArrayDeque<>();
        visit(root, callStack);

        while (!callStack.isEmpty()) {
            Frame frame = callStack.peek();
            String v = frame.function();

            if (frame.calls().hasNext()) {
                String w = frame.calls().next().callee();
                if (!index.containsKey(w)) {
                    visit(w, callStack);
                } else if (onStack.contains(w)) {
                    lowLink.put(v, Math.min(lowLink.get(v), index.get(w)));
                }
                continue;
            }

            callStack.pop();

            // v is the root of a component
            if (lowLink.get(v).equals(index.get(v))) {
                List<String> component = new ArrayList<>();
                String w;
                do {
                    w = stack.pop();
                    onStack.remove(w);
                    component.add(w);
                } while (!w.equals(v));
                components.add(List.copyOf(component));
            }

            Frame caller = callStack.peek();
            if (caller != null) {
                lowLink.put(caller.function(), Math.min(lowLink.get(caller.function()), lowLink.get(v)));
            }
        }
    }

    private void visit(String v, Deque<Frame> callStack) {
        index.put(v, nextIndex);
        lowLink.put(v, nextIndex);
        nextIndex++;
        stack.push(v);
        onStack.add(v);
        callStack.push(new Frame(v, graph.callsFrom(v).iterator()));
    }

    /**
     * A function being explored, with the calls not yet followed.
     */
    private record Frame(String function, Iterator<CallEdge> calls) {}
}
