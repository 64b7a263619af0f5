package io.callscan.graph;

import io.callscan.config.AnalysisConfig;
import io.callscan.model.CallEdge;
import io.callscan.model.CallGraph;
import io.callscan.model.FunctionNode;
import io.callscan.model.RecursionDepthInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Computes recursion facts for every function of a call graph.
 * <ul>
 *   <li>Direct recursion depth: size of the function's recursive SCC (self-loops count as size 1)</li>
 *   <li>Indirect recursion depth: for functions outside a cycle, the deepest path position at
 *       which a function repeats, capped by {@code maxIndirectDepth}</li>
 *   <li>Recursive callees: callees that are themselves recursive</li>
 * </ul>
 */
public class RecursionAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RecursionAnalyzer.class);

    private final int maxIndirectDepth;

    public RecursionAnalyzer() {
        this(AnalysisConfig.DEFAULT_MAX_INDIRECT_DEPTH);
    }

    /**
     * @param maxIndirectDepth Cap for the indirect depth walk; results at the cap mean "at least this deep"
     */
    public RecursionAnalyzer(int maxIndirectDepth) {
        if (maxIndirectDepth < 0) {
            throw new IllegalArgumentException("maxIndirectDepth must not be negative");
        }
        this.maxIndirectDepth = maxIndirectDepth;
    }

    /**
     * Computes recursion depth information for every function without touching the graph.
     *
     * @return function id to recursion info, in function insertion order
     */
    public Map<String, RecursionDepthInfo> calculateRecursionDepth(CallGraph graph) {
        Map<String, Integer> directDepth = new HashMap<>();
        Map<String, List<String>> cycleFunctions = new HashMap<>();

        // Step 1: functions in recursive cycles
        for (List<String> component : StronglyConnectedComponents.find(graph)) {
            if (!StronglyConnectedComponents.isRecursiveCycle(graph, component)) {
                continue;
            }
            List<String> members = inGraphOrder(graph, component);
            for (String function : members) {
                directDepth.put(function, members.size());
                cycleFunctions.put(function, members);
            }
        }

        Map<String, RecursionDepthInfo> result = new LinkedHashMap<>();
        for (String function : graph.functions().keySet()) {
            int direct = directDepth.getOrDefault(function, 0);

            // Step 2: indirect depth for functions outside a cycle
            int indirect = direct == 0
                    ? findIndirectRecursionDepth(function, graph, new HashSet<>(), 0)
                    : 0;

            // Step 3: callees that are recursive
            Set<String> recursiveCallees = new LinkedHashSet<>();
            for (CallEdge call : graph.callsFrom(function)) {
                if (directDepth.getOrDefault(call.callee(), 0) > 0) {
                    recursiveCallees.add(call.callee());
                }
            }

            result.put(function, new RecursionDepthInfo(
                    function,
                    direct,
                    indirect,
                    List.copyOf(recursiveCallees),
                    cycleFunctions.getOrDefault(function, List.of())
            ));
        }

        return Collections.unmodifiableMap(result);
    }

    /**
     * Computes recursion information and flags every recursive function's node.
     * Flags are only ever raised, never cleared.
     */
    public Map<String, RecursionDepthInfo> markRecursiveFunctions(CallGraph graph) {
        Map<String, RecursionDepthInfo> depths = calculateRecursionDepth(graph);
        for (RecursionDepthInfo info : depths.values()) {
            if (info.isRecursive()) {
                graph.getFunction(info.functionId()).ifPresent(FunctionNode::markRecursive);
                log.debug("Recursive function {} (cycle: {})", info.functionId(), info.cycleFunctions());
            }
        }
        return depths;
    }

    /**
     * Walks outgoing calls depth-first. Each branch gets its own copy of the path,
     * so a repeat is only detected along the current path; the depth at which it
     * repeats is the branch's result. Branches that end without repeating count 0.
     */
    private int findIndirectRecursionDepth(String function, CallGraph graph, Set<String> path, int depth) {
        if (path.contains(function)) {
            return Math.min(depth, maxIndirectDepth);
        }
        if (depth > maxIndirectDepth) {
            return maxIndirectDepth;
        }

        path.add(function);

        int maxDepth = 0;
        for (CallEdge call : graph.callsFrom(function)) {
            int d = findIndirectRecursionDepth(call.callee(), graph, new HashSet<>(path), depth + 1);
            maxDepth = Math.max(maxDepth, d);
        }
        return maxDepth;
    }

    private static List<String> inGraphOrder(CallGraph graph, List<String> component) {
        Set<String> members = new HashSet<>(component);
        List<String> ordered = new ArrayList<>();
        for (String function : graph.functions().keySet()) {
            if (members.remove(function)) {
                ordered.add(function);
            }
        }
        // callers without a node only occur in lenient graphs
        for (String function : component) {
            if (members.contains(function)) {
                ordered.add(function);
            }
        }
        return List.copyOf(ordered);
    }

    public int getMaxIndirectDepth() {
        return maxIndirectDepth;
    }
}
