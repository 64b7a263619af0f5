package io.callscan.graph;

import io.callscan.model.CallEdge;
import io.callscan.model.CallGraph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Computes the length of the longest acyclic call chain.
 * <p>
 * Depth-first from every function, memoizing a function's depth once its calls
 * are explored. A function already on the current path is a cycle boundary and
 * contributes no further depth, so cyclic graphs terminate. The path holds the
 * functions of the frames currently on the walk's own stack.
 */
public class CallDepthAnalyzer {

    /**
     * Returns the deepest call chain, counted in calls (a function calling nothing has depth 0).
     */
    public int deepestCallChain(CallGraph graph) {
        Map<String, Integer> depthCache = new HashMap<>();
        int maxDepth = 0;
        for (String function : graph.functions().keySet()) {
            maxDepth = Math.max(maxDepth, computeDepth(function, graph, depthCache));
        }
        return maxDepth;
    }

    /**
     * Returns the depth of every function, computed the same way as {@link #deepestCallChain}.
     */
    public Map<String, Integer> callDepths(CallGraph graph) {
        Map<String, Integer> depthCache = new HashMap<>();
        Map<String, Integer> depths = new LinkedHashMap<>();
        for (String function : graph.functions().keySet()) {
            depths.put(function, computeDepth(function, graph, depthCache));
        }
        return depths;
    }

    private int computeDepth(String function, CallGraph graph, Map<String, Integer> depthCache) {
        Set<String> path = new HashSet<>();
        Deque<Frame> frames = new ArrayDeque<>();
        Integer known = enter(function, graph, path, depthCache, frames);
        if (known != null) {
            return known;
        }

        int depth = 0;
        while (!frames.isEmpty()) {
            Frame frame = frames.peek();
            if (frame.calls.hasNext()) {
                Integer calleeDepth = enter(frame.calls.next().callee(), graph, path, depthCache, frames);
                if (calleeDepth != null) {
                    frame.depth = Math.max(frame.depth, 1 + calleeDepth);
                }
                continue;
            }

            frames.pop();
            path.remove(frame.function);
            depthCache.put(frame.function, frame.depth);

            Frame caller = frames.peek();
            if (caller != null) {
                caller.depth = Math.max(caller.depth, 1 + frame.depth);
            } else {
                depth = frame.depth;
            }
        }
        return depth;
    }

    /**
     * Returns the depth of a function that needs no exploring (memoized, or on the
     * current path), otherwise pushes a frame for it and returns null.
     */
    private static Integer enter(String function, CallGraph graph, Set<String> path,
                                 Map<String, Integer> depthCache, Deque<Frame> frames) {
        Integer cached = depthCache.get(function);
        if (cached != null) {
            return cached;
        }
        if (path.contains(function)) {
            return 0;
        }
        path.add(function);
        frames.push(new Frame(function, graph.callsFrom(function).iterator()));
        return null;
    }

    private static final class Frame {
        private final String function;
        private final Iterator<CallEdge> calls;
        private int depth;

        private Frame(String function, Iterator<CallEdge> calls) {
            this.function = function;
            this.calls = calls;
        }
    }
}
