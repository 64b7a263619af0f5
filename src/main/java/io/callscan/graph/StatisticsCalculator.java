package io.callscan.graph;

import io.callscan.model.CallGraph;
import io.callscan.model.CallGraphStatistics;
import io.callscan.model.CallGraphStatistics.MostCalled;
import io.callscan.model.FunctionNode;
import io.callscan.model.RecursionDepthInfo;

import java.util.*;

/**
 * Computes aggregate metrics over a call graph.
 * <p>
 * External and recursive counts read the node flags, so the graph should be
 * classified and marked before calling {@link #computeStatistics(CallGraph)}.
 */
public class StatisticsCalculator {

    private final RecursionAnalyzer recursionAnalyzer;
    private final CallDepthAnalyzer callDepthAnalyzer;

    public StatisticsCalculator() {
        this(new RecursionAnalyzer(), new CallDepthAnalyzer());
    }

    public StatisticsCalculator(RecursionAnalyzer recursionAnalyzer, CallDepthAnalyzer callDepthAnalyzer) {
        this.recursionAnalyzer = recursionAnalyzer;
        this.callDepthAnalyzer = callDepthAnalyzer;
    }

    public CallGraphStatistics computeStatistics(CallGraph graph) {
        int totalFunctions = graph.functionCount();
        int totalCalls = graph.callCount();

        int externalFunctions = 0;
        int recursiveFunctions = 0;
        int maxCalls = 0;
        for (FunctionNode function : graph.functions().values()) {
            if (function.isExternal()) {
                externalFunctions++;
            }
            if (function.isRecursive()) {
                recursiveFunctions++;
            }
            maxCalls = Math.max(maxCalls, graph.callsFrom(function.name()).size());
        }

        double averageCalls = totalFunctions > 0 ? (double) totalCalls / totalFunctions : 0.0;

        return new CallGraphStatistics(
                totalFunctions,
                totalCalls,
                externalFunctions,
                recursiveFunctions,
                averageCalls,
                maxCalls,
                findMostCalled(graph),
                callDepthAnalyzer.deepestCallChain(graph),
                averageRecursionDepth(graph, recursiveFunctions)
        );
    }

    /**
     * Function with the most incoming calls; ties keep function insertion order.
     * Null only for a graph without functions.
     */
    static MostCalled findMostCalled(CallGraph graph) {
        List<MostCalled> counts = new ArrayList<>();
        for (String function : graph.functions().keySet()) {
            counts.add(new MostCalled(function, graph.callsTo(function).size()));
        }
        if (counts.isEmpty()) {
            return null;
        }
        // List.sort is stable
        counts.sort(Comparator.comparingInt(MostCalled::count).reversed());
        return counts.get(0);
    }

    private double averageRecursionDepth(CallGraph graph, int recursiveFunctions) {
        if (recursiveFunctions == 0) {
            return 0.0;
        }
        int totalDepth = 0;
        for (RecursionDepthInfo info : recursionAnalyzer.calculateRecursionDepth(graph).values()) {
            if (info.directRecursionDepth() > 0) {
                totalDepth += info.directRecursionDepth();
            }
        }
        return (double) totalDepth / recursiveFunctions;
    }
}
