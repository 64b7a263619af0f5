package io.callscan.analysis;

import io.callscan.analysis.ParameterMapper.CallSiteMapping;
import io.callscan.model.CallGraph;
import io.callscan.model.CallGraphStatistics;
import io.callscan.model.ExternalFunctionInfo;
import io.callscan.model.RecursionDepthInfo;
import io.callscan.model.ReturnValueInfo;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete result of one analysis run.
 *
 * @param source             Where the graph came from (file name), or null
 * @param analysisStartTime  When the analysis started
 * @param analysisDuration   How long the analysis took
 * @param graph              The analyzed graph, with external/recursive flags set
 * @param externalFunctions  External callee name to function info, in order of first call
 * @param recursion          Recursion info per function, in function order
 * @param tailRecursive      Tail-recursive functions, in function order
 * @param statistics         Aggregate metrics
 * @param callSiteMappings   Parameter mappings of every call to a function in the graph
 * @param returnValues       Return values per function with a CFG
 */
public record AnalysisReport(
        String source,
        Instant analysisStartTime,
        Duration analysisDuration,
        CallGraph graph,
        Map<String, ExternalFunctionInfo> externalFunctions,
        Map<String, RecursionDepthInfo> recursion,
        List<String> tailRecursive,
        CallGraphStatistics statistics,
        List<CallSiteMapping> callSiteMappings,
        Map<String, List<ReturnValueInfo>> returnValues
) {
    public AnalysisReport {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        externalFunctions = ordered(externalFunctions);
        recursion = ordered(recursion);
        tailRecursive = tailRecursive == null ? List.of() : List.copyOf(tailRecursive);
        callSiteMappings = callSiteMappings == null ? List.of() : List.copyOf(callSiteMappings);
        returnValues = ordered(returnValues);
    }

    private static <V> Map<String, V> ordered(Map<String, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public boolean isTailRecursive(String functionId) {
        return tailRecursive.contains(functionId);
    }

    /**
     * Returns the external functions not known to be safe.
     */
    public List<ExternalFunctionInfo> unsafeExternalFunctions() {
        return externalFunctions.values().stream()
                .filter(info -> !info.safe())
                .toList();
    }

    /**
     * Returns the recursion info of the functions that are recursive.
     */
    public List<RecursionDepthInfo> recursiveFunctions() {
        return recursion.values().stream()
                .filter(RecursionDepthInfo::isRecursive)
                .toList();
    }
}
