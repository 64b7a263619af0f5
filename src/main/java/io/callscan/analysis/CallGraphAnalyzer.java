package io.callscan.analysis;

import io.callscan.analysis.ParameterMapper.CallSiteMapping;
import io.callscan.config.AnalysisConfig;
import io.callscan.graph.CallDepthAnalyzer;
import io.callscan.graph.ExternalFunctionClassifier;
import io.callscan.graph.RecursionAnalyzer;
import io.callscan.graph.StatisticsCalculator;
import io.callscan.graph.TailRecursionDetector;
import io.callscan.model.CallGraph;
import io.callscan.model.CallGraphStatistics;
import io.callscan.model.ExternalFunctionInfo;
import io.callscan.model.FunctionCfg;
import io.callscan.model.RecursionDepthInfo;
import io.callscan.model.ReturnValueInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Runs the full analysis pipeline over a call graph.
 * <p>
 * Order matters: external identification and recursion marking set the node
 * flags that tail detection and statistics read.
 * <ol>
 *   <li>Identify external functions</li>
 *   <li>Mark recursive functions</li>
 *   <li>Detect tail recursion</li>
 *   <li>Compute statistics</li>
 *   <li>Map call-site parameters</li>
 *   <li>Analyze return values</li>
 * </ol>
 * A run is single-threaded and writes to the graph's nodes, so one graph must
 * not be analyzed concurrently.
 */
public class CallGraphAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CallGraphAnalyzer.class);

    private final ExternalFunctionClassifier externalClassifier;
    private final RecursionAnalyzer recursionAnalyzer;
    private final TailRecursionDetector tailRecursionDetector;
    private final StatisticsCalculator statisticsCalculator;
    private final ParameterMapper parameterMapper;
    private final ReturnValueAnalyzer returnValueAnalyzer;

    public CallGraphAnalyzer() {
        this(AnalysisConfig.defaults());
    }

    public CallGraphAnalyzer(AnalysisConfig config) {
        this.externalClassifier = new ExternalFunctionClassifier(config.getCatalog());
        this.recursionAnalyzer = new RecursionAnalyzer(config.getMaxIndirectDepth());
        this.tailRecursionDetector = new TailRecursionDetector();
        this.statisticsCalculator = new StatisticsCalculator(recursionAnalyzer, new CallDepthAnalyzer());
        this.parameterMapper = new ParameterMapper();
        this.returnValueAnalyzer = new ReturnValueAnalyzer();
    }

    public AnalysisReport analyze(CallGraph graph) {
        return analyze(graph, Map.of(), null);
    }

    /**
     * @param graph  Graph to analyze; its node flags are updated
     * @param cfgs   CFGs by function id (functions without one skip tail and return analysis)
     * @param source Where the graph came from, for reporting; may be null
     */
    public AnalysisReport analyze(CallGraph graph, Map<String, FunctionCfg> cfgs, String source) {
        Instant start = Instant.now();
        log.debug("Analyzing {} functions, {} calls", graph.functionCount(), graph.callCount());

        Map<String, ExternalFunctionInfo> externals = externalClassifier.identifyExternalFunctions(graph);
        Map<String, RecursionDepthInfo> recursion = recursionAnalyzer.markRecursiveFunctions(graph);
        List<String> tailRecursive = tailRecursionDetector.detectTailRecursion(graph, cfgs);
        CallGraphStatistics statistics = statisticsCalculator.computeStatistics(graph);
        List<CallSiteMapping> mappings = parameterMapper.mapAllCallSites(graph);
        Map<String, List<ReturnValueInfo>> returnValues = analyzeReturnValues(graph, cfgs);

        Duration duration = Duration.between(start, Instant.now());
        log.debug("Analysis finished in {} ms: {} external, {} recursive, {} tail-recursive",
                duration.toMillis(), externals.size(), statistics.recursiveFunctions(), tailRecursive.size());

        return new AnalysisReport(source, start, duration, graph, externals, recursion, tailRecursive,
                statistics, mappings, returnValues);
    }

    private Map<String, List<ReturnValueInfo>> analyzeReturnValues(CallGraph graph, Map<String, FunctionCfg> cfgs) {
        Map<String, List<ReturnValueInfo>> result = new LinkedHashMap<>();
        for (String function : graph.functions().keySet()) {
            FunctionCfg cfg = cfgs.get(function);
            if (cfg != null) {
                result.put(function, returnValueAnalyzer.analyzeReturns(cfg));
            }
        }
        return result;
    }
}
