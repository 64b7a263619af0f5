package io.callscan.report;

import io.callscan.analysis.AnalysisReport;
import io.callscan.config.AnalysisConfig;
import io.callscan.model.CallEdge;
import io.callscan.model.CallGraph;
import io.callscan.model.FunctionNode;

import java.io.IOException;
import java.io.Writer;
import java.util.*;

/**
 * Renders the call graph in Graphviz DOT format.
 * <p>
 * Node style follows the node's flags, first match wins:
 * external (dotted gray), tail-recursive (orange), recursive (red),
 * hub with more than {@code hubCallThreshold} outgoing calls (blue), default.
 * Repeated calls between the same pair collapse into one edge labelled {@code Nx}.
 */
public class DotReporter implements Reporter {

    private final int hubCallThreshold;

    public DotReporter() {
        this(AnalysisConfig.DEFAULT_HUB_CALL_THRESHOLD);
    }

    public DotReporter(int hubCallThreshold) {
        this.hubCallThreshold = hubCallThreshold;
    }

    @Override
    public String format() {
        return "dot";
    }

    @Override
    public void write(AnalysisReport report, Writer writer) throws IOException {
        writer.write(render(report.graph(), report.tailRecursive()));
        writer.flush();
    }

    /**
     * Renders the graph; node flags must already be set.
     */
    public String render(CallGraph graph, Collection<String> tailRecursive) {
        Set<String> tail = new HashSet<>(tailRecursive);
        StringBuilder dot = new StringBuilder();
        dot.append("digraph CallGraph {\n");
        dot.append("  rankdir=LR;\n");
        dot.append("  node [shape=box, style=rounded];\n\n");

        for (FunctionNode function : graph.functions().values()) {
            int outgoing = graph.callsFrom(function.name()).size();
            dot.append("  ").append(quote(function.name()))
               .append(" [label=\"").append(escape(function.name())).append("\\n(").append(outgoing).append(" calls)\"");
            String style = nodeStyle(function, tail.contains(function.name()), outgoing);
            if (!style.isEmpty()) {
                dot.append(", ").append(style);
            }
            dot.append("];\n");
        }

        dot.append("\n");

        Map<String, Integer> edgeCounts = new LinkedHashMap<>();
        Map<String, CallEdge> firstEdge = new LinkedHashMap<>();
        for (CallEdge call : graph.calls()) {
            edgeCounts.merge(call.pairKey(), 1, Integer::sum);
            firstEdge.putIfAbsent(call.pairKey(), call);
        }

        for (Map.Entry<String, CallEdge> entry : firstEdge.entrySet()) {
            CallEdge call = entry.getValue();
            int count = edgeCounts.get(entry.getKey());
            dot.append("  ").append(quote(call.caller())).append(" -> ").append(quote(call.callee()));
            if (count > 1) {
                dot.append(" [label=\"").append(count).append("x\"]");
            }
            dot.append(";\n");
        }

        dot.append("}\n");
        return dot.toString();
    }

    private String nodeStyle(FunctionNode function, boolean tailRecursive, int outgoing) {
        if (function.isExternal()) {
            return "style=dotted, color=gray";
        }
        if (function.isRecursive()) {
            return tailRecursive
                    ? "color=orange, style=filled, fillcolor=lightyellow"
                    : "color=red, style=filled, fillcolor=lightpink";
        }
        if (outgoing > hubCallThreshold) {
            return "color=blue, style=filled, fillcolor=lightblue";
        }
        return "";
    }

    private static String quote(String id) {
        return "\"" + escape(id) + "\"";
    }

    // backslashes before quotes
    private static String escape(String id) {
        return id.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
