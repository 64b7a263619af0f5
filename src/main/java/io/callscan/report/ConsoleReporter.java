package io.callscan.report;

import io.callscan.analysis.AnalysisReport;
import io.callscan.analysis.ParameterMapper.CallSiteMapping;
import io.callscan.model.CallGraphStatistics;
import io.callscan.model.ExternalFunctionInfo;
import io.callscan.model.FunctionSummary;
import io.callscan.model.ParameterMapping;
import io.callscan.model.RecursionDepthInfo;
import io.callscan.model.ReturnValueInfo;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Formats analysis results for console output with ANSI colors.
 * <p>
 * Sections: summary statistics, external functions, recursion, and optionally
 * call-site parameter mappings and return values.
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";
    private static final String DIM = "\u001B[2m";

    private final boolean useColors;
    private final boolean showMappings;
    private final boolean showReturns;

    public ConsoleReporter() {
        this(true, false, false);
    }

    public ConsoleReporter(boolean useColors) {
        this(useColors, false, false);
    }

    public ConsoleReporter(boolean useColors, boolean showMappings, boolean showReturns) {
        this.useColors = useColors;
        this.showMappings = showMappings;
        this.showReturns = showReturns;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(AnalysisReport report, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out, report);
        printStatistics(out, report.statistics());
        printExternalFunctions(out, report.externalFunctions());
        printRecursion(out, report);

        if (showMappings) {
            printCallSiteMappings(out, report.callSiteMappings());
        }
        if (showReturns) {
            printReturnValues(out, report.returnValues());
        }

        printFooter(out, report);
        out.flush();
    }

    private void printHeader(PrintWriter out, AnalysisReport report) {
        out.println();
        out.println(line('=', 70));
        out.println(center("CALL-SCAN REPORT", 70));
        out.println(line('=', 70));
        out.println();

        if (report.source() != null) {
            out.println("Source: " + report.source());
        }
        if (report.analysisStartTime() != null) {
            out.println("Analysis Date: " + report.analysisStartTime());
        }
        out.println();
    }

    private void printStatistics(PrintWriter out, CallGraphStatistics stats) {
        out.println(bold("SUMMARY"));
        out.println(line('-', 70));

        out.printf("Functions: %d | Calls: %d | External: %d | Recursive: %d%n",
                stats.totalFunctions(),
                stats.totalCalls(),
                stats.externalFunctions(),
                stats.recursiveFunctions());
        out.printf("Calls per function: %.2f avg, %d max%n",
                stats.averageCallsPerFunction(),
                stats.maxCallsPerFunction());
        if (stats.mostCalledFunction() != null) {
            out.println("Most called: " + color(CYAN, stats.mostCalledFunction().name())
                    + " (" + stats.mostCalledFunction().count() + " calls)");
        }
        out.println("Deepest call chain: " + stats.deepestCallChain());
        out.printf("Average recursion depth: %.2f%n", stats.averageRecursionDepth());
        out.println();
    }

    private void printExternalFunctions(PrintWriter out, Map<String, ExternalFunctionInfo> externals) {
        if (externals.isEmpty()) {
            return;
        }

        out.println(bold("EXTERNAL FUNCTIONS") + color(CYAN, " (" + externals.size() + ")"));
        out.println(line('-', 70));

        for (ExternalFunctionInfo info : externals.values()) {
            String marker = info.safe() ? color(GREEN, "[safe]  ") : color(YELLOW, "[unsafe]");
            out.printf("  %s %-20s %-10s %s%n",
                    marker, info.name(), info.category().label(), dim(info.description()));
            if (info.hasSummary() && !info.summary().writtenParameters().isEmpty()) {
                out.println("             writes: " + writtenNames(info.summary()));
            }
        }
        out.println();
    }

    private static String writtenNames(FunctionSummary summary) {
        return summary.parameters().stream()
                .filter(p -> p.mode().writes())
                .map(p -> p.name() + " (" + p.mode().label() + ")")
                .collect(Collectors.joining(", "));
    }

    private void printRecursion(PrintWriter out, AnalysisReport report) {
        List<RecursionDepthInfo> recursive = report.recursiveFunctions();
        if (recursive.isEmpty()) {
            return;
        }

        out.println(bold("RECURSION") + color(CYAN, " (" + recursive.size() + " functions)"));
        out.println(line('-', 70));

        for (RecursionDepthInfo info : recursive) {
            String kind = report.isTailRecursive(info.functionId())
                    ? color(YELLOW, "tail-recursive")
                    : color(RED, "recursive");
            out.printf("  %s: %s, cycle size %d%n", info.functionId(), kind, info.directRecursionDepth());
            if (info.cycleFunctions().size() > 1) {
                out.println("    cycle: " + String.join(" -> ", info.cycleFunctions()));
            }
        }
        out.println();
    }

    private void printCallSiteMappings(PrintWriter out, List<CallSiteMapping> sites) {
        out.println(bold("PARAMETER MAPPINGS"));
        out.println(line('-', 70));

        for (CallSiteMapping site : sites) {
            if (site.mappings().isEmpty()) {
                continue;
            }
            String location = site.call().line() > 0 ? dim(" (line " + site.call().line() + ")") : "";
            out.println("  " + color(CYAN, site.call().pairKey()) + location);
            for (ParameterMapping mapping : site.mappings()) {
                out.printf("    %s <- %s  %s%n",
                        mapping.formalParam(),
                        mapping.actualArg(),
                        dim("[" + mapping.derivation().describe() + "]"));
            }
        }
        out.println();
    }

    private void printReturnValues(PrintWriter out, Map<String, List<ReturnValueInfo>> returns) {
        out.println(bold("RETURN VALUES"));
        out.println(line('-', 70));

        returns.forEach((function, values) -> {
            if (values.isEmpty()) {
                return;
            }
            out.println("  " + color(CYAN, function) + ":");
            for (ReturnValueInfo value : values) {
                String text = value.value().isEmpty() ? "(void)" : value.value();
                out.printf("    %s  %s%n", text,
                        dim("[" + value.type().name().toLowerCase(Locale.ROOT)
                                + ", " + value.inferredType() + ", block " + value.blockId() + "]"));
            }
        });
        out.println();
    }

    private void printFooter(PrintWriter out, AnalysisReport report) {
        out.println(line('=', 70));

        long unsafe = report.unsafeExternalFunctions().size();
        if (unsafe > 0) {
            out.println(color(YELLOW, "ATTENTION: " + unsafe + " external function(s) not known to be safe."));
        } else {
            out.println(color(GREEN, "No unsafe external functions called."));
        }

        if (!showMappings && !report.callSiteMappings().isEmpty()) {
            out.println();
            out.println("Run with --mappings for parameter mapping details.");
        }

        out.println();
    }

    // Formatting helpers

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String dim(String text) {
        return color(DIM, text);
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        if (text.length() >= width) return text;
        int padding = (width - text.length()) / 2;
        return " ".repeat(padding) + text;
    }
}
