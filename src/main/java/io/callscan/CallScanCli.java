package io.callscan;

import io.callscan.analysis.AnalysisReport;
import io.callscan.analysis.CallGraphAnalyzer;
import io.callscan.config.AnalysisConfig;
import io.callscan.input.CallGraphLoader;
import io.callscan.input.CallGraphLoader.LoadedProgram;
import io.callscan.model.MalformedCallGraphException;
import io.callscan.report.ConsoleReporter;
import io.callscan.report.DotReporter;
import io.callscan.report.JsonReporter;
import io.callscan.report.Reporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the call-scan tool.
 */
@Command(
        name = "call-scan",
        mixinStandardHelpOptions = true,
        version = "call-scan 1.0.0",
        description = "Analyzes an extracted call graph: external functions, recursion, tail calls, "
                + "statistics and argument derivation.",
        footer = {
                "",
                "Examples:",
                "  call-scan graph.json",
                "  call-scan graph.json --output-format dot --output-file graph.dot",
                "  call-scan graph.json --mappings --returns --config call-scan.yaml"
        }
)
public class CallScanCli implements Callable<Integer> {

    @Parameters(
            index = "0",
            description = "Path to the call graph JSON document"
    )
    private Path graphFile;

    @Option(
            names = {"-o", "--output-format"},
            description = "Output format: console (default), json, dot",
            defaultValue = "console"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-f", "--output-file"},
            description = "Output file path (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file"
    )
    private Path configFile;

    @Option(
            names = {"--mappings"},
            description = "Include call-site parameter mappings in console output"
    )
    private boolean showMappings;

    @Option(
            names = {"--returns"},
            description = "Include return value analysis in console output"
    )
    private boolean showReturns;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    public enum OutputFormat {
        console,
        json,
        dot
    }

    @Override
    public Integer call() {
        try {
            if (!Files.isRegularFile(graphFile)) {
                System.err.println("Error: Call graph file does not exist: " + graphFile);
                return 1;
            }

            AnalysisConfig config = loadConfig();

            log("Loading call graph from: " + graphFile);
            LoadedProgram program = new CallGraphLoader().load(graphFile);
            log("  " + program.graph().functionCount() + " functions, "
                    + program.graph().callCount() + " calls, "
                    + program.cfgs().size() + " CFGs");

            log("Analyzing...");
            AnalysisReport report = new CallGraphAnalyzer(config)
                    .analyze(program.graph(), program.cfgs(), graphFile.getFileName().toString());
            log("  Done in " + report.analysisDuration().toMillis() + " ms");

            writeReport(report, createReporter(config));
            return 0;

        } catch (MalformedCallGraphException e) {
            System.err.println("Error: Invalid call graph: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    private AnalysisConfig loadConfig() throws IOException {
        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new IOException("Config file does not exist: " + configFile);
            }
            log("Loading configuration from: " + configFile);
            return AnalysisConfig.load(configFile);
        }

        // Check for call-scan.yaml next to the graph
        Path sibling = graphFile.toAbsolutePath().resolveSibling("call-scan.yaml");
        if (Files.exists(sibling)) {
            log("Loading configuration from: " + sibling);
            return AnalysisConfig.load(sibling);
        }

        return AnalysisConfig.defaults();
    }

    private Reporter createReporter(AnalysisConfig config) {
        return switch (outputFormat) {
            case console -> new ConsoleReporter(!noColor && outputFile == null, showMappings, showReturns);
            case json -> new JsonReporter(true);
            case dot -> new DotReporter(config.getHubCallThreshold());
        };
    }

    private void writeReport(AnalysisReport report, Reporter reporter) throws IOException {
        if (outputFile != null) {
            reporter.write(report, outputFile);
            if (outputFormat == OutputFormat.console) {
                System.out.println("Report written to: " + outputFile);
            }
        } else {
            reporter.write(report, new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        }
    }

    private void log(String message) {
        if (verbose && outputFormat == OutputFormat.console) {
            System.out.println(message);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CallScanCli()).execute(args);
        System.exit(exitCode);
    }
}
