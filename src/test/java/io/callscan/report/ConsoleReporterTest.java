package io.callscan.report;

import io.callscan.analysis.AnalysisReport;
import io.callscan.analysis.CallGraphAnalyzer;
import io.callscan.input.CallGraphLoader;
import io.callscan.input.CallGraphLoader.LoadedProgram;
import io.callscan.model.CallGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReporterTest {

    private AnalysisReport report;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/graphs/recursion.json")) {
            LoadedProgram program = new CallGraphLoader().load(in);
            report = new CallGraphAnalyzer().analyze(program.graph(), program.cfgs(), "recursion.json");
        }
    }

    @Test
    void write_printsSummaryExternalsAndRecursion() {
        String output = new ConsoleReporter(false).toString(report);

        assertThat(output).contains("CALL-SCAN REPORT");
        assertThat(output).contains("Source: recursion.json");
        assertThat(output).contains("Functions: 6 | Calls: 9 | External: 1 | Recursive: 4");
        assertThat(output).contains("Most called: fact (2 calls)");
        assertThat(output).contains("Deepest call chain: 3");
        assertThat(output).contains("EXTERNAL FUNCTIONS (2)");
        assertThat(output).contains("gcd: tail-recursive, cycle size 1");
        assertThat(output).contains("fact: recursive, cycle size 1");
        assertThat(output).contains("cycle: isEven -> isOdd");
    }

    @Test
    void write_omitsOptionalSectionsByDefault() {
        String output = new ConsoleReporter(false).toString(report);

        assertThat(output).doesNotContain("PARAMETER MAPPINGS");
        assertThat(output).doesNotContain("RETURN VALUES");
        assertThat(output).contains("Run with --mappings");
    }

    @Test
    void write_includesMappingsAndReturnsWhenRequested() {
        String output = new ConsoleReporter(false, true, true).toString(report);

        assertThat(output).contains("PARAMETER MAPPINGS");
        assertThat(output).contains("main -> gcd (line 5)");
        assertThat(output).contains("b <- a % b  [expression (base: a)]");
        assertThat(output).contains("RETURN VALUES");
        assertThat(output).contains("gcd(b, a % b)  [call, auto, block B2]");
    }

    @Test
    void write_withoutColorsHasNoEscapeCodes() {
        assertThat(new ConsoleReporter(false).toString(report)).doesNotContain("\u001B[");
        assertThat(new ConsoleReporter(true).toString(report)).contains("\u001B[");
    }

    @Test
    void write_listsParametersWrittenByLibraryCalls() {
        CallGraph graph = CallGraph.builder()
                .addFunctions("main")
                .addCall("main", "strcat", "buf", "name")
                .addCall("main", "puts", "buf")
                .build();

        String output = new ConsoleReporter(false).toString(new CallGraphAnalyzer().analyze(graph));

        assertThat(output).contains("writes: dest (inout)");
        assertThat(output).containsOnlyOnce("writes:");
    }
}
