package io.callscan.analysis;

import io.callscan.config.AnalysisConfig;
import io.callscan.input.CallGraphLoader;
import io.callscan.input.CallGraphLoader.LoadedProgram;
import io.callscan.model.ArgumentDerivation;
import io.callscan.model.CallGraph;
import io.callscan.model.CallGraphStatistics;
import io.callscan.model.ReturnValueInfo;
import io.callscan.model.ReturnValueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CallGraphAnalyzerTest {

    private LoadedProgram program;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/graphs/recursion.json")) {
            program = new CallGraphLoader().load(in);
        }
    }

    private AnalysisReport analyze() {
        return new CallGraphAnalyzer().analyze(program.graph(), program.cfgs(), "recursion.json");
    }

    @Test
    void analyze_identifiesExternalFunctions() {
        AnalysisReport report = analyze();

        assertThat(report.externalFunctions()).containsOnlyKeys("atoi", "printf");
        assertThat(report.graph().getFunction("atoi").orElseThrow().isExternal()).isTrue();
        assertThat(report.statistics().externalFunctions()).isEqualTo(1);
    }

    @Test
    void analyze_marksRecursionAndTailCalls() {
        AnalysisReport report = analyze();

        assertThat(report.recursiveFunctions())
                .extracting(info -> info.functionId())
                .containsExactly("fact", "gcd", "isEven", "isOdd");
        assertThat(report.tailRecursive()).containsExactly("gcd");
        assertThat(report.recursion().get("isEven").cycleFunctions()).containsExactly("isEven", "isOdd");
        assertThat(report.recursion().get("main").recursiveCallees()).containsExactly("fact", "gcd", "isEven");
    }

    @Test
    void analyze_computesStatisticsAfterMarking() {
        CallGraphStatistics stats = analyze().statistics();

        assertThat(stats.totalFunctions()).isEqualTo(6);
        assertThat(stats.totalCalls()).isEqualTo(9);
        assertThat(stats.recursiveFunctions()).isEqualTo(4);
        assertThat(stats.averageCallsPerFunction()).isEqualTo(1.5);
        assertThat(stats.maxCallsPerFunction()).isEqualTo(5);
        assertThat(stats.mostCalledFunction().name()).isEqualTo("fact");
        assertThat(stats.deepestCallChain()).isEqualTo(3);
        assertThat(stats.averageRecursionDepth()).isEqualTo(1.5);
    }

    @Test
    void analyze_mapsCallSitesWithNodes() {
        AnalysisReport report = analyze();

        assertThat(report.callSiteMappings()).hasSize(8);
        ArgumentDerivation atoiArg = report.callSiteMappings().get(0).mappings().get(0).derivation();
        assertThat(atoiArg).isInstanceOf(ArgumentDerivation.ArrayAccess.class);
        assertThat(atoiArg.base()).isEqualTo("argv");
    }

    @Test
    void analyze_collectsReturnValuesOfFunctionsWithCfg() {
        AnalysisReport report = analyze();

        assertThat(report.returnValues()).containsOnlyKeys("main", "fact", "gcd");
        List<ReturnValueInfo> fact = report.returnValues().get("fact");
        assertThat(fact).extracting(ReturnValueInfo::type)
                .containsExactly(ReturnValueType.CONSTANT, ReturnValueType.CALL);
    }

    @Test
    void analyze_isRepeatable() {
        AnalysisReport first = analyze();
        AnalysisReport second = analyze();

        assertThat(second.statistics()).isEqualTo(first.statistics());
        assertThat(second.tailRecursive()).isEqualTo(first.tailRecursive());
        assertThat(second.externalFunctions()).isEqualTo(first.externalFunctions());
    }

    @Test
    void analyze_withoutCfgsSkipsTailAndReturnAnalysis() {
        CallGraph graph = CallGraph.builder()
                .addFunctions("gcd")
                .addCall("gcd", "gcd", "b", "a % b")
                .build();

        AnalysisReport report = new CallGraphAnalyzer(AnalysisConfig.defaults()).analyze(graph);

        assertThat(report.tailRecursive()).isEmpty();
        assertThat(report.returnValues()).isEmpty();
        assertThat(report.statistics().recursiveFunctions()).isEqualTo(1);
        assertThat(report.source()).isNull();
    }

    @Test
    void analyze_emptyGraph() {
        AnalysisReport report = new CallGraphAnalyzer().analyze(CallGraph.empty());

        assertThat(report.statistics()).isEqualTo(CallGraphStatistics.empty());
        assertThat(report.externalFunctions()).isEmpty();
        assertThat(report.callSiteMappings()).isEmpty();
    }

    @Test
    void analyze_longAcyclicChainCompletes() {
        int length = 10_000;
        CallGraph.Builder builder = CallGraph.builder();
        for (int i = 0; i < length; i++) {
            builder.addFunctions("f" + i);
        }
        for (int i = 0; i + 1 < length; i++) {
            builder.addCall("f" + i, "f" + (i + 1));
        }
        CallGraphAnalyzer analyzer = new CallGraphAnalyzer(AnalysisConfig.defaults().withMaxIndirectDepth(10));

        AnalysisReport report = analyzer.analyze(builder.build());

        assertThat(report.statistics().deepestCallChain()).isEqualTo(length - 1);
        assertThat(report.statistics().recursiveFunctions()).isZero();
        assertThat(report.recursiveFunctions()).isEmpty();
    }
}
