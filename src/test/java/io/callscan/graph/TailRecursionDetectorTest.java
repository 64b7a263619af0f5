package io.callscan.graph;

import io.callscan.model.BasicBlock;
import io.callscan.model.CallGraph;
import io.callscan.model.FunctionCfg;
import io.callscan.model.Statement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TailRecursionDetectorTest {

    private final TailRecursionDetector detector = new TailRecursionDetector();

    private static CallGraph markedSelfRecursive(String... functions) {
        CallGraph.Builder builder = CallGraph.builder().addFunctions(functions);
        for (String function : functions) {
            builder.addCall(function, function);
        }
        CallGraph graph = builder.build();
        new RecursionAnalyzer().markRecursiveFunctions(graph);
        return graph;
    }

    private static FunctionCfg gcdCfg() {
        return FunctionCfg.of("gcd", List.of(
                new BasicBlock("B0", List.of("B1", "B2"), List.of(new Statement("s0", "if (b == 0)"))),
                new BasicBlock("B1", List.of(), List.of(new Statement("s1", "return a;"))),
                new BasicBlock("B2", List.of(), List.of(new Statement("s2", "return gcd(b, a % b);")))
        ));
    }

    @Test
    void detectTailRecursion_findsSelfCallInExitBlock() {
        CallGraph graph = markedSelfRecursive("gcd");

        List<String> result = detector.detectTailRecursion(graph, Map.of("gcd", gcdCfg()));

        assertThat(result).containsExactly("gcd");
    }

    @Test
    void detectTailRecursion_ignoresCallInsideExpression() {
        CallGraph graph = markedSelfRecursive("factorial");
        FunctionCfg cfg = FunctionCfg.singleBlock("factorial", "return n * factorial(n - 1);");

        assertThat(detector.detectTailRecursion(graph, Map.of("factorial", cfg))).isEmpty();
    }

    @Test
    void detectTailRecursion_skipsFunctionsNotMarkedRecursive() {
        CallGraph graph = CallGraph.builder()
                .addFunctions("gcd")
                .build();

        assertThat(detector.detectTailRecursion(graph, Map.of("gcd", gcdCfg()))).isEmpty();
    }

    @Test
    void detectTailRecursion_skipsFunctionsWithoutCfg() {
        CallGraph graph = markedSelfRecursive("gcd", "walk");

        assertThat(detector.detectTailRecursion(graph, Map.of("gcd", gcdCfg()))).containsExactly("gcd");
    }

    @Test
    void detectTailRecursion_onlyLooksAtExitBlocks() {
        CallGraph graph = markedSelfRecursive("loop");
        FunctionCfg cfg = FunctionCfg.of("loop", List.of(
                new BasicBlock("B0", List.of("B1"), List.of(Statement.of("return loop(x);"))),
                new BasicBlock("B1", List.of(), List.of(Statement.of("return 0;")))
        ));

        assertThat(detector.detectTailRecursion(graph, Map.of("loop", cfg))).isEmpty();
    }

    @Test
    void detectTailRecursion_onlyLooksAtLastStatement() {
        CallGraph graph = markedSelfRecursive("count");
        FunctionCfg cfg = FunctionCfg.singleBlock("count", "return count(n - 1);", "cleanup();");

        assertThat(detector.detectTailRecursion(graph, Map.of("count", cfg))).isEmpty();
    }

    @Test
    void detectTailRecursion_ignoresEmptyExitBlocks() {
        CallGraph graph = markedSelfRecursive("gcd");
        FunctionCfg cfg = FunctionCfg.of("gcd", List.of(
                new BasicBlock("B0", List.of(), List.of()),
                new BasicBlock("B1", List.of(), List.of(Statement.of("return gcd(b, a % b);")))
        ));

        assertThat(detector.detectTailRecursion(graph, Map.of("gcd", cfg))).containsExactly("gcd");
    }

    @Test
    void hasTailRecursiveExit_requiresExactFunctionName() {
        FunctionCfg similar = FunctionCfg.singleBlock("foo", "return fooBar(x);");
        FunctionCfg spaced = FunctionCfg.singleBlock("foo", "return foo (x);");

        assertThat(detector.hasTailRecursiveExit("foo", similar)).isFalse();
        assertThat(detector.hasTailRecursiveExit("foo", spaced)).isTrue();
    }

    @Test
    void hasTailRecursiveExit_treatsNameLiterally() {
        FunctionCfg cfg = FunctionCfg.singleBlock("Tree::walk", "return Tree::walk(node->left);");

        assertThat(detector.hasTailRecursiveExit("Tree::walk", cfg)).isTrue();
        assertThat(detector.hasTailRecursiveExit("Tree.walk", cfg)).isFalse();
    }
}
