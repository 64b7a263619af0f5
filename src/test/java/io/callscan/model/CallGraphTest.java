package io.callscan.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallGraphTest {

    @Test
    void build_indexesCallsBothWays() {
        CallGraph graph = CallGraph.builder()
                .addFunctions("main", "parse", "emit")
                .addCall("main", "parse", "argv")
                .addCall("main", "emit")
                .addCall("parse", "emit", "tok")
                .build();

        assertThat(graph.callsFrom("main")).extracting(CallEdge::callee).containsExactly("parse", "emit");
        assertThat(graph.callsTo("emit")).extracting(CallEdge::caller).containsExactly("main", "parse");
        assertThat(graph.callsFrom("emit")).isEmpty();
        assertThat(graph.callCount()).isEqualTo(3);
    }

    @Test
    void build_indexesAgreeWithFlatCallList() {
        CallGraph graph = CallGraph.builder()
                .addFunctions("a", "b")
                .addCall("a", "b")
                .addCall("a", "b")
                .addCall("b", "a")
                .build();

        int fromIndex = graph.callsFromIndex().values().stream().mapToInt(List::size).sum();
        int toIndex = graph.callsToIndex().values().stream().mapToInt(List::size).sum();

        assertThat(fromIndex).isEqualTo(graph.calls().size());
        assertThat(toIndex).isEqualTo(graph.calls().size());
        for (CallEdge call : graph.calls()) {
            assertThat(graph.callsFrom(call.caller())).contains(call);
            assertThat(graph.callsTo(call.callee())).contains(call);
        }
    }

    @Test
    void build_rejectsCallFromUnknownFunction() {
        CallGraph.Builder builder = CallGraph.builder()
                .addFunctions("main")
                .addCall("ghost", "main");

        assertThatThrownBy(builder::build)
                .isInstanceOf(MalformedCallGraphException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void build_lenientAcceptsCallFromUnknownFunction() {
        CallGraph graph = CallGraph.builder()
                .addFunctions("main")
                .addCall("ghost", "main")
                .lenient()
                .build();

        assertThat(graph.callsTo("main")).hasSize(1);
    }

    @Test
    void callersAndCallees_areDistinctInFirstSeenOrder() {
        CallGraph graph = CallGraph.builder()
                .addFunctions("a", "b", "c")
                .addCall("a", "c")
                .addCall("a", "b")
                .addCall("a", "c")
                .addCall("b", "c")
                .build();

        assertThat(graph.callees("a")).containsExactly("c", "b");
        assertThat(graph.callers("c")).containsExactly("a", "b");
    }

    @Test
    void isDefined_falseForMissingAndDeclarationOnlyNodes() {
        CallGraph graph = CallGraph.builder()
                .addFunction(FunctionNode.of("main"))
                .addFunction(FunctionNode.builder().name("strlen").declarationOnly(true).build())
                .build();

        assertThat(graph.isDefined("main")).isTrue();
        assertThat(graph.isDefined("strlen")).isFalse();
        assertThat(graph.isDefined("printf")).isFalse();
        assertThat(graph.hasFunction("strlen")).isTrue();
    }

    @Test
    void hasSelfLoop_detectsDirectSelfCall() {
        CallGraph graph = CallGraph.builder()
                .addFunctions("fact", "main")
                .addCall("fact", "fact", "n - 1")
                .addCall("main", "fact", "5")
                .build();

        assertThat(graph.hasSelfLoop("fact")).isTrue();
        assertThat(graph.hasSelfLoop("main")).isFalse();
    }

    @Test
    void flags_canOnlyBeRaised() {
        FunctionNode node = FunctionNode.of("f", "x");

        assertThat(node.isRecursive()).isFalse();
        node.markRecursive();
        node.markRecursive();

        assertThat(node.isRecursive()).isTrue();
        assertThat(node.isExternal()).isFalse();
        assertThat(node.parameterNames()).containsExactly("x");
    }

    @Test
    void empty_hasNoFunctionsOrCalls() {
        CallGraph graph = CallGraph.empty();

        assertThat(graph.isEmpty()).isTrue();
        assertThat(graph.callsFrom("anything")).isEmpty();
        assertThat(graph.getFunction("anything")).isEmpty();
    }
}
