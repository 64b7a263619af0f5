package io.callscan.config;

import io.callscan.model.ExternalFunctionCategory;
import io.callscan.model.ExternalFunctionInfo;
import io.callscan.model.FunctionSummary;
import io.callscan.model.FunctionSummary.GlobalEffect;
import io.callscan.model.FunctionSummary.ParameterSummary;
import io.callscan.model.FunctionSummary.ReturnSummary;
import io.callscan.model.ParameterMode;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ExternalFunctionCatalogTest {

    private final ExternalFunctionCatalog catalog = ExternalFunctionCatalog.defaultCatalog();

    @Test
    void defaultCatalog_containsCoreLibraryFunctions() {
        for (String name : List.of("printf", "scanf", "malloc", "free", "strcpy", "memcpy",
                "open", "read", "write", "close", "system", "exit")) {
            assertThat(catalog.contains(name)).as(name).isTrue();
        }
    }

    @Test
    void lookup_returnsCuratedEntry() {
        ExternalFunctionInfo printf = catalog.lookup("printf").orElseThrow();

        assertThat(printf.category()).isEqualTo(ExternalFunctionCategory.STDLIB);
        assertThat(printf.safe()).isTrue();

        ExternalFunctionInfo system = catalog.lookup("system").orElseThrow();
        assertThat(system.category()).isEqualTo(ExternalFunctionCategory.SYSTEM);
        assertThat(system.safe()).isFalse();

        assertThat(catalog.lookup("open").orElseThrow().category()).isEqualTo(ExternalFunctionCategory.POSIX);
    }

    @Test
    void categorizeUnknown_usesNamingPatterns() {
        assertThat(ExternalFunctionCatalog.categorizeUnknown("std::sort")).isEqualTo(ExternalFunctionCategory.CPP_STDLIB);
        assertThat(ExternalFunctionCatalog.categorizeUnknown("pthread_mutex_lock")).isEqualTo(ExternalFunctionCategory.POSIX);
        assertThat(ExternalFunctionCatalog.categorizeUnknown("sem_wait")).isEqualTo(ExternalFunctionCategory.POSIX);
        assertThat(ExternalFunctionCatalog.categorizeUnknown("device_read")).isEqualTo(ExternalFunctionCategory.POSIX);
        assertThat(ExternalFunctionCatalog.categorizeUnknown("spawn_worker")).isEqualTo(ExternalFunctionCategory.SYSTEM);
        assertThat(ExternalFunctionCatalog.categorizeUnknown("my_helper")).isEqualTo(ExternalFunctionCategory.UNKNOWN);
    }

    @Test
    void categorizeUnknown_posixPrefixWinsOverSystemPrefix() {
        // fork and exec appear in both pattern lists
        assertThat(ExternalFunctionCatalog.categorizeUnknown("fork_child")).isEqualTo(ExternalFunctionCategory.POSIX);
        assertThat(ExternalFunctionCatalog.categorizeUnknown("execvp_wrapper")).isEqualTo(ExternalFunctionCategory.POSIX);
    }

    @Test
    void describe_unknownNameIsConservativelyUnsafe() {
        ExternalFunctionInfo info = catalog.describe("mystery_call");

        assertThat(info.name()).isEqualTo("mystery_call");
        assertThat(info.category()).isEqualTo(ExternalFunctionCategory.UNKNOWN);
        assertThat(info.safe()).isFalse();
        assertThat(info.description()).isEqualTo("Unknown external function");
        assertThat(info.isVariadic()).isTrue();
    }

    @Test
    void describe_isAPureFunctionOfTheName() {
        assertThat(catalog.describe("std::vector::push_back"))
                .isEqualTo(catalog.describe("std::vector::push_back"));
        assertThat(catalog.describe("malloc")).isEqualTo(catalog.describe("malloc"));
    }

    @Test
    void load_readsYamlEntries() {
        String yaml = """
                externalFunctions:
                  - name: my_alloc
                    category: stdlib
                    description: Project allocator
                    safe: false
                    parameters: 1
                    returnType: void*
                  - {name: log_line, category: posix, safe: true}
                """;

        ExternalFunctionCatalog loaded = ExternalFunctionCatalog.load(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertThat(loaded.size()).isEqualTo(2);
        ExternalFunctionInfo alloc = loaded.lookup("my_alloc").orElseThrow();
        assertThat(alloc.parameterCount()).isEqualTo(1);
        assertThat(alloc.returnType()).isEqualTo("void*");
        assertThat(loaded.lookup("log_line").orElseThrow().isVariadic()).isTrue();
    }

    @Test
    void load_rejectsUnknownCategory() {
        String yaml = """
                externalFunctions:
                  - name: thing
                    category: kernel
                """;

        assertThatThrownBy(() -> ExternalFunctionCatalog.load(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kernel");
    }

    @Test
    void merge_otherCatalogTakesPrecedence() {
        ExternalFunctionCatalog override = ExternalFunctionCatalog.of(List.of(
                new ExternalFunctionInfo("printf", ExternalFunctionCategory.STDLIB, "Audited printf", false, -1, "int")));

        ExternalFunctionCatalog merged = catalog.merge(override);

        assertThat(merged.lookup("printf").orElseThrow().safe()).isFalse();
        assertThat(merged.size()).isEqualTo(catalog.size());
        assertThat(catalog.lookup("printf").orElseThrow().safe()).isTrue();
    }

    @Test
    void byCategory_filtersEntries() {
        assertThat(catalog.byCategory(ExternalFunctionCategory.SYSTEM))
                .extracting(ExternalFunctionInfo::name)
                .contains("system")
                .doesNotContain("printf");
    }

    @Test
    void summary_recordsParameterModesAndReturnDependencies() {
        FunctionSummary strcpy = catalog.summary("strcpy").orElseThrow();

        assertThat(strcpy.category()).isEqualTo("string");
        assertThat(strcpy.parameters())
                .extracting(ParameterSummary::name, ParameterSummary::mode)
                .containsExactly(tuple("dest", ParameterMode.OUT), tuple("src", ParameterMode.IN));
        assertThat(strcpy.writtenParameters()).containsExactly(0);
        assertThat(strcpy.taintingParameters()).containsExactly(1);
        assertThat(strcpy.returnValue().type()).isEqualTo("char*");
        assertThat(strcpy.returnValue().tainted()).isTrue();
        assertThat(strcpy.returnValue().depends()).containsExactly(1);
        assertThat(strcpy.hasSideEffects()).isTrue();
    }

    @Test
    void summary_distinguishesInoutFromOut() {
        assertThat(catalog.summary("strcat").orElseThrow().parameter(0).orElseThrow().mode())
                .isEqualTo(ParameterMode.INOUT);
        assertThat(catalog.summary("memcpy").orElseThrow().parameter(0).orElseThrow().mode())
                .isEqualTo(ParameterMode.OUT);
    }

    @Test
    void summary_voidReturnAndGlobalEffects() {
        FunctionSummary free = catalog.summary("free").orElseThrow();
        assertThat(free.returnValue()).isEqualTo(ReturnSummary.VOID);
        assertThat(free.hasSideEffects()).isFalse();

        FunctionSummary fopen = catalog.summary("fopen").orElseThrow();
        assertThat(fopen.globalEffects())
                .extracting(GlobalEffect::variable)
                .containsExactly("errno");
        assertThat(fopen.hasSideEffects()).isTrue();
        assertThat(fopen.returnValue().depends()).containsExactly(0);
    }

    @Test
    void summary_emptyForUnsummarizedFunctions() {
        assertThat(catalog.summary("strlen")).isEmpty();
        assertThat(catalog.hasSummary("mystery_call")).isFalse();
        assertThat(catalog.describe("strcpy").hasSummary()).isTrue();
    }

    @Test
    void summariesByCategory_groupsByFunctionalArea() {
        assertThat(catalog.summariesByCategory("memory"))
                .extracting(FunctionSummary::name)
                .containsExactly("malloc", "free", "memcpy");
        assertThat(catalog.summariesByCategory("io"))
                .extracting(FunctionSummary::name)
                .contains("printf", "scanf", "fopen", "fread");
        assertThat(catalog.summarizedFunctions()).contains("sprintf", "strcat");
    }

    @Test
    void withSummary_attachesToExistingOrNewEntry() {
        FunctionSummary custom = new FunctionSummary("my_read", "io", "Project reader",
                List.of(new ParameterSummary(0, "buf", ParameterMode.OUT, false, "")),
                new ReturnSummary("int", false, List.of(), ""),
                List.of());

        ExternalFunctionCatalog extended = catalog.withSummary(custom);

        assertThat(extended.summary("my_read")).contains(custom);
        assertThat(extended.lookup("my_read").orElseThrow().category()).isEqualTo(ExternalFunctionCategory.POSIX);
        assertThat(catalog.hasSummary("my_read")).isFalse();

        FunctionSummary audited = new FunctionSummary("strlen", "string", "", List.of(), null, List.of());
        ExternalFunctionInfo strlen = catalog.withSummary(audited).lookup("strlen").orElseThrow();
        assertThat(strlen.safe()).isTrue();
        assertThat(strlen.summary().returnValue()).isEqualTo(ReturnSummary.VOID);
    }

    @Test
    void load_readsSummaryBlock() {
        String yaml = """
                externalFunctions:
                  - name: copy_to
                    category: stdlib
                    returnType: size_t
                    summary:
                      category: memory
                      parameters:
                        - {name: dst, mode: out}
                        - {name: src, mode: in, taints: true}
                        - {name: len}
                      returns: {tainted: true, depends: [1]}
                      globalEffects:
                        - {variable: copy_count, modified: true}
                """;

        FunctionSummary summary = ExternalFunctionCatalog.load(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))).summary("copy_to").orElseThrow();

        assertThat(summary.parameters()).extracting(ParameterSummary::index).containsExactly(0, 1, 2);
        assertThat(summary.parameter(2).orElseThrow().mode()).isEqualTo(ParameterMode.IN);
        assertThat(summary.returnValue().type()).isEqualTo("size_t");
        assertThat(summary.returnValue().depends()).containsExactly(1);
        assertThat(summary.globalEffects())
                .extracting(GlobalEffect::variable, GlobalEffect::modified)
                .containsExactly(tuple("copy_count", true));
    }

    @Test
    void load_rejectsUnknownParameterMode() {
        String yaml = """
                externalFunctions:
                  - name: thing
                    summary:
                      parameters:
                        - {name: p, mode: sideways}
                """;

        assertThatThrownBy(() -> ExternalFunctionCatalog.load(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sideways");
    }

    @Test
    void load_rejectsReturnDependencyOnMissingParameter() {
        String yaml = """
                externalFunctions:
                  - name: thing
                    summary:
                      parameters:
                        - {name: p}
                      returns: {depends: [3]}
                """;

        assertThatThrownBy(() -> ExternalFunctionCatalog.load(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("thing");
    }
}
