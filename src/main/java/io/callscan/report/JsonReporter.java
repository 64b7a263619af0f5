package io.callscan.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.callscan.analysis.AnalysisReport;
import io.callscan.analysis.ParameterMapper.CallSiteMapping;
import io.callscan.model.ArgumentDerivation;
import io.callscan.model.CallEdge;
import io.callscan.model.CallGraphStatistics;
import io.callscan.model.ExternalFunctionInfo;
import io.callscan.model.FunctionNode;
import io.callscan.model.FunctionSummary;
import io.callscan.model.ParameterMapping;
import io.callscan.model.RecursionDepthInfo;
import io.callscan.model.ReturnValueInfo;

import java.io.IOException;
import java.io.Writer;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Formats analysis results as JSON for machine processing.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(AnalysisReport report, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(report));
    }

    JsonReport toJsonReport(AnalysisReport report) {
        return new JsonReport(
                new JsonReport.Metadata(
                        report.source(),
                        report.analysisStartTime(),
                        report.analysisDuration() != null ? report.analysisDuration().toMillis() : 0L
                ),
                toJsonStatistics(report.statistics()),
                report.graph().functions().values().stream()
                        .map(f -> toJsonFunction(f, report))
                        .toList(),
                report.graph().calls().stream()
                        .map(this::toJsonCall)
                        .toList(),
                report.externalFunctions().values().stream()
                        .map(this::toJsonExternal)
                        .toList(),
                report.tailRecursive(),
                report.callSiteMappings().stream()
                        .map(this::toJsonCallSite)
                        .toList(),
                toJsonReturns(report.returnValues())
        );
    }

    private JsonReport.Statistics toJsonStatistics(CallGraphStatistics stats) {
        return new JsonReport.Statistics(
                stats.totalFunctions(),
                stats.totalCalls(),
                stats.externalFunctions(),
                stats.recursiveFunctions(),
                stats.averageCallsPerFunction(),
                stats.maxCallsPerFunction(),
                stats.mostCalledFunction() != null ? stats.mostCalledFunction().name() : null,
                stats.mostCalledFunction() != null ? stats.mostCalledFunction().count() : null,
                stats.deepestCallChain(),
                stats.averageRecursionDepth()
        );
    }

    private JsonReport.Function toJsonFunction(FunctionNode function, AnalysisReport report) {
        RecursionDepthInfo info = report.recursion().get(function.name());
        return new JsonReport.Function(
                function.name(),
                function.returnType(),
                function.parameterNames(),
                function.isExternal(),
                function.isRecursive(),
                report.isTailRecursive(function.name()),
                info != null ? info.directRecursionDepth() : 0,
                info != null ? info.indirectRecursionDepth() : 0,
                info == null || info.recursiveCallees().isEmpty() ? null : info.recursiveCallees(),
                info == null || info.cycleFunctions().isEmpty() ? null : info.cycleFunctions()
        );
    }

    private JsonReport.Call toJsonCall(CallEdge call) {
        return new JsonReport.Call(
                call.caller(),
                call.callee(),
                call.arguments(),
                call.line() > 0 ? call.line() : null
        );
    }

    private JsonReport.External toJsonExternal(ExternalFunctionInfo info) {
        return new JsonReport.External(
                info.name(),
                info.category().label(),
                info.description(),
                info.safe(),
                info.isVariadic() ? null : info.parameterCount(),
                info.returnType(),
                info.hasSummary() ? toJsonSummary(info.summary()) : null
        );
    }

    private JsonReport.Summary toJsonSummary(FunctionSummary summary) {
        return new JsonReport.Summary(
                summary.category().isEmpty() ? null : summary.category(),
                summary.parameters().stream()
                        .map(p -> new JsonReport.SummaryParameter(p.index(), p.name(), p.mode().label(), p.taintPropagation()))
                        .toList(),
                new JsonReport.SummaryReturn(
                        summary.returnValue().type(),
                        summary.returnValue().tainted(),
                        summary.returnValue().depends().isEmpty() ? null : summary.returnValue().depends()
                ),
                summary.globalEffects().isEmpty() ? null : summary.globalEffects().stream()
                        .map(e -> new JsonReport.SummaryEffect(e.variable(), e.modified(), e.tainted()))
                        .toList()
        );
    }

    private JsonReport.CallSite toJsonCallSite(CallSiteMapping site) {
        return new JsonReport.CallSite(
                site.call().caller(),
                site.call().callee(),
                site.mappings().stream().map(this::toJsonMapping).toList()
        );
    }

    private JsonReport.Mapping toJsonMapping(ParameterMapping mapping) {
        ArgumentDerivation derivation = mapping.derivation();
        return new JsonReport.Mapping(
                mapping.position(),
                mapping.formalParam(),
                mapping.actualArg(),
                derivation.type().label(),
                derivation.base(),
                derivation.transformations(),
                derivation.usedVariables()
        );
    }

    private Map<String, List<JsonReport.ReturnValue>> toJsonReturns(Map<String, List<ReturnValueInfo>> returns) {
        Map<String, List<JsonReport.ReturnValue>> result = new LinkedHashMap<>();
        returns.forEach((function, values) -> result.put(function, values.stream()
                .map(r -> new JsonReport.ReturnValue(
                        r.value(),
                        r.blockId(),
                        r.statementId(),
                        r.type().name().toLowerCase(Locale.ROOT),
                        r.usedVariables(),
                        r.inferredType()))
                .toList()));
        return result;
    }

    /**
     * JSON structure for the report.
     */
    public record JsonReport(
            Metadata metadata,
            Statistics statistics,
            List<Function> functions,
            List<Call> calls,
            List<External> externalFunctions,
            List<String> tailRecursive,
            List<CallSite> callSites,
            Map<String, List<ReturnValue>> returnValues
    ) {
        public record Metadata(
                String source,
                Instant analysisDate,
                long analysisDurationMs
        ) {}

        public record Statistics(
                int totalFunctions,
                int totalCalls,
                int externalFunctions,
                int recursiveFunctions,
                double averageCallsPerFunction,
                int maxCallsPerFunction,
                String mostCalledFunction,
                Integer mostCalledCount,
                int deepestCallChain,
                double averageRecursionDepth
        ) {}

        public record Function(
                String name,
                String returnType,
                List<String> parameters,
                boolean external,
                boolean recursive,
                boolean tailRecursive,
                int directRecursionDepth,
                int indirectRecursionDepth,
                List<String> recursiveCallees,
                List<String> cycle
        ) {}

        public record Call(
                String caller,
                String callee,
                List<String> arguments,
                Integer line
        ) {}

        public record External(
                String name,
                String category,
                String description,
                boolean safe,
                Integer parameters,
                String returnType,
                Summary summary
        ) {}

        public record Summary(
                String category,
                List<SummaryParameter> parameters,
                SummaryReturn returns,
                List<SummaryEffect> globalEffects
        ) {}

        public record SummaryParameter(int index, String name, String mode, boolean taints) {}

        public record SummaryReturn(String type, boolean tainted, List<Integer> depends) {}

        public record SummaryEffect(String variable, boolean modified, boolean tainted) {}

        public record CallSite(
                String caller,
                String callee,
                List<Mapping> mappings
        ) {}

        public record Mapping(
                int position,
                String formal,
                String actual,
                String derivation,
                String base,
                List<String> transformations,
                List<String> usedVariables
        ) {}

        public record ReturnValue(
                String value,
                String blockId,
                String statementId,
                String type,
                List<String> usedVariables,
                String inferredType
        ) {}
    }
}
