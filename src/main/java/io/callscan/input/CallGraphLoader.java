package io.callscan.input;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.callscan.model.BasicBlock;
import io.callscan.model.CallEdge;
import io.callscan.model.CallGraph;
import io.callscan.model.FunctionCfg;
import io.callscan.model.FunctionNode;
import io.callscan.model.MalformedCallGraphException;
import io.callscan.model.Parameter;
import io.callscan.model.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads a call graph document (functions with optional CFGs, plus call sites) from JSON.
 * <p>
 * Unknown properties are ignored. Calls to functions missing from the document
 * are kept; those callees are treated as external by the analysis.
 */
public class CallGraphLoader {

    private static final Logger log = LoggerFactory.getLogger(CallGraphLoader.class);

    private final ObjectMapper mapper;

    public CallGraphLoader() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * A loaded graph plus the CFGs of the functions that carried one.
     */
    public record LoadedProgram(CallGraph graph, Map<String, FunctionCfg> cfgs) {
        public LoadedProgram {
            cfgs = cfgs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(cfgs));
        }
    }

    /**
     * @throws IOException                 if the file cannot be read or is not valid JSON
     * @throws MalformedCallGraphException if the document is structurally invalid
     */
    public LoadedProgram load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            LoadedProgram program = load(in);
            log.debug("Loaded {}: {} functions, {} calls", path,
                    program.graph().functionCount(), program.graph().callCount());
            return program;
        }
    }

    public LoadedProgram load(InputStream in) throws IOException {
        return toProgram(mapper.readValue(in, GraphDocument.class));
    }

    public LoadedProgram parse(String json) throws JsonProcessingException {
        return toProgram(mapper.readValue(json, GraphDocument.class));
    }

    private LoadedProgram toProgram(GraphDocument document) {
        if (document == null) {
            return new LoadedProgram(CallGraph.empty(), Map.of());
        }

        CallGraph.Builder builder = CallGraph.builder();
        Map<String, FunctionCfg> cfgs = new LinkedHashMap<>();

        for (FunctionDocument function : orEmpty(document.functions())) {
            String name = requireName(function.name(), "function");
            builder.addFunction(toNode(name, function));
            if (function.cfg() != null) {
                cfgs.put(name, toCfg(name, function.cfg()));
            }
        }

        for (CallDocument call : orEmpty(document.calls())) {
            builder.addCall(new CallEdge(
                    requireName(call.caller(), "caller"),
                    requireName(call.callee(), "callee"),
                    orEmpty(call.arguments()),
                    call.line() == null ? -1 : call.line()
            ));
        }

        return new LoadedProgram(builder.build(), cfgs);
    }

    private static FunctionNode toNode(String name, FunctionDocument function) {
        List<Parameter> parameters = new ArrayList<>();
        for (ParameterDocument param : orEmpty(function.parameters())) {
            parameters.add(new Parameter(requireName(param.name(), "parameter of " + name), param.type()));
        }
        return FunctionNode.builder()
                .name(name)
                .parameters(parameters)
                .returnType(function.returnType())
                .declarationOnly(Boolean.TRUE.equals(function.declarationOnly()))
                .build();
    }

    private static FunctionCfg toCfg(String name, CfgDocument cfg) {
        List<BasicBlock> blocks = new ArrayList<>();
        for (BlockDocument block : orEmpty(cfg.blocks())) {
            List<Statement> statements = new ArrayList<>();
            for (StatementDocument stmt : orEmpty(block.statements())) {
                statements.add(new Statement(stmt.id(), stmt.text()));
            }
            blocks.add(new BasicBlock(requireName(block.id(), "block of " + name), block.successors(), statements));
        }
        FunctionCfg built = FunctionCfg.of(name, blocks);
        return cfg.entry() == null ? built : new FunctionCfg(name, cfg.entry(), built.blocks());
    }

    private static String requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new MalformedCallGraphException("Missing or blank " + what + " name");
        }
        return value.trim();
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    // JSON document shape

    public record GraphDocument(List<FunctionDocument> functions, List<CallDocument> calls) {}

    public record FunctionDocument(String name, String returnType, List<ParameterDocument> parameters,
                            Boolean declarationOnly, CfgDocument cfg) {}

    public record ParameterDocument(String name, String type) {}

    public record CfgDocument(String entry, List<BlockDocument> blocks) {}

    public record BlockDocument(String id, List<String> successors, List<StatementDocument> statements) {}

    public record StatementDocument(String id, String text) {}

    public record CallDocument(String caller, String callee, List<String> arguments, Integer line) {}
}
