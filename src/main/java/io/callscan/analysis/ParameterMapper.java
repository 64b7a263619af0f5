package io.callscan.analysis;

import io.callscan.model.ArgumentDerivation;
import io.callscan.model.CallEdge;
import io.callscan.model.CallGraph;
import io.callscan.model.FunctionNode;
import io.callscan.model.ParameterMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Maps the actual arguments of a call site onto the callee's formal parameters.
 * <p>
 * Matching is positional only: position {@code i} pairs the i-th formal with
 * the i-th actual, and surplus actuals or formals are ignored.
 */
public class ParameterMapper {

    private static final Logger log = LoggerFactory.getLogger(ParameterMapper.class);

    private final ArgumentDerivationClassifier classifier;

    public ParameterMapper() {
        this(new ArgumentDerivationClassifier());
    }

    public ParameterMapper(ArgumentDerivationClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Mappings of one call site, one per position where both a formal and an actual exist.
     */
    public List<ParameterMapping> mapParametersWithDerivation(CallEdge call, FunctionNode callee) {
        List<String> formals = callee.parameterNames();
        List<String> actuals = call.arguments();
        int count = Math.min(formals.size(), actuals.size());

        List<ParameterMapping> mappings = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String actual = actuals.get(i).trim();
            ArgumentDerivation derivation = classifier.analyzeArgumentDerivation(actual);
            mappings.add(new ParameterMapping(formals.get(i), actual, derivation, i));
            log.debug("{}: {} <- {} [{}]", call.pairKey(), formals.get(i), actual, derivation.describe());
        }
        return List.copyOf(mappings);
    }

    /**
     * Formal parameter name to raw argument text, without derivation detail.
     */
    public Map<String, String> mapParameters(CallEdge call, FunctionNode callee) {
        List<String> formals = callee.parameterNames();
        List<String> actuals = call.arguments();
        int count = Math.min(formals.size(), actuals.size());

        Map<String, String> mapping = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            mapping.put(formals.get(i), actuals.get(i).trim());
        }
        return mapping;
    }

    /**
     * Maps every call site whose callee has a node in the graph, in call order.
     */
    public List<CallSiteMapping> mapAllCallSites(CallGraph graph) {
        List<CallSiteMapping> result = new ArrayList<>();
        for (CallEdge call : graph.calls()) {
            Optional<FunctionNode> callee = graph.getFunction(call.callee());
            if (callee.isEmpty()) {
                continue;
            }
            result.add(new CallSiteMapping(call, mapParametersWithDerivation(call, callee.get())));
        }
        return List.copyOf(result);
    }

    public boolean isPointerArgument(ArgumentDerivation derivation) {
        return derivation.isPointer();
    }

    public boolean isCompositeArgument(ArgumentDerivation derivation) {
        return derivation.isComposite();
    }

    public boolean isCallArgument(ArgumentDerivation derivation) {
        return derivation.isCall();
    }

    /**
     * Parameter mappings of one call site.
     */
    public record CallSiteMapping(CallEdge call, List<ParameterMapping> mappings) {
        public CallSiteMapping {
            mappings = List.copyOf(mappings);
        }
    }
}
