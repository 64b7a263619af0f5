package io.callscan.graph;

import io.callscan.config.ExternalFunctionCatalog;
import io.callscan.model.CallEdge;
import io.callscan.model.CallGraph;
import io.callscan.model.ExternalFunctionInfo;
import io.callscan.model.FunctionNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identifies the callees that are not defined inside the analyzed program.
 */
public class ExternalFunctionClassifier {

    private static final Logger log = LoggerFactory.getLogger(ExternalFunctionClassifier.class);

    private final ExternalFunctionCatalog catalog;

    public ExternalFunctionClassifier() {
        this(ExternalFunctionCatalog.defaultCatalog());
    }

    public ExternalFunctionClassifier(ExternalFunctionCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Maps every undefined callee to its catalog entry (or a generic unsafe record)
     * and flags its node external when the graph has one.
     * <p>
     * A callee is undefined when the graph has no node for it or its node is a
     * declaration without a body. Entries appear in order of first call.
     *
     * @return external callee name to function info
     */
    public Map<String, ExternalFunctionInfo> identifyExternalFunctions(CallGraph graph) {
        Map<String, ExternalFunctionInfo> externals = new LinkedHashMap<>();

        for (CallEdge call : graph.calls()) {
            String callee = call.callee();
            if (graph.isDefined(callee) || externals.containsKey(callee)) {
                continue;
            }

            ExternalFunctionInfo info = catalog.describe(callee);
            externals.put(callee, info);
            graph.getFunction(callee).ifPresent(FunctionNode::markExternal);

            log.debug("External function {} ({}, safe={})", callee, info.category().label(), info.safe());
        }

        return Collections.unmodifiableMap(externals);
    }

    public ExternalFunctionCatalog getCatalog() {
        return catalog;
    }
}
