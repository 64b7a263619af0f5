package io.callscan.graph;

import io.callscan.model.BasicBlock;
import io.callscan.model.CallGraph;
import io.callscan.model.FunctionCfg;
import io.callscan.model.FunctionNode;
import io.callscan.model.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds recursive functions that return the result of calling themselves as the
 * last action of some exit path.
 * <p>
 * The check is textual: the last statement of an exit block must match
 * {@code return <name>(}. It misses tail calls written differently (e.g. through a
 * temporary) and can be fooled by the same text inside a comment or string.
 */
public class TailRecursionDetector {

    private static final Logger log = LoggerFactory.getLogger(TailRecursionDetector.class);

    /**
     * Returns the recursive functions with at least one tail-recursive exit, in graph order.
     * Only functions already flagged recursive are considered; functions without a CFG are skipped.
     */
    public List<String> detectTailRecursion(CallGraph graph, Map<String, FunctionCfg> cfgs) {
        List<String> tailRecursive = new ArrayList<>();

        for (FunctionNode function : graph.functions().values()) {
            if (!function.isRecursive()) {
                continue;
            }
            FunctionCfg cfg = cfgs.get(function.name());
            if (cfg == null) {
                continue;
            }
            if (hasTailRecursiveExit(function.name(), cfg)) {
                tailRecursive.add(function.name());
                log.debug("Tail recursion detected: {}", function.name());
            }
        }

        return List.copyOf(tailRecursive);
    }

    /**
     * Checks the last statement of each non-empty exit block; the first match is enough.
     */
    public boolean hasTailRecursiveExit(String functionId, FunctionCfg cfg) {
        Pattern tailCall = tailCallPattern(functionId);
        for (BasicBlock exit : cfg.exitBlocks()) {
            Optional<Statement> last = exit.lastStatement();
            if (last.isPresent() && tailCall.matcher(last.get().text()).find()) {
                return true;
            }
        }
        return false;
    }

    static Pattern tailCallPattern(String functionId) {
        return Pattern.compile("return\\s+" + Pattern.quote(functionId) + "\\s*\\(");
    }
}
