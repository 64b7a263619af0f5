package io.callscan.analysis;

import io.callscan.model.BasicBlock;
import io.callscan.model.FunctionCfg;
import io.callscan.model.ReturnValueInfo;
import io.callscan.model.ReturnValueType;
import io.callscan.model.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts and classifies the values a function returns, from the statement text of its CFG.
 */
public class ReturnValueAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ReturnValueAnalyzer.class);

    private static final Pattern RETURN_KEYWORD = Pattern.compile("\\breturn\\b");
    private static final Pattern RETURN_VALUE = Pattern.compile("return\\s+(.+?);?$");
    private static final Pattern CALL = Pattern.compile("([a-zA-Z_][a-zA-Z0-9_]*)\\s*\\(([^)]*)\\)");
    private static final Pattern OPERATOR = Pattern.compile("[+\\-*/%<>=!&|]");
    private static final Pattern INTEGER = Pattern.compile("^\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^\\d+\\.\\d+$");
    private static final Pattern DECIMAL_PREFIX = Pattern.compile("^\\d+\\.\\d+");
    private static final Pattern IDENTIFIER = Pattern.compile("^\\s*([a-zA-Z_][a-zA-Z0-9_]*)\\s*$");

    private static final Set<String> LITERAL_KEYWORDS = Set.of("true", "false", "nullptr", "NULL");

    /**
     * Returns one entry per return statement, in block then statement order.
     */
    public List<ReturnValueInfo> analyzeReturns(FunctionCfg cfg) {
        List<ReturnValueInfo> returns = new ArrayList<>();

        for (BasicBlock block : cfg.blocks().values()) {
            for (Statement stmt : block.statements()) {
                if (!RETURN_KEYWORD.matcher(stmt.text()).find()) {
                    continue;
                }
                ReturnValueInfo info = extractReturnValue(stmt, block.id());
                returns.add(info);
                log.debug("Return in {}: '{}' ({}) from block {}", cfg.name(), info.value(), info.type(), block.id());
            }
        }

        return List.copyOf(returns);
    }

    private ReturnValueInfo extractReturnValue(Statement stmt, String blockId) {
        Matcher returnMatch = RETURN_VALUE.matcher(stmt.text().trim());
        if (!returnMatch.find()) {
            return new ReturnValueInfo("", blockId, stmt.id(), ReturnValueType.VOID, List.of(), "void");
        }

        String value = returnMatch.group(1).trim();
        ReturnValueType type = classify(value);
        return new ReturnValueInfo(value, blockId, stmt.id(), type, usedVariables(value, type), inferReturnType(value));
    }

    /**
     * Classifies a returned expression: call, conditional, operator expression,
     * literal constant, bare variable, or (for anything else) expression.
     */
    ReturnValueType classify(String value) {
        if (value.isEmpty()) {
            return ReturnValueType.VOID;
        }
        if (value.contains("(") && value.contains(")") && CALL.matcher(value).find()) {
            return ReturnValueType.CALL;
        }
        if (isConditional(value)) {
            return ReturnValueType.CONDITIONAL;
        }
        if (OPERATOR.matcher(value).find()) {
            return ReturnValueType.EXPRESSION;
        }
        if (isConstant(value)) {
            return ReturnValueType.CONSTANT;
        }
        if (IDENTIFIER.matcher(value).matches()) {
            return ReturnValueType.VARIABLE;
        }
        return ReturnValueType.EXPRESSION;
    }

    private static List<String> usedVariables(String value, ReturnValueType type) {
        return switch (type) {
            case CALL -> VariableExtractor.extractVariables(callArguments(value), VariableExtractor.KEYWORDS_AND_LITERALS);
            case CONSTANT, VOID -> List.of();
            default -> VariableExtractor.extractVariables(value, VariableExtractor.KEYWORDS_AND_LITERALS);
        };
    }

    private static String callArguments(String value) {
        Matcher call = CALL.matcher(value);
        return call.find() ? call.group(2) : "";
    }

    // exactly one '?' and one ':'
    private static boolean isConditional(String value) {
        if (!value.contains("?") || !value.contains(":")) {
            return false;
        }
        String[] parts = value.split("\\?", -1);
        return parts.length == 2 && parts[1].split(":", -1).length == 2;
    }

    private static boolean isConstant(String value) {
        return INTEGER.matcher(value).matches()
                || DECIMAL.matcher(value).matches()
                || LITERAL_KEYWORDS.contains(value);
    }

    /**
     * Best-effort type of a returned literal; anything needing the call graph or
     * declarations is {@code auto}.
     */
    static String inferReturnType(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            return "void";
        }
        if (INTEGER.matcher(trimmed).matches()) {
            return "int";
        }
        if (DECIMAL_PREFIX.matcher(trimmed).find()) {
            return "double";
        }
        if (trimmed.equals("true") || trimmed.equals("false")) {
            return "bool";
        }
        if (trimmed.equals("nullptr") || trimmed.equals("NULL")) {
            return "void*";
        }
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return "const char*";
        }
        if (trimmed.length() >= 2 && trimmed.startsWith("'") && trimmed.endsWith("'")) {
            return "char";
        }
        return "auto";
    }

    /**
     * Returns every variable any of the return values reads; these affect a
     * variable assigned from a call to the function.
     */
    public List<String> affectingVariables(List<ReturnValueInfo> returns) {
        Set<String> variables = new LinkedHashSet<>();
        for (ReturnValueInfo info : returns) {
            variables.addAll(info.usedVariables());
        }
        return List.copyOf(variables);
    }

    public boolean hasMultipleReturnPaths(List<ReturnValueInfo> returns) {
        return returns.size() > 1;
    }

    public boolean hasConditionalReturns(List<ReturnValueInfo> returns) {
        return returns.stream().anyMatch(r -> r.type() == ReturnValueType.CONDITIONAL);
    }
}
