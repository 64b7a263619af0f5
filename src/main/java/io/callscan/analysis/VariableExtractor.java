package io.callscan.analysis;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls variable names out of an expression.
 */
public final class VariableExtractor {

    private static final Pattern IDENTIFIER = Pattern.compile("\\b([a-zA-Z_][a-zA-Z0-9_]*)\\b");

    /**
     * Type names and control keywords that look like identifiers but are never variables.
     */
    public static final Set<String> KEYWORDS = Set.of(
            "int", "float", "double", "char", "bool", "void",
            "return", "if", "else", "while", "for", "do",
            "switch", "case", "default", "const", "static",
            "extern", "auto", "register", "inline"
    );

    /**
     * Keywords plus the literal keywords a returned value may consist of.
     */
    public static final Set<String> KEYWORDS_AND_LITERALS = union(KEYWORDS, Set.of("true", "false", "nullptr", "NULL"));

    private VariableExtractor() {
    }

    /**
     * Returns the identifiers of the expression that are not keywords, without
     * duplicates, in order of first appearance.
     */
    public static List<String> extractVariables(String expression) {
        return extractVariables(expression, KEYWORDS);
    }

    public static List<String> extractVariables(String expression, Set<String> excluded) {
        if (expression == null || expression.isEmpty()) {
            return List.of();
        }
        Set<String> variables = new LinkedHashSet<>();
        Matcher matcher = IDENTIFIER.matcher(expression);
        while (matcher.find()) {
            String identifier = matcher.group(1);
            if (!excluded.contains(identifier)) {
                variables.add(identifier);
            }
        }
        return List.copyOf(variables);
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> result = new LinkedHashSet<>(a);
        result.addAll(b);
        return Set.copyOf(result);
    }
}
