package io.callscan.analysis;

import io.callscan.model.ArgumentDerivation;
import io.callscan.model.ArgumentDerivation.AddressOf;
import io.callscan.model.ArgumentDerivation.ArrayAccess;
import io.callscan.model.ArgumentDerivation.CallResult;
import io.callscan.model.ArgumentDerivation.Composite;
import io.callscan.model.ArgumentDerivation.Dereference;
import io.callscan.model.ArgumentDerivation.Direct;
import io.callscan.model.ArgumentDerivation.Expression;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies how an actual argument expression is derived from program variables.
 * <p>
 * Rules are tried in a fixed order and the first match wins:
 * <ol>
 *   <li>{@code &x}: address-of</li>
 *   <li>{@code *p}: dereference</li>
 *   <li>{@code f(args)}: call result, base is the called name</li>
 *   <li>{@code a[i]}: array access</li>
 *   <li>{@code s.f}, {@code p->f}: member access chain</li>
 *   <li>operator characters: expression, base is the first identifier</li>
 *   <li>bare identifier: direct</li>
 *   <li>anything else (literals): expression without transformations</li>
 * </ol>
 * The classification never fails; every input gets exactly one derivation.
 */
public class ArgumentDerivationClassifier {

    private static final Pattern CALL = Pattern.compile("([a-zA-Z_][a-zA-Z0-9_]*)\\s*\\(([^)]*)\\)");
    private static final Pattern ARRAY = Pattern.compile("([a-zA-Z_][a-zA-Z0-9_]*)\\s*\\[([^\\]]+)\\]");
    private static final Pattern OPERATOR = Pattern.compile("[+\\-*/%<>=!&|]");
    private static final Pattern FIRST_IDENTIFIER = Pattern.compile("\\b([a-zA-Z_]\\w*)\\b");
    private static final Pattern BARE_IDENTIFIER = Pattern.compile("^\\s*([a-zA-Z_]\\w*)\\s*$");
    private static final Pattern MEMBER_SEPARATOR = Pattern.compile("\\.|->");

    public ArgumentDerivation analyzeArgumentDerivation(String argument) {
        String expr = argument == null ? "" : argument.trim();

        if (expr.startsWith("&")) {
            String base = expr.substring(1).trim();
            return new AddressOf(base, expr, VariableExtractor.extractVariables(base));
        }

        if (expr.startsWith("*")) {
            String base = expr.substring(1).trim();
            return new Dereference(base, expr, VariableExtractor.extractVariables(base));
        }

        if (expr.contains("(") && expr.contains(")")) {
            Matcher call = CALL.matcher(expr);
            if (call.find()) {
                return new CallResult(call.group(1), expr, VariableExtractor.extractVariables(call.group(2)));
            }
        }

        if (expr.contains("[") && expr.contains("]")) {
            Matcher array = ARRAY.matcher(expr);
            if (array.find()) {
                String name = array.group(1);
                String index = array.group(2);
                Set<String> used = new LinkedHashSet<>();
                used.add(name);
                used.addAll(VariableExtractor.extractVariables(index));
                return new ArrayAccess(name, index, expr, List.copyOf(used));
            }
        }

        if (expr.contains(".") || expr.contains("->")) {
            return memberAccess(expr);
        }

        if (OPERATOR.matcher(expr).find()) {
            Matcher first = FIRST_IDENTIFIER.matcher(expr);
            String base = first.find() ? first.group(1) : expr;
            return new Expression(base, expr, VariableExtractor.extractVariables(expr), List.of("arithmetic"));
        }

        Matcher bare = BARE_IDENTIFIER.matcher(expr);
        if (bare.matches()) {
            return new Direct(bare.group(1), expr);
        }

        return new Expression(expr, expr, VariableExtractor.extractVariables(expr), List.of());
    }

    /**
     * Base is the text before the first separator; the rest is split on both
     * {@code .} and {@code ->} into the member chain.
     */
    private static Composite memberAccess(String expr) {
        Matcher separator = MEMBER_SEPARATOR.matcher(expr);
        separator.find();
        String base = expr.substring(0, separator.start()).trim();
        String rest = expr.substring(separator.end());

        List<String> members = new ArrayList<>();
        for (String member : MEMBER_SEPARATOR.split(rest)) {
            String trimmed = member.trim();
            if (!trimmed.isEmpty()) {
                members.add(trimmed);
            }
        }
        return new Composite(base, expr, members, VariableExtractor.extractVariables(base));
    }
}
