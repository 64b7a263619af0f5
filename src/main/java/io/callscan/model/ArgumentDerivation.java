package io.callscan.model;

import java.util.List;

/**
 * Classification of an actual argument expression.
 * One variant per {@link DerivationType}.
 */
public sealed interface ArgumentDerivation {

    /**
     * Identifier the argument roots from (for unrecognized text, the text itself).
     */
    String base();

    /**
     * Full argument expression, trimmed.
     */
    String expression();

    /**
     * Variables referenced by the expression, keyword-free, without duplicates, first-seen order.
     */
    List<String> usedVariables();

    /**
     * Textual transformations applied to the base.
     */
    List<String> transformations();

    DerivationType type();

    /**
     * Bare variable: {@code x}.
     */
    record Direct(String base, String expression) implements ArgumentDerivation {
        @Override
        public List<String> usedVariables() {
            return List.of(base);
        }

        @Override
        public List<String> transformations() {
            return List.of();
        }

        @Override
        public DerivationType type() {
            return DerivationType.DIRECT;
        }
    }

    /**
     * Operator expression, or unrecognized text such as a literal.
     * A literal carries no transformations.
     */
    record Expression(String base, String expression, List<String> usedVariables, List<String> transformations)
            implements ArgumentDerivation {
        public Expression {
            usedVariables = List.copyOf(usedVariables);
            transformations = List.copyOf(transformations);
        }

        @Override
        public DerivationType type() {
            return DerivationType.EXPRESSION;
        }
    }

    /**
     * Member access chain: {@code obj.a.b}, {@code p->next}.
     */
    record Composite(String base, String expression, List<String> members, List<String> usedVariables)
            implements ArgumentDerivation {
        public Composite {
            members = List.copyOf(members);
            usedVariables = List.copyOf(usedVariables);
        }

        @Override
        public List<String> transformations() {
            return members;
        }

        @Override
        public DerivationType type() {
            return DerivationType.COMPOSITE;
        }
    }

    /**
     * Address-of: {@code &x}.
     */
    record AddressOf(String base, String expression, List<String> usedVariables) implements ArgumentDerivation {
        public AddressOf {
            usedVariables = List.copyOf(usedVariables);
        }

        @Override
        public List<String> transformations() {
            return List.of("&");
        }

        @Override
        public DerivationType type() {
            return DerivationType.ADDRESS;
        }
    }

    /**
     * Pointer dereference: {@code *p}.
     */
    record Dereference(String base, String expression, List<String> usedVariables) implements ArgumentDerivation {
        public Dereference {
            usedVariables = List.copyOf(usedVariables);
        }

        @Override
        public List<String> transformations() {
            return List.of("*");
        }

        @Override
        public DerivationType type() {
            return DerivationType.DEREFERENCE;
        }
    }

    /**
     * Nested call result: {@code bar(y)}. The base is the called function.
     */
    record CallResult(String base, String expression, List<String> usedVariables) implements ArgumentDerivation {
        public CallResult {
            usedVariables = List.copyOf(usedVariables);
        }

        @Override
        public List<String> transformations() {
            return List.of("call");
        }

        @Override
        public DerivationType type() {
            return DerivationType.CALL;
        }
    }

    /**
     * Array element: {@code arr[i + 1]}.
     */
    record ArrayAccess(String base, String index, String expression, List<String> usedVariables)
            implements ArgumentDerivation {
        public ArrayAccess {
            usedVariables = List.copyOf(usedVariables);
        }

        @Override
        public List<String> transformations() {
            return List.of("[" + index + "]");
        }

        @Override
        public DerivationType type() {
            return DerivationType.ARRAY_ACCESS;
        }
    }

    /**
     * Check if the argument passes or reads through a pointer.
     */
    default boolean isPointer() {
        return this instanceof AddressOf || this instanceof Dereference;
    }

    /**
     * Check if the argument reads part of an aggregate (member or element).
     */
    default boolean isComposite() {
        return this instanceof Composite || this instanceof ArrayAccess;
    }

    /**
     * Check if the argument is the result of a nested call.
     */
    default boolean isCall() {
        return this instanceof CallResult;
    }

    /**
     * Get a human-readable description of this derivation.
     */
    default String describe() {
        return type().label() + " (base: " + base() + ")";
    }
}
