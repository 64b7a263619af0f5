package io.callscan.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A function in the call graph.
 * <p>
 * Identity and signature are fixed at construction. The {@code external} and
 * {@code recursive} flags are analysis outputs written back onto the node; they
 * can only ever be raised, so repeated or reordered analysis passes agree.
 */
public final class FunctionNode {

    private final String name;
    private final List<Parameter> parameters;
    private final String returnType;
    private final boolean declarationOnly;

    private volatile boolean external;
    private volatile boolean recursive;

    private FunctionNode(String name, List<Parameter> parameters, String returnType, boolean declarationOnly) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Function name cannot be null or blank");
        }
        this.name = name;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.returnType = returnType == null || returnType.isBlank() ? "auto" : returnType;
        this.declarationOnly = declarationOnly;
    }

    public String name() {
        return name;
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public String returnType() {
        return returnType;
    }

    /**
     * True for a prototype seen without a body (e.g., a library declaration).
     */
    public boolean isDeclarationOnly() {
        return declarationOnly;
    }

    public boolean isExternal() {
        return external;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public void markExternal() {
        this.external = true;
    }

    public void markRecursive() {
        this.recursive = true;
    }

    /**
     * Returns the parameter names in declaration order.
     */
    public List<String> parameterNames() {
        return parameters.stream().map(Parameter::name).toList();
    }

    @Override
    public String toString() {
        return name + "(" + String.join(", ", parameterNames()) + ")";
    }

    public static FunctionNode of(String name, String... parameterNames) {
        Builder builder = builder().name(name);
        for (String param : parameterNames) {
            builder.parameter(Parameter.of(param));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private final List<Parameter> parameters = new ArrayList<>();
        private String returnType;
        private boolean declarationOnly;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder parameter(Parameter parameter) {
            this.parameters.add(parameter);
            return this;
        }

        public Builder parameters(List<Parameter> parameters) {
            this.parameters.clear();
            if (parameters != null) {
                this.parameters.addAll(parameters);
            }
            return this;
        }

        public Builder returnType(String returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder declarationOnly(boolean declarationOnly) {
            this.declarationOnly = declarationOnly;
            return this;
        }

        public FunctionNode build() {
            return new FunctionNode(name, parameters, returnType, declarationOnly);
        }
    }
}
