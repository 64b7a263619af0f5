package io.callscan.model;

/**
 * How an actual argument expression is built from program variables.
 */
public enum DerivationType {
    /** Bare variable reference: {@code foo(x)} */
    DIRECT("direct"),
    /** Arithmetic, comparison or logical expression: {@code foo(x + 1)} */
    EXPRESSION("expression"),
    /** Structure/object member access: {@code foo(obj.field)}, {@code foo(p->next)} */
    COMPOSITE("composite"),
    /** Address-of: {@code foo(&x)} */
    ADDRESS("address"),
    /** Result of a nested call: {@code foo(bar(y))} */
    CALL("call"),
    /** Array element: {@code foo(arr[i])} */
    ARRAY_ACCESS("array_access"),
    /** Pointer dereference: {@code foo(*ptr)} */
    DEREFERENCE("dereference");

    private final String label;

    DerivationType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
