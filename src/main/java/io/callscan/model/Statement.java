package io.callscan.model;

/**
 * A statement inside a basic block.
 *
 * @param id   Statement identifier, unique within its function (may be null)
 * @param text Source text of the statement
 */
public record Statement(String id, String text) {
    public Statement {
        if (text == null) {
            text = "";
        }
    }

    public static Statement of(String text) {
        return new Statement(null, text);
    }
}
