package io.callscan.model;

import java.util.List;
import java.util.Optional;

/**
 * A basic block of a function CFG.
 *
 * @param id         Block identifier (e.g., "B0")
 * @param successors Identifiers of the successor blocks
 * @param statements Statements in execution order
 */
public record BasicBlock(String id, List<String> successors, List<Statement> statements) {
    public BasicBlock {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Block id cannot be null or blank");
        }
        successors = successors == null ? List.of() : List.copyOf(successors);
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    /**
     * An exit block has no successor edges.
     */
    public boolean isExit() {
        return successors.isEmpty();
    }

    /**
     * Returns the final statement of the block, or empty for an empty block.
     */
    public Optional<Statement> lastStatement() {
        return statements.isEmpty() ? Optional.empty() : Optional.of(statements.get(statements.size() - 1));
    }
}
