package io.callscan.model;

import java.util.*;

/**
 * Control-flow graph of one function.
 *
 * @param name   Function identifier
 * @param entry  Identifier of the entry block (may be null when unknown)
 * @param blocks Blocks keyed by identifier, in declaration order
 */
public record FunctionCfg(String name, String entry, Map<String, BasicBlock> blocks) {
    public FunctionCfg {
        blocks = blocks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(blocks));
    }

    /**
     * Returns the blocks with no successors.
     */
    public List<BasicBlock> exitBlocks() {
        return blocks.values().stream()
            .filter(BasicBlock::isExit)
            .toList();
    }

    public static FunctionCfg of(String name, List<BasicBlock> blocks) {
        Map<String, BasicBlock> byId = new LinkedHashMap<>();
        for (BasicBlock block : blocks) {
            byId.put(block.id(), block);
        }
        String entry = blocks.isEmpty() ? null : blocks.get(0).id();
        return new FunctionCfg(name, entry, byId);
    }

    /**
     * A CFG made of a single exit block holding the given statements.
     */
    public static FunctionCfg singleBlock(String name, String... statements) {
        List<Statement> stmts = new ArrayList<>();
        for (int i = 0; i < statements.length; i++) {
            stmts.add(new Statement("s" + i, statements[i]));
        }
        return of(name, List.of(new BasicBlock("B0", List.of(), stmts)));
    }
}
