package com.csentinel.core.cfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Basic-block graph of one function. Blocks are never removed, so blocks made
 * unreachable by a return, break or continue stay in {@link #getBlocks()}.
 */
public class ControlFlowGraph {

    private final String functionName;
    private final List<BasicBlock> blocks = new ArrayList<>();
    private BasicBlock entry;

    public ControlFlowGraph(String functionName) {
        this.functionName = functionName;
    }

    /** Creates a block with the next sequential id (B0, B1, ...). */
    public BasicBlock newBlock(String label) {
        BasicBlock block = new BasicBlock("B" + blocks.size(), label);
        blocks.add(block);
        return block;
    }

    void setEntry(BasicBlock entry) {
        this.entry = entry;
    }

    public String getFunctionName()    { return functionName; }
    public BasicBlock getEntry()       { return entry; }
    public List<BasicBlock> getBlocks() { return Collections.unmodifiableList(blocks); }

    public BasicBlock findBlock(String id) {
        for (BasicBlock b : blocks) {
            if (b.getId().equals(id)) return b;
        }
        return null;
    }

    /** Blocks reachable from the entry, breadth first. */
    public Set<BasicBlock> reachableFromEntry() {
        Set<BasicBlock> seen = new LinkedHashSet<>();
        if (entry == null) return seen;
        Deque<BasicBlock> queue = new ArrayDeque<>();
        queue.add(entry);
        seen.add(entry);
        while (!queue.isEmpty()) {
            for (BasicBlock succ : queue.poll().getSuccessors()) {
                if (seen.add(succ)) queue.add(succ);
            }
        }
        return seen;
    }
}
