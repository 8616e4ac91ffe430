package com.csentinel.core.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Straight-line run of instructions with one entry. Successor and predecessor
 * sets keep insertion order and are only changed together through
 * {@link #addSuccessor(BasicBlock)}.
 */
public class BasicBlock {

    private final String id;
    private final String label;
    private final List<String> instructions = new ArrayList<>();
    private final Set<BasicBlock> successors = new LinkedHashSet<>();
    private final Set<BasicBlock> predecessors = new LinkedHashSet<>();

    BasicBlock(String id, String label) {
        this.id = id;
        this.label = label;
    }

    public String getId()    { return id; }
    public String getLabel() { return label; }

    public List<String> getInstructions()  { return Collections.unmodifiableList(instructions); }
    public Set<BasicBlock> getSuccessors()   { return Collections.unmodifiableSet(successors); }
    public Set<BasicBlock> getPredecessors() { return Collections.unmodifiableSet(predecessors); }

    public void addInstruction(String instruction) {
        instructions.add(instruction);
    }

    /** Adds the edge this -> target on both ends. Adding an existing edge is a no-op. */
    public void addSuccessor(BasicBlock target) {
        successors.add(target);
        target.predecessors.add(this);
    }

    @Override
    public String toString() {
        return id + "(" + label + ")";
    }
}
