package com.csentinel.core.analysis;

import com.csentinel.core.ast.Node;
import com.csentinel.core.diagnostics.Diagnostics;
import com.csentinel.core.visitor.TreeVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tree visitor that accumulates findings over one whole-tree walk.
 * All per-run state is cleared at the start of {@link #analyze(Node)}, so an
 * instance can be reused across unrelated inputs.
 */
public abstract class BaseAnalyzer extends TreeVisitor {

    private final List<Vulnerability> findings = new ArrayList<>();

    /** Names known to hold heap-allocated memory in the current run. */
    protected final Set<String> heapVars = new HashSet<>();

    protected BaseAnalyzer(Diagnostics diagnostics, int maxDepth) {
        super(diagnostics, maxDepth);
    }

    public List<Vulnerability> analyze(Node root) {
        reset();
        findings.clear();
        heapVars.clear();
        visit(root);
        return Collections.unmodifiableList(new ArrayList<>(findings));
    }

    protected void report(Vulnerability vulnerability) {
        findings.add(vulnerability);
    }

    public Set<String> heapVariables() {
        return Collections.unmodifiableSet(heapVars);
    }
}
