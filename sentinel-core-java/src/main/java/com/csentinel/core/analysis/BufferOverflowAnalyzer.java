package com.csentinel.core.analysis;

import com.csentinel.core.SentinelConfig;
import com.csentinel.core.ast.*;
import com.csentinel.core.diagnostics.Diagnostics;

import java.util.Map;
import java.util.Set;

/**
 * Flags calls to unbounded write functions and classifies the written buffer
 * as heap or stack by direct allocator provenance.
 *
 * A name becomes heap-backed when it is declared with, or assigned, the result
 * of {@code malloc}, {@code calloc} or {@code realloc}, looking through casts.
 * This is a per-file heuristic without data flow: aliases and reassignments are
 * not followed. Targets whose base name cannot be resolved and callees that are
 * not plain identifiers are skipped without a finding.
 */
public class BufferOverflowAnalyzer extends BaseAnalyzer {

    static final Set<String> HEAP_ALLOCATORS = Set.of("malloc", "calloc", "realloc");

    /** Unsafe writer to the index of the argument it writes; negative counts from the end. */
    static final Map<String, Integer> WRITE_ARG_INDEX = Map.of(
        "gets", 0,
        "strcpy", 0,
        "strcat", 0,
        "scanf", -1
    );

    public BufferOverflowAnalyzer(Diagnostics diagnostics, int maxDepth) {
        super(diagnostics, maxDepth);
    }

    public BufferOverflowAnalyzer(Diagnostics diagnostics) {
        this(diagnostics, SentinelConfig.defaults().traversalDepthLimit());
    }

    @Override
    protected void visitDeclaration(Declaration node) {
        for (VarDeclarator declarator : node.declarators()) {
            if (declarator.name() == null || declarator.initializer() == null) continue;
            Call call = unwrapCall(declarator.initializer());
            if (call != null && HEAP_ALLOCATORS.contains(call.calleeName())) {
                heapVars.add(declarator.name());
            }
        }
        genericVisit(node);
    }

    @Override
    protected void visitCall(Call node) {
        String callee = node.calleeName();
        if (callee == null) {
            genericVisit(node);
            return;
        }
        if (HEAP_ALLOCATORS.contains(callee)) {
            String assigned = assignedName(node);
            if (assigned != null) heapVars.add(assigned);
            genericVisit(node);
            return;
        }

        Integer index = WRITE_ARG_INDEX.get(callee);
        if (index != null) {
            int idx = index < 0 ? node.args().size() + index : index;
            if (idx >= 0 && idx < node.args().size()) {
                checkTarget(callee, node, node.args().get(idx));
            }
        }
        genericVisit(node);
    }

    private void checkTarget(String callee, Call call, Node target) {
        String baseName = baseName(target);
        if (baseName == null) {
            return;
        }
        VulnerabilityType type = heapVars.contains(baseName)
                ? VulnerabilityType.HEAP_OVERFLOW
                : VulnerabilityType.STACK_OVERFLOW;
        SourcePosition position = call.func().position();
        Integer line = position != null ? position.line() : null;
        report(Vulnerability.critical(type, callee, line, label(target)));
    }

    /**
     * Name that receives the allocator result: the declarator or the base of
     * the left operand of a plain assignment, reached through any casts.
     */
    private static String assignedName(Call call) {
        Node child = call;
        Node parent = call.parent();
        while (parent instanceof Cast) {
            child = parent;
            parent = parent.parent();
        }
        if (parent instanceof VarDeclarator) {
            return ((VarDeclarator) parent).name();
        }
        if (parent instanceof BinaryOp) {
            BinaryOp op = (BinaryOp) parent;
            if ("=".equals(op.op()) && op.right() == child) {
                return baseName(op.left());
            }
        }
        return null;
    }

    static Call unwrapCall(Node node) {
        Node current = node;
        while (current instanceof Cast) {
            current = ((Cast) current).expr();
        }
        return current instanceof Call ? (Call) current : null;
    }

    /** Identifier the written memory hangs off, or null when there is none. */
    static String baseName(Node node) {
        if (node == null) return null;
        switch (node.kind()) {
            case IDENTIFIER:
                return ((Identifier) node).name();
            case UNARY_OP: {
                UnaryOp op = (UnaryOp) node;
                return UnaryOp.ADDRESS_OF.equals(op.op()) ? baseName(op.operand()) : null;
            }
            case ARRAY_REF:
                return baseName(((ArrayRef) node).base());
            case MEMBER_ACCESS:
                return baseName(((MemberAccess) node).base());
            case POINTER_MEMBER_ACCESS:
                return baseName(((PointerMemberAccess) node).base());
            case CAST:
                return baseName(((Cast) node).expr());
            default:
                return null;
        }
    }

    /** Human-readable target: {@code buf}, {@code &x}, {@code base[]}, {@code a.m}, {@code a->m}. */
    static String label(Node node) {
        if (node == null) return "unknown";
        switch (node.kind()) {
            case IDENTIFIER:
                return ((Identifier) node).name();
            case UNARY_OP: {
                UnaryOp op = (UnaryOp) node;
                return UnaryOp.ADDRESS_OF.equals(op.op())
                        ? "&" + label(op.operand())
                        : node.kind().displayName();
            }
            case ARRAY_REF:
                return label(((ArrayRef) node).base()) + "[]";
            case MEMBER_ACCESS: {
                MemberAccess access = (MemberAccess) node;
                return label(access.base()) + "." + memberName(access.member());
            }
            case POINTER_MEMBER_ACCESS: {
                PointerMemberAccess access = (PointerMemberAccess) node;
                return label(access.base()) + "->" + memberName(access.member());
            }
            case CAST:
                return label(((Cast) node).expr());
            default:
                return node.kind().displayName();
        }
    }

    private static String memberName(Identifier member) {
        return member != null ? member.name() : "field";
    }
}
