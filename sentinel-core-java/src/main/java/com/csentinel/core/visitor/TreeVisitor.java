package com.csentinel.core.visitor;

import com.csentinel.core.ast.*;
import com.csentinel.core.diagnostics.Diagnostics;
import com.csentinel.core.diagnostics.Phase;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks an AST once per node.
 *
 * {@link #visit(Node)} dispatches on the node kind to the matching
 * {@code visitXxx} method. Every one of those defaults to
 * {@link #genericVisit(Node)}, which stamps the parent link on each child and
 * recurses into it. Subclasses override only the kinds they care about and
 * call {@code genericVisit} to keep descending.
 *
 * A node is visited at most once per run, keyed on its id, so two
 * structurally equal nodes are still both visited. A RuntimeException raised
 * while visiting one node is logged with the node kind and the walk carries on
 * with its siblings.
 */
public abstract class TreeVisitor {

    protected final Diagnostics diagnostics;
    private final int maxDepth;

    private final Set<Long> visited = new HashSet<>();
    private int depth;

    protected TreeVisitor(Diagnostics diagnostics, int maxDepth) {
        this.diagnostics = diagnostics;
        this.maxDepth = maxDepth;
    }

    /** Clears the visited set. Called at the start of every run. */
    protected void reset() {
        visited.clear();
        depth = 0;
    }

    public final void visit(Node node) {
        if (node == null || !visited.add(node.id())) {
            return;
        }
        if (depth >= maxDepth) {
            diagnostics.error(phase(), "Traversal depth limit " + maxDepth + " reached at "
                    + node.kind().displayName() + ", subtree skipped");
            return;
        }
        depth++;
        try {
            dispatch(node);
        } catch (RuntimeException e) {
            diagnostics.warn(phase(), node.kind().displayName() + ": " + e);
        } finally {
            depth--;
        }
    }

    public final void visitAll(List<? extends Node> nodes) {
        if (nodes == null) return;
        for (Node node : nodes) {
            visit(node);
        }
    }

    public boolean wasVisited(Node node) {
        return node != null && visited.contains(node.id());
    }

    /** Phase under which this visitor's diagnostics are filed. */
    protected Phase phase() {
        return Phase.ANALYSIS;
    }

    private void dispatch(Node node) {
        switch (node.kind()) {
            case PROGRAM               -> visitProgram((Program) node);
            case FUNCTION_DEF          -> visitFunctionDef((FunctionDef) node);
            case DECLARATION           -> visitDeclaration((Declaration) node);
            case VAR_DECLARATOR        -> visitVarDeclarator((VarDeclarator) node);
            case COMPOUND              -> visitCompound((Compound) node);
            case IF_STMT               -> visitIfStmt((IfStmt) node);
            case WHILE_STMT            -> visitWhileStmt((WhileStmt) node);
            case DO_WHILE_STMT         -> visitDoWhileStmt((DoWhileStmt) node);
            case FOR_STMT              -> visitForStmt((ForStmt) node);
            case SWITCH_STMT           -> visitSwitchStmt((SwitchStmt) node);
            case RETURN                -> visitReturn((Return) node);
            case CALL                  -> visitCall((Call) node);
            case IDENTIFIER            -> visitIdentifier((Identifier) node);
            case BINARY_OP             -> visitBinaryOp((BinaryOp) node);
            case UNARY_OP              -> visitUnaryOp((UnaryOp) node);
            case CAST                  -> visitCast((Cast) node);
            case ARRAY_REF             -> visitArrayRef((ArrayRef) node);
            case MEMBER_ACCESS         -> visitMemberAccess((MemberAccess) node);
            case POINTER_MEMBER_ACCESS -> visitPointerMemberAccess((PointerMemberAccess) node);
            case STRUCT_SPECIFIER      -> visitStructSpecifier((StructSpecifier) node);
            default                    -> genericVisit(node);
        }
    }

    /**
     * Structural fallback: stamps {@code node} as the parent of each owned child,
     * then visits the children in field order. The parent link itself is not a
     * field and is never followed.
     */
    protected void genericVisit(Node node) {
        for (Node child : node.children()) {
            child.attachParent(node);
            visit(child);
        }
    }

    protected void visitProgram(Program node)                         { genericVisit(node); }
    protected void visitFunctionDef(FunctionDef node)                 { genericVisit(node); }
    protected void visitDeclaration(Declaration node)                 { genericVisit(node); }
    protected void visitVarDeclarator(VarDeclarator node)             { genericVisit(node); }
    protected void visitCompound(Compound node)                       { genericVisit(node); }
    protected void visitIfStmt(IfStmt node)                           { genericVisit(node); }
    protected void visitWhileStmt(WhileStmt node)                     { genericVisit(node); }
    protected void visitDoWhileStmt(DoWhileStmt node)                 { genericVisit(node); }
    protected void visitForStmt(ForStmt node)                         { genericVisit(node); }
    protected void visitSwitchStmt(SwitchStmt node)                   { genericVisit(node); }
    protected void visitReturn(Return node)                           { genericVisit(node); }
    protected void visitCall(Call node)                               { genericVisit(node); }
    protected void visitIdentifier(Identifier node)                   { genericVisit(node); }
    protected void visitBinaryOp(BinaryOp node)                       { genericVisit(node); }
    protected void visitUnaryOp(UnaryOp node)                         { genericVisit(node); }
    protected void visitCast(Cast node)                               { genericVisit(node); }
    protected void visitArrayRef(ArrayRef node)                       { genericVisit(node); }
    protected void visitMemberAccess(MemberAccess node)               { genericVisit(node); }
    protected void visitPointerMemberAccess(PointerMemberAccess node) { genericVisit(node); }
    protected void visitStructSpecifier(StructSpecifier node)         { genericVisit(node); }
}
