package com.csentinel.core.ast;

import java.util.List;

public final class TernaryOp extends Node {

    private final Node condition;
    private final Node trueExpr;
    private final Node falseExpr;

    public TernaryOp(Node condition, Node trueExpr, Node falseExpr, SourcePosition position) {
        super(position);
        this.condition = condition;
        this.trueExpr = trueExpr;
        this.falseExpr = falseExpr;
    }

    public Node condition() { return condition; }
    public Node trueExpr()  { return trueExpr; }
    public Node falseExpr() { return falseExpr; }

    @Override public NodeKind kind() { return NodeKind.TERNARY_OP; }

    @Override
    public List<Field> fields() {
        return List.of(
            Field.of("condition", condition),
            Field.of("true_expr", trueExpr),
            Field.of("false_expr", falseExpr));
    }
}
