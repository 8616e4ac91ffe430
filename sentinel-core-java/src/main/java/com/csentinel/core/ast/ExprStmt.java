package com.csentinel.core.ast;

import java.util.List;

/** Expression statement; expr is null for the empty statement {@code ;}. */
public final class ExprStmt extends Node {

    private final Node expr;

    public ExprStmt(Node expr, SourcePosition position) {
        super(position);
        this.expr = expr;
    }

    public Node expr() { return expr; }

    @Override public NodeKind kind() { return NodeKind.EXPR_STMT; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("expr", expr));
    }
}
