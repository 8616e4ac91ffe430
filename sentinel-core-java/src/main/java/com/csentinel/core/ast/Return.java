package com.csentinel.core.ast;

import java.util.List;

public final class Return extends Node {

    private final Node expr;

    public Return(Node expr, SourcePosition position) {
        super(position);
        this.expr = expr;
    }

    public Node expr() { return expr; }

    @Override public NodeKind kind() { return NodeKind.RETURN; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("expr", expr));
    }
}
