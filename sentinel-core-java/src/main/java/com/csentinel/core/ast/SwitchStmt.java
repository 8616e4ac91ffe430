package com.csentinel.core.ast;

import java.util.List;

public final class SwitchStmt extends Node {

    private final Node expr;
    private final Node body;

    public SwitchStmt(Node expr, Node body, SourcePosition position) {
        super(position);
        this.expr = expr;
        this.body = body;
    }

    public Node expr() { return expr; }
    public Node body() { return body; }

    @Override public NodeKind kind() { return NodeKind.SWITCH_STMT; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("expr", expr), Field.of("body", body));
    }
}
