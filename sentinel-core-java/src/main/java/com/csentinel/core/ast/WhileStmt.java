package com.csentinel.core.ast;

import java.util.List;

public final class WhileStmt extends Node {

    private final Node cond;
    private final Node body;

    public WhileStmt(Node cond, Node body, SourcePosition position) {
        super(position);
        this.cond = cond;
        this.body = body;
    }

    public Node cond() { return cond; }
    public Node body() { return body; }

    @Override public NodeKind kind() { return NodeKind.WHILE_STMT; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("cond", cond), Field.of("body", body));
    }
}
