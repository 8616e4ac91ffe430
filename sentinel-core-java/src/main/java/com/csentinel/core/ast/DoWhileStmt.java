package com.csentinel.core.ast;

import java.util.List;

public final class DoWhileStmt extends Node {

    private final Node body;
    private final Node cond;

    public DoWhileStmt(Node body, Node cond, SourcePosition position) {
        super(position);
        this.body = body;
        this.cond = cond;
    }

    public Node body() { return body; }
    public Node cond() { return cond; }

    @Override public NodeKind kind() { return NodeKind.DO_WHILE_STMT; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("body", body), Field.of("cond", cond));
    }
}
