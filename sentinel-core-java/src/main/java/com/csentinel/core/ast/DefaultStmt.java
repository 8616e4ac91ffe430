package com.csentinel.core.ast;

import java.util.List;

public final class DefaultStmt extends Node {

    private final Node statement;

    public DefaultStmt(Node statement, SourcePosition position) {
        super(position);
        this.statement = statement;
    }

    public Node statement() { return statement; }

    @Override public NodeKind kind() { return NodeKind.DEFAULT_STMT; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("statement", statement));
    }
}
