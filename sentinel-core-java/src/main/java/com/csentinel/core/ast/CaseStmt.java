package com.csentinel.core.ast;

import java.util.List;

public final class CaseStmt extends Node {

    private final Node value;
    private final Node statement;

    public CaseStmt(Node value, Node statement, SourcePosition position) {
        super(position);
        this.value = value;
        this.statement = statement;
    }

    public Node value()     { return value; }
    public Node statement() { return statement; }

    @Override public NodeKind kind() { return NodeKind.CASE_STMT; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("value", value), Field.of("statement", statement));
    }
}
