package com.csentinel.core.ast;

import java.util.List;

public final class IfStmt extends Node {

    private final Node cond;
    private final Node thenStmt;
    private final Node elseStmt;

    public IfStmt(Node cond, Node thenStmt, Node elseStmt, SourcePosition position) {
        super(position);
        this.cond = cond;
        this.thenStmt = thenStmt;
        this.elseStmt = elseStmt;
    }

    public Node cond()     { return cond; }
    public Node thenStmt() { return thenStmt; }
    public Node elseStmt() { return elseStmt; }

    @Override public NodeKind kind() { return NodeKind.IF_STMT; }

    @Override
    public List<Field> fields() {
        return List.of(
            Field.of("cond", cond),
            Field.of("then_stmt", thenStmt),
            Field.of("else_stmt", elseStmt));
    }
}
