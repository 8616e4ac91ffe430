package com.csentinel.core.ast;

import java.util.List;

/** {@code (type) expr}; position is the opening parenthesis. */
public final class Cast extends Node {

    private final String toType;
    private final Node expr;

    public Cast(String toType, Node expr, SourcePosition position) {
        super(position);
        this.toType = toType;
        this.expr = expr;
    }

    public String toType() { return toType; }
    public Node expr()     { return expr; }

    @Override public NodeKind kind() { return NodeKind.CAST; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("to_type", toType), Field.of("expr", expr));
    }
}
