package com.csentinel.core.ast;

import java.util.List;

/**
 * Literal kept as its source text. ctype is one of int, float, char, string.
 */
public final class Constant extends Node {

    private final String value;
    private final String ctype;

    public Constant(String value, String ctype, SourcePosition position) {
        super(position);
        this.value = value;
        this.ctype = ctype;
    }

    public String value() { return value; }
    public String ctype() { return ctype; }

    @Override public NodeKind kind() { return NodeKind.CONSTANT; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("value", value), Field.of("ctype", ctype));
    }
}
