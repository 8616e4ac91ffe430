package com.csentinel.core.ast;

import java.util.List;

/** A type written where an expression could stand, as in {@code sizeof(char *)}. */
public final class TypeName extends Node {

    private final String text;

    public TypeName(String text, SourcePosition position) {
        super(position);
        this.text = text;
    }

    public String text() { return text; }

    @Override public NodeKind kind() { return NodeKind.TYPE_NAME; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("text", text));
    }
}
