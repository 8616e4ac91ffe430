package com.csentinel.core.ast;

import java.util.List;

public final class Identifier extends Node {

    private final String name;

    public Identifier(String name, SourcePosition position) {
        super(position);
        this.name = name;
    }

    public String name() { return name; }

    @Override public NodeKind kind() { return NodeKind.IDENTIFIER; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("name", name));
    }
}
