package com.csentinel.core.ast;

import java.util.List;

public final class Compound extends Node {

    private final List<Node> items;

    public Compound(List<Node> items, SourcePosition position) {
        super(position);
        this.items = listOf(items);
    }

    public List<Node> items() { return items; }

    @Override public NodeKind kind() { return NodeKind.COMPOUND; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("items", items));
    }
}
