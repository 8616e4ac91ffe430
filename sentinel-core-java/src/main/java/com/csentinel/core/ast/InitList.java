package com.csentinel.core.ast;

import java.util.List;

/** Brace initializer {@code { a, b, c }}. */
public final class InitList extends Node {

    private final List<Node> items;

    public InitList(List<Node> items, SourcePosition position) {
        super(position);
        this.items = listOf(items);
    }

    public List<Node> items() { return items; }

    @Override public NodeKind kind() { return NodeKind.INIT_LIST; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("items", items));
    }
}
