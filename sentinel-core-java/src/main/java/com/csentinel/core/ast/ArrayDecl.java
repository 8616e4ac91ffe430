package com.csentinel.core.ast;

import java.util.List;

/** One array dimension; size is null for {@code []}. */
public final class ArrayDecl extends Node {

    private final Node size;

    public ArrayDecl(Node size, SourcePosition position) {
        super(position);
        this.size = size;
    }

    public Node size() { return size; }

    @Override public NodeKind kind() { return NodeKind.ARRAY_DECL; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("size", size));
    }
}
