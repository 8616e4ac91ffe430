package com.csentinel.core.ast;

import java.util.List;

/** {@code base[index]}; position is the opening bracket. */
public final class ArrayRef extends Node {

    private final Node base;
    private final Node index;

    public ArrayRef(Node base, Node index, SourcePosition position) {
        super(position);
        this.base = base;
        this.index = index;
    }

    public Node base()  { return base; }
    public Node index() { return index; }

    @Override public NodeKind kind() { return NodeKind.ARRAY_REF; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("base", base), Field.of("index", index));
    }
}
