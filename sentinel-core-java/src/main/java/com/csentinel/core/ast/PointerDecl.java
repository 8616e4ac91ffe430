package com.csentinel.core.ast;

import java.util.List;

public final class PointerDecl extends Node {

    private final int level;

    public PointerDecl(int level, SourcePosition position) {
        super(position);
        this.level = level;
    }

    public int level() { return level; }

    @Override public NodeKind kind() { return NodeKind.POINTER_DECL; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("level", level));
    }
}
