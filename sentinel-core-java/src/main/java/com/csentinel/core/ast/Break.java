package com.csentinel.core.ast;

import java.util.List;

public final class Break extends Node {

    public Break(SourcePosition position) {
        super(position);
    }

    @Override public NodeKind kind() { return NodeKind.BREAK; }

    @Override
    public List<Field> fields() {
        return List.of();
    }
}
