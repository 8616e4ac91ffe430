package com.csentinel.core.ast;

import java.util.List;

public final class Continue extends Node {

    public Continue(SourcePosition position) {
        super(position);
    }

    @Override public NodeKind kind() { return NodeKind.CONTINUE; }

    @Override
    public List<Field> fields() {
        return List.of();
    }
}
