package com.csentinel.core.ast;

import java.util.List;

/** A preprocessor line kept verbatim (#include, #define, ...). */
public final class Include extends Node {

    private final String text;

    public Include(String text, SourcePosition position) {
        super(position);
        this.text = text;
    }

    public String text() { return text; }

    @Override public NodeKind kind() { return NodeKind.INCLUDE; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("text", text));
    }
}
