package com.csentinel.core.ast;

import java.util.List;

/**
 * One declared name with its pointer level, array dimensions and initializer.
 * The name is null for abstract parameter declarators such as {@code int f(char *)}.
 */
public final class VarDeclarator extends Node {

    private final String name;
    private final PointerDecl pointer;
    private final List<ArrayDecl> dimensions;
    private final Node initializer;

    public VarDeclarator(String name, PointerDecl pointer, List<ArrayDecl> dimensions,
                         Node initializer, SourcePosition position) {
        super(position);
        this.name = name;
        this.pointer = pointer;
        this.dimensions = listOf(dimensions);
        this.initializer = initializer;
    }

    public String name()                { return name; }
    public PointerDecl pointer()        { return pointer; }
    public List<ArrayDecl> dimensions() { return dimensions; }
    public Node initializer()           { return initializer; }

    public boolean isPointer() { return pointer != null; }

    @Override public NodeKind kind() { return NodeKind.VAR_DECLARATOR; }

    @Override
    public List<Field> fields() {
        return List.of(
            Field.of("name", name),
            Field.of("pointer", pointer),
            Field.of("dimensions", dimensions),
            Field.of("initializer", initializer));
    }
}
