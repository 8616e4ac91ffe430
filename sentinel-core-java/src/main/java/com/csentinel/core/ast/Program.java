package com.csentinel.core.ast;

import java.util.List;
import java.util.stream.Collectors;

/** Root of one translation unit: top-level declarations, functions and includes in source order. */
public final class Program extends Node {

    private final List<Node> declarations;

    public Program(List<Node> declarations) {
        super(null);
        this.declarations = listOf(declarations);
    }

    public List<Node> declarations() { return declarations; }

    public List<FunctionDef> functions() {
        return declarations.stream()
            .filter(n -> n instanceof FunctionDef)
            .map(n -> (FunctionDef) n)
            .collect(Collectors.toList());
    }

    @Override public NodeKind kind() { return NodeKind.PROGRAM; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("external_declarations", declarations));
    }
}
