package com.csentinel.core.ast;

import java.util.List;

public final class StructField extends Node {

    private final String typeSpec;
    private final StructSpecifier struct;
    private final List<VarDeclarator> declarators;

    public StructField(String typeSpec, StructSpecifier struct, List<VarDeclarator> declarators,
                       SourcePosition position) {
        super(position);
        this.typeSpec = typeSpec;
        this.struct = struct;
        this.declarators = listOf(declarators);
    }

    public String typeSpec()                 { return typeSpec; }
    public StructSpecifier struct()          { return struct; }
    public List<VarDeclarator> declarators() { return declarators; }

    @Override public NodeKind kind() { return NodeKind.STRUCT_FIELD; }

    @Override
    public List<Field> fields() {
        return List.of(
            Field.of("type_spec", typeSpec),
            Field.of("struct", struct),
            Field.of("declarators", declarators));
    }
}
