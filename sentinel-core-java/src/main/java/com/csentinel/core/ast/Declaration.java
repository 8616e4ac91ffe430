package com.csentinel.core.ast;

import java.util.List;

/**
 * {@code type declarator, declarator ...;}. The struct specifier, if the type
 * names one, is owned here.
 */
public final class Declaration extends Node {

    private final String declType;
    private final StructSpecifier struct;
    private final List<VarDeclarator> declarators;
    private final boolean typedef;

    public Declaration(String declType, StructSpecifier struct, List<VarDeclarator> declarators,
                       boolean typedef, SourcePosition position) {
        super(position);
        this.declType = declType;
        this.struct = struct;
        this.declarators = listOf(declarators);
        this.typedef = typedef;
    }

    public String declType()                 { return declType; }
    public StructSpecifier struct()          { return struct; }
    public List<VarDeclarator> declarators() { return declarators; }
    public boolean isTypedef()               { return typedef; }

    @Override public NodeKind kind() { return NodeKind.DECLARATION; }

    @Override
    public List<Field> fields() {
        return List.of(
            Field.of("decl_type", declType),
            Field.of("typedef", typedef ? Boolean.TRUE : null),
            Field.of("struct", struct),
            Field.of("declarators", declarators));
    }
}
