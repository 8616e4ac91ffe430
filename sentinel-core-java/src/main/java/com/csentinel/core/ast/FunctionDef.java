package com.csentinel.core.ast;

import java.util.List;

/**
 * Function definition, or a prototype when {@link #body()} is null.
 */
public final class FunctionDef extends Node {

    private final String returnType;
    private final String name;
    private final List<VarDeclarator> params;
    private final boolean variadic;
    private final Compound body;

    public FunctionDef(String returnType, String name, List<VarDeclarator> params,
                       boolean variadic, Compound body, SourcePosition position) {
        super(position);
        this.returnType = returnType;
        this.name = name;
        this.params = listOf(params);
        this.variadic = variadic;
        this.body = body;
    }

    public String returnType()          { return returnType; }
    public String name()                { return name; }
    public List<VarDeclarator> params() { return params; }
    public boolean isVariadic()         { return variadic; }
    public Compound body()              { return body; }
    public boolean isPrototype()        { return body == null; }

    @Override public NodeKind kind() { return NodeKind.FUNCTION_DEF; }

    @Override
    public List<Field> fields() {
        return List.of(
            Field.of("return_type", returnType),
            Field.of("name", name),
            Field.of("params", params),
            Field.of("variadic", variadic ? Boolean.TRUE : null),
            Field.of("body", body));
    }
}
