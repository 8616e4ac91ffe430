package com.csentinel.core.ast;

import java.util.List;

/** Function call; position is the opening parenthesis. */
public final class Call extends Node {

    private final Node func;
    private final List<Node> args;

    public Call(Node func, List<Node> args, SourcePosition position) {
        super(position);
        this.func = func;
        this.args = listOf(args);
    }

    public Node func()       { return func; }
    public List<Node> args() { return args; }

    /** Callee name when the callee is a plain identifier, else null. */
    public String calleeName() {
        return func instanceof Identifier ? ((Identifier) func).name() : null;
    }

    @Override public NodeKind kind() { return NodeKind.CALL; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("func", func), Field.of("args", args));
    }
}
