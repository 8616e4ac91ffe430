package com.csentinel.core.ast;

import java.util.List;
import java.util.Set;

/**
 * Binary operator, including assignments ({@code =}, {@code +=}, ...) and the
 * comma operator. Position is the operator token.
 */
public final class BinaryOp extends Node {

    private static final Set<String> ASSIGNMENT_OPS =
        Set.of("=", "+=", "-=", "*=", "/=", "%=", "<<=", ">>=", "&=", "|=", "^=");

    private final String op;
    private final Node left;
    private final Node right;

    public BinaryOp(String op, Node left, Node right, SourcePosition position) {
        super(position);
        this.op = op;
        this.left = left;
        this.right = right;
    }

    public String op()  { return op; }
    public Node left()  { return left; }
    public Node right() { return right; }

    public boolean isAssignment() {
        return ASSIGNMENT_OPS.contains(op);
    }

    @Override public NodeKind kind() { return NodeKind.BINARY_OP; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("op", op), Field.of("left", left), Field.of("right", right));
    }
}
