package com.csentinel.core.ast;

import java.util.List;

/**
 * Prefix and postfix operators. Postfix increment and decrement use the
 * {@link #POSTINC} and {@link #POSTDEC} operator names; {@code sizeof} is
 * a unary operator whose operand may be a {@link TypeName}.
 */
public final class UnaryOp extends Node {

    public static final String POSTINC = "POSTINC";
    public static final String POSTDEC = "POSTDEC";
    public static final String SIZEOF = "sizeof";
    public static final String ADDRESS_OF = "&";

    private final String op;
    private final Node operand;

    public UnaryOp(String op, Node operand, SourcePosition position) {
        super(position);
        this.op = op;
        this.operand = operand;
    }

    public String op()     { return op; }
    public Node operand()  { return operand; }

    @Override public NodeKind kind() { return NodeKind.UNARY_OP; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("op", op), Field.of("operand", operand));
    }
}
