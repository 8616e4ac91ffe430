package com.csentinel.core.ast;

import java.util.List;

/**
 * {@code for (init; cond; post) body}. Init is a Declaration or an expression;
 * any of init, cond and post may be null.
 */
public final class ForStmt extends Node {

    private final Node init;
    private final Node cond;
    private final Node post;
    private final Node body;

    public ForStmt(Node init, Node cond, Node post, Node body, SourcePosition position) {
        super(position);
        this.init = init;
        this.cond = cond;
        this.post = post;
        this.body = body;
    }

    public Node init() { return init; }
    public Node cond() { return cond; }
    public Node post() { return post; }
    public Node body() { return body; }

    @Override public NodeKind kind() { return NodeKind.FOR_STMT; }

    @Override
    public List<Field> fields() {
        return List.of(
            Field.of("init", init),
            Field.of("cond", cond),
            Field.of("post", post),
            Field.of("body", body));
    }
}
