package com.csentinel.core.ast;

import java.util.List;

/** {@code base.member}. */
public final class MemberAccess extends Node {

    private final Node base;
    private final Identifier member;

    public MemberAccess(Node base, Identifier member, SourcePosition position) {
        super(position);
        this.base = base;
        this.member = member;
    }

    public Node base()         { return base; }
    public Identifier member() { return member; }

    @Override public NodeKind kind() { return NodeKind.MEMBER_ACCESS; }

    @Override
    public List<Field> fields() {
        return List.of(Field.of("base", base), Field.of("member", member));
    }
}
