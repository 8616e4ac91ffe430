package com.csentinel.core.ast;

import java.util.List;

/**
 * struct or union specifier. Name is null for anonymous types; fields is null
 * for a forward reference ({@code struct node;} or {@code struct node *next}).
 */
public final class StructSpecifier extends Node {

    private final String keyword;
    private final String name;
    private final List<StructField> fields;

    public StructSpecifier(String keyword, String name, List<StructField> fields, SourcePosition position) {
        super(position);
        this.keyword = keyword;
        this.name = name;
        this.fields = fields == null ? null : listOf(fields);
    }

    public String keyword()             { return keyword; }
    public String name()                { return name; }
    public List<StructField> members()  { return fields; }
    public boolean isForwardReference() { return fields == null; }
    public boolean isAnonymous()        { return name == null; }

    /** Type text as it would be written in a declaration. */
    public String typeText() {
        return name != null ? keyword + " " + name : keyword;
    }

    @Override public NodeKind kind() { return NodeKind.STRUCT_SPECIFIER; }

    @Override
    public List<Field> fields() {
        return List.of(
            Field.of("keyword", keyword),
            Field.of("name", name),
            Field.of("fields", fields));
    }
}
