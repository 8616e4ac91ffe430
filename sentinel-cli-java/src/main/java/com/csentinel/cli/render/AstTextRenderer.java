package com.csentinel.cli.render;

import com.csentinel.core.ast.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders an AST as an indented box-drawing tree:
 *
 * <pre>
 * Program
 * └── external_declarations:
 *     └── FunctionDef
 *         ├── return_type: 'int'
 *         ├── name: 'main'
 *         ...
 * </pre>
 *
 * Scalar fields print as {@code name: value} (strings quoted), node fields and
 * non-empty node lists print a {@code name:} label followed by the nodes.
 * Null fields and empty lists are left out.
 */
public class AstTextRenderer {

    private static final String TEE = "├── ";
    private static final String ELBOW = "└── ";
    private static final String PIPE = "│   ";
    private static final String BLANK = "    ";

    public String render(Node root) {
        if (root == null) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        lines.add(root.kind().displayName());
        renderChildren(root, "", lines);
        return String.join("\n", lines);
    }

    private void render(Node node, String prefix, boolean last, List<String> lines) {
        lines.add(prefix + (last ? ELBOW : TEE) + node.kind().displayName());
        renderChildren(node, prefix + (last ? BLANK : PIPE), lines);
    }

    private void renderChildren(Node node, String prefix, List<String> lines) {
        List<Object> entries = new ArrayList<>();
        for (Node.Field field : node.fields()) {
            Object value = field.value();
            if (value == null) continue;
            if (field.isScalar()) {
                entries.add(field.name() + ": " + scalar(value));
            } else if (value instanceof Node) {
                entries.add(field.name() + ":");
                entries.add(value);
            } else if (value instanceof List<?> && !((List<?>) value).isEmpty()) {
                entries.add(field.name() + ":");
                for (Object item : (List<?>) value) {
                    if (item instanceof Node) entries.add(item);
                }
            }
        }

        for (int i = 0; i < entries.size(); i++) {
            boolean last = i == entries.size() - 1;
            Object entry = entries.get(i);
            if (entry instanceof Node) {
                render((Node) entry, prefix, last, lines);
            } else {
                lines.add(prefix + (last ? ELBOW : TEE) + entry);
            }
        }
    }

    private static String scalar(Object value) {
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
}
