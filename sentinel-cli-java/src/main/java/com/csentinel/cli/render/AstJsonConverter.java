package com.csentinel.cli.render;

import com.csentinel.cli.report.ReportModel.AstJson;
import com.csentinel.core.ast.Node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts an AST into the nested {@code {node, attributes, children}} shape of
 * the report. Nodes deeper than the configured limit are dropped.
 */
public class AstJsonConverter {

    public static final int DEFAULT_MAX_DEPTH = 32;

    private final int maxDepth;

    public AstJsonConverter(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public AstJsonConverter() {
        this(DEFAULT_MAX_DEPTH);
    }

    public AstJson convert(Node root) {
        return convert(root, 0);
    }

    private AstJson convert(Node node, int depth) {
        if (node == null || depth > maxDepth) {
            return null;
        }
        AstJson json = new AstJson();
        json.node = node.kind().displayName();
        json.line = node.position() != null ? node.position().line() : null;

        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Node.Field field : node.fields()) {
            if (field.isScalar()) attributes.put(field.name(), field.value());
        }
        json.attributes = attributes.isEmpty() ? null : attributes;

        json.children = new ArrayList<>();
        for (Node child : node.children()) {
            AstJson converted = convert(child, depth + 1);
            if (converted != null) json.children.add(converted);
        }
        return json;
    }
}
