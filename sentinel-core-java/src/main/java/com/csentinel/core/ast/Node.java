package com.csentinel.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base of every AST node.
 *
 * A node owns the nodes reachable through {@link #fields()}. The parent link is
 * not a field: it is a non-owning back reference stamped on during traversal and
 * never walked by structural recursion.
 */
public abstract class Node {

    private static final AtomicLong NEXT_ID = new AtomicLong();

    private final long id = NEXT_ID.incrementAndGet();
    private final SourcePosition position;
    private Node parent;

    protected Node(SourcePosition position) {
        this.position = position;
    }

    public abstract NodeKind kind();

    /** Named attributes in declaration order. Values are scalars, nodes, node lists or null. */
    public abstract List<Field> fields();

    /** Unique for the lifetime of the JVM; visited sets key on this. */
    public long id() { return id; }

    /** May be null for nodes built without a token. */
    public SourcePosition position() { return position; }

    public int line() { return position != null ? position.line() : 0; }

    /** Null until a traversal has passed through the parent. */
    public Node parent() { return parent; }

    public void attachParent(Node parent) {
        this.parent = parent;
    }

    /** Owned child nodes in field order, nulls skipped. */
    public List<Node> children() {
        List<Node> result = new ArrayList<>();
        for (Field field : fields()) {
            Object value = field.value();
            if (value instanceof Node) {
                result.add((Node) value);
            } else if (value instanceof List<?>) {
                for (Object item : (List<?>) value) {
                    if (item instanceof Node) result.add((Node) item);
                }
            }
        }
        return result;
    }

    protected static <T> List<T> listOf(List<T> items) {
        if (items == null || items.isEmpty()) return Collections.emptyList();
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    @Override
    public String toString() {
        return kind().displayName() + "#" + id;
    }

    /** One named attribute of a node. */
    public record Field(String name, Object value) {

        public static Field of(String name, Object value) {
            return new Field(name, value);
        }

        public boolean isScalar() {
            return value != null && !(value instanceof Node) && !(value instanceof List<?>);
        }
    }
}
