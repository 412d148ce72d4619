package ai.treescan.grammar;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * One node of a {@link SyntaxTree}. Nodes are created by {@link SyntaxTree.Builder} and are read-only once the tree is
 * built; they hold no text of their own and slice it from the owning tree's source on demand.
 */
public final class Node {
    public static final String ERROR_KIND = "ERROR";

    private final SourceText source;
    private final int index;
    private final String kind;
    private final boolean named;
    private final @Nullable String fieldName;
    private final int startByte;
    private final int endByte;
    private final Point startPoint;
    private final Point endPoint;
    private final boolean missing;
    private final @Nullable Node parent;

    private List<Node> children = List.of();
    private boolean subtreeHasError;

    Node(
            SourceText source,
            int index,
            String kind,
            boolean named,
            @Nullable String fieldName,
            int startByte,
            int endByte,
            Point startPoint,
            Point endPoint,
            boolean missing,
            @Nullable Node parent) {
        this.source = source;
        this.index = index;
        this.kind = kind;
        this.named = named;
        this.fieldName = fieldName == null || fieldName.isEmpty() ? null : fieldName;
        this.startByte = startByte;
        this.endByte = endByte;
        this.startPoint = startPoint;
        this.endPoint = endPoint;
        this.missing = missing;
        this.parent = parent;
    }

    void seal(List<Node> children, boolean subtreeHasError) {
        this.children = List.copyOf(children);
        this.subtreeHasError = subtreeHasError;
    }

    public String kind() {
        return kind;
    }

    /** Whether the grammar names this node, as opposed to an anonymous token such as {@code "("} or {@code "except"}. */
    public boolean isNamed() {
        return named;
    }

    /** The field under which this node hangs off its parent, e.g. {@code function} for the callee of a call. */
    public @Nullable String fieldName() {
        return fieldName;
    }

    /** Position of this node in the pre-order enumeration of its tree. */
    public int index() {
        return index;
    }

    public @Nullable Node parent() {
        return parent;
    }

    public List<Node> children() {
        return children;
    }

    public int childCount() {
        return children.size();
    }

    public Node child(int i) {
        return children.get(i);
    }

    public List<Node> namedChildren() {
        var result = new ArrayList<Node>(children.size());
        for (var child : children) {
            if (child.named) {
                result.add(child);
            }
        }
        return result;
    }

    public List<Node> childrenByField(String field) {
        var result = new ArrayList<Node>(1);
        for (var child : children) {
            if (field.equals(child.fieldName)) {
                result.add(child);
            }
        }
        return result;
    }

    public Optional<Node> childByField(String field) {
        for (var child : children) {
            if (field.equals(child.fieldName)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public boolean hasField(String field) {
        return childByField(field).isPresent();
    }

    /** Whether any direct child has one of the given kinds. */
    public boolean hasChildOfKind(Collection<String> kinds) {
        for (var child : children) {
            if (kinds.contains(child.kind)) {
                return true;
            }
        }
        return false;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isError() {
        return ERROR_KIND.equals(kind);
    }

    /** A zero-width node the grammar inserted during error recovery. */
    public boolean isMissing() {
        return missing;
    }

    /** Whether this node or any of its descendants is an error or missing node. */
    public boolean hasError() {
        return subtreeHasError;
    }

    public int startByte() {
        return startByte;
    }

    public int endByte() {
        return endByte;
    }

    public Point startPoint() {
        return startPoint;
    }

    public Point endPoint() {
        return endPoint;
    }

    public Span span() {
        return new Span(source.file(), startByte, endByte, startPoint, endPoint);
    }

    public String text() {
        return source.slice(startByte, endByte);
    }

    /** The token text of a leaf node; empty for interior nodes. */
    public Optional<String> leafText() {
        return children.isEmpty() ? Optional.of(text()) : Optional.empty();
    }

    /** Renders the named structure below this node in tree-sitter's s-expression notation. */
    public String toSExpression() {
        var sb = new StringBuilder();
        appendSExpression(this, sb);
        return sb.toString();
    }

    private static void appendSExpression(Node node, StringBuilder sb) {
        if (node.missing) {
            sb.append("(MISSING ").append(node.kind).append(')');
            return;
        }
        sb.append('(').append(node.kind);
        for (var child : node.children) {
            if (!child.named) {
                continue;
            }
            sb.append(' ');
            if (child.fieldName != null) {
                sb.append(child.fieldName).append(": ");
            }
            appendSExpression(child, sb);
        }
        sb.append(')');
    }

    @Override
    public String toString() {
        return "(" + kind + " " + startPoint + " - " + endPoint + ")";
    }
}
