package ai.treescan.grammar;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable concrete syntax tree of one source file. Node order is the grammar's child order, and {@link #nodes()}
 * enumerates them root first, depth first.
 */
public final class SyntaxTree {
    private final String languageId;
    private final SourceText source;
    private final Node root;
    private final List<Node> nodes;
    private final @Nullable Span errorSpan;

    private SyntaxTree(String languageId, SourceText source, Node root, List<Node> nodes, @Nullable Span errorSpan) {
        this.languageId = languageId;
        this.source = source;
        this.root = root;
        this.nodes = nodes;
        this.errorSpan = errorSpan;
    }

    public static Builder builder(String languageId, String file, String text) {
        return new Builder(languageId, new SourceText(file, text));
    }

    public String languageId() {
        return languageId;
    }

    public String file() {
        return source.file();
    }

    public SourceText source() {
        return source;
    }

    public Node root() {
        return root;
    }

    /** All nodes in pre-order; {@code nodes().get(n.index()) == n}. */
    public List<Node> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean hasErrors() {
        return root.hasError();
    }

    /** Span of the error or missing node that ends furthest into the file, if the grammar had to recover. */
    public Optional<Span> errorSpan() {
        return Optional.ofNullable(errorSpan);
    }

    @Override
    public String toString() {
        return "SyntaxTree[" + languageId + ", " + source.file() + ", " + nodes.size() + " nodes]";
    }

    /**
     * Assembles a tree from a depth-first walk: every {@link #open} is matched by a {@link #close}, and nodes opened
     * while another node is open become its children in call order.
     */
    public static final class Builder {
        private final String languageId;
        private final SourceText source;
        private final Deque<OpenNode> open = new ArrayDeque<>();
        private final List<Node> nodes = new ArrayList<>();
        private @Nullable Node root;
        private @Nullable Span errorSpan;

        private static final class OpenNode {
            final Node node;
            final List<Node> children = new ArrayList<>();
            boolean subtreeHasError;

            OpenNode(Node node) {
                this.node = node;
            }
        }

        private Builder(String languageId, SourceText source) {
            this.languageId = languageId;
            this.source = source;
        }

        public Builder open(
                String kind,
                boolean named,
                @Nullable String fieldName,
                int startByte,
                int endByte,
                Point start,
                Point end,
                boolean missing) {
            if (root != null && open.isEmpty()) {
                throw new IllegalStateException("Tree already has a root: " + root);
            }
            var parent = open.peek();
            var node = new Node(
                    source,
                    nodes.size(),
                    kind,
                    named,
                    fieldName,
                    startByte,
                    endByte,
                    start,
                    end,
                    missing,
                    parent == null ? null : parent.node);
            nodes.add(node);
            if (parent == null) {
                root = node;
            } else {
                parent.children.add(node);
            }
            open.push(new OpenNode(node));
            return this;
        }

        public Builder close() {
            var top = open.pop();
            var node = top.node;
            boolean selfError = node.isError() || node.isMissing();
            if (selfError) {
                recordError(node.span());
            }
            boolean subtreeHasError = selfError || top.subtreeHasError;
            node.seal(top.children, subtreeHasError);
            var parent = open.peek();
            if (parent != null && subtreeHasError) {
                parent.subtreeHasError = true;
            }
            return this;
        }

        public Builder leaf(String kind, boolean named, @Nullable String fieldName, int startByte, int endByte, Point start, Point end) {
            return open(kind, named, fieldName, startByte, endByte, start, end, false).close();
        }

        private void recordError(Span span) {
            if (errorSpan == null
                    || span.endByte() > errorSpan.endByte()
                    || (span.endByte() == errorSpan.endByte() && span.startByte() > errorSpan.startByte())) {
                errorSpan = span;
            }
        }

        public SyntaxTree build() {
            if (!open.isEmpty()) {
                throw new IllegalStateException(open.size() + " node(s) still open: " + open.peek().node);
            }
            if (root == null) {
                throw new IllegalStateException("Tree has no root node");
            }
            return new SyntaxTree(languageId, source, root, List.copyOf(nodes), errorSpan);
        }
    }
}
