package ai.treescan.match;

import ai.treescan.grammar.Node;
import java.util.ArrayDeque;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Persistent list of capture bindings made so far on one backtracking path. Binding returns a new list and leaves the
 * receiver untouched, so abandoning a branch needs no undo step.
 */
final class Bindings {
    static final Bindings EMPTY = new Bindings(null, null, null);

    private final @Nullable String name;
    private final @Nullable Node node;
    private final @Nullable Bindings next;

    private Bindings(@Nullable String name, @Nullable Node node, @Nullable Bindings next) {
        this.name = name;
        this.node = node;
        this.next = next;
    }

    Bindings bind(List<String> names, Node bound) {
        var result = this;
        for (var captureName : names) {
            result = new Bindings(captureName, bound, result);
        }
        return result;
    }

    /** Visits bindings oldest first. */
    void forEachInOrder(Visitor visitor) {
        var stack = new ArrayDeque<Bindings>();
        for (var b = this; b.next != null; b = b.next) {
            stack.push(b);
        }
        while (!stack.isEmpty()) {
            var b = stack.pop();
            visitor.visit(b.name, b.node);
        }
    }

    interface Visitor {
        void visit(String name, Node node);
    }
}
