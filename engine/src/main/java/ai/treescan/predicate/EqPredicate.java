package ai.treescan.predicate;

import ai.treescan.grammar.Node;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * {@code (#eq? @a "text")} / {@code (#eq? @a @b)} and their {@code not-eq} forms. Compares the exact text of every node
 * bound to {@code @a}.
 */
record EqPredicate(String name, String capture, @Nullable String literal, @Nullable String otherCapture, boolean negated)
        implements QueryPredicate {

    static QueryPredicate create(String name, List<PredicateArgument> arguments, boolean negated)
            throws PredicateArgumentException {
        PredicateArguments.requireCount(name, arguments, 2);
        String capture = PredicateArguments.requireCapture(name, arguments, 0);
        if (arguments.get(1) instanceof PredicateArgument.Capture other) {
            return new EqPredicate(name, capture, null, other.name(), negated);
        }
        return new EqPredicate(name, capture, PredicateArguments.requireLiteral(name, arguments, 1), null, negated);
    }

    @Override
    public PredicateCost cost() {
        return PredicateCost.EQUALITY;
    }

    @Override
    public Set<String> captureNames() {
        return otherCapture == null ? Set.of(capture) : Set.of(capture, otherCapture);
    }

    @Override
    public boolean test(Captures captures) {
        List<Node> nodes = captures.nodes(capture);
        String expected = literal;
        if (otherCapture != null) {
            List<Node> other = captures.nodes(otherCapture);
            if (other.isEmpty()) {
                return true;
            }
            expected = other.get(0).text();
        }
        for (var node : nodes) {
            if (node.text().equals(expected) == negated) {
                return false;
            }
        }
        return true;
    }
}
