package ai.treescan.predicate;

import java.util.List;
import java.util.Set;

/** {@code (#any-of? @a "x" "y" ...)} and {@code not-any-of}. */
record AnyOfPredicate(String name, String capture, Set<String> values, boolean negated) implements QueryPredicate {

    static QueryPredicate create(String name, List<PredicateArgument> arguments, boolean negated)
            throws PredicateArgumentException {
        String capture = PredicateArguments.requireCapture(name, arguments, 0);
        var values = PredicateArguments.requireLiterals(name, arguments, 1);
        return new AnyOfPredicate(name, capture, Set.copyOf(values), negated);
    }

    @Override
    public PredicateCost cost() {
        return PredicateCost.EQUALITY;
    }

    @Override
    public Set<String> captureNames() {
        return Set.of(capture);
    }

    @Override
    public boolean test(Captures captures) {
        for (var node : captures.nodes(capture)) {
            if (values.contains(node.text()) == negated) {
                return false;
            }
        }
        return true;
    }
}
