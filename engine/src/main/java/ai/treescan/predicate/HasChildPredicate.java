package ai.treescan.predicate;

import java.util.List;
import java.util.Set;

/**
 * {@code (#has-child? @a kind ...)} and {@code (#not-has-child? @a kind ...)}: whether a direct child of the node bound
 * to {@code @a} has one of the listed kinds. Unlike an absence assertion inside the pattern, this is checked against
 * whichever node the capture bound, not the pattern root.
 */
record HasChildPredicate(String name, String capture, Set<String> kinds, boolean negated) implements QueryPredicate {

    static QueryPredicate create(String name, List<PredicateArgument> arguments, boolean negated)
            throws PredicateArgumentException {
        String capture = PredicateArguments.requireCapture(name, arguments, 0);
        var kinds = PredicateArguments.requireLiterals(name, arguments, 1);
        return new HasChildPredicate(name, capture, Set.copyOf(kinds), negated);
    }

    @Override
    public PredicateCost cost() {
        return PredicateCost.STRUCTURAL;
    }

    @Override
    public Set<String> captureNames() {
        return Set.of(capture);
    }

    @Override
    public boolean test(Captures captures) {
        for (var node : captures.nodes(capture)) {
            if (node.hasChildOfKind(kinds) == negated) {
                return false;
            }
        }
        return true;
    }
}
