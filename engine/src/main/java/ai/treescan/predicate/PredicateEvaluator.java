package ai.treescan.predicate;

import java.util.List;

/** Applies a compiled predicate list to the captures of one match. */
public final class PredicateEvaluator {

    private PredicateEvaluator() {}

    /**
     * Logical AND over {@code predicates} in list order, stopping at the first failure. Compiled queries keep their
     * predicates sorted by {@link PredicateCost}, so cheap tests run first.
     *
     * @throws MissingCaptureException if a predicate reads a capture the match does not declare
     */
    public static boolean accept(List<? extends QueryPredicate> predicates, Captures captures) {
        for (var predicate : predicates) {
            if (!predicate.test(captures)) {
                return false;
            }
        }
        return true;
    }
}
