package ai.treescan.predicate;

import java.util.Set;

/**
 * A compiled post-match test over the nodes of a match. Implementations are immutable and shared by every thread that
 * evaluates the owning query.
 */
public interface QueryPredicate {

    /** Clause name without the leading {@code #} and trailing {@code ?}, e.g. {@code not-has-child}. */
    String name();

    PredicateCost cost();

    /** Every capture this predicate reads. */
    Set<String> captureNames();

    /** @throws MissingCaptureException if a referenced capture is not part of {@code captures} */
    boolean test(Captures captures);
}
