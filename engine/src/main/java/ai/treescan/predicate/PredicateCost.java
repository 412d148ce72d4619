package ai.treescan.predicate;

/** Relative evaluation cost; the compiler runs cheaper predicates first. */
public enum PredicateCost {
    /** Looks at node kinds only. */
    STRUCTURAL,
    /** Compares bound text against literals. */
    EQUALITY,
    /** Runs a regular expression over bound text. */
    REGEX
}
