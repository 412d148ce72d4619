package ai.treescan.query;

/** A predicate clause names a predicate the compiler's registry does not know. */
public class UnknownPredicateException extends QueryException {
    private final String predicateName;

    public UnknownPredicateException(String predicateName, int offset) {
        super("Unknown predicate #" + predicateName + "?", offset);
        this.predicateName = predicateName;
    }

    public String getPredicateName() {
        return predicateName;
    }
}
