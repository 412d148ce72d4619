package ai.treescan.predicate;

/** Thrown by a {@link PredicateFactory} when a clause has the wrong number or kind of arguments. */
public class PredicateArgumentException extends Exception {

    public PredicateArgumentException(String message) {
        super(message);
    }
}
