package ai.treescan.predicate;

/** One argument of a predicate clause: either a capture reference or a literal. */
public sealed interface PredicateArgument permits PredicateArgument.Capture, PredicateArgument.Literal {

    /** {@code @name} */
    record Capture(String name) implements PredicateArgument {
        @Override
        public String toString() {
            return "@" + name;
        }
    }

    /** A quoted string or a bare word such as a node kind. */
    record Literal(String value) implements PredicateArgument {
        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }
}
