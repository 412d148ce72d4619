package ai.treescan.predicate;

import java.util.ArrayList;
import java.util.List;

/** Argument checks shared by predicate factories. */
public final class PredicateArguments {

    private PredicateArguments() {}

    public static String requireCapture(String predicate, List<PredicateArgument> arguments, int position)
            throws PredicateArgumentException {
        if (arguments.size() <= position) {
            throw new PredicateArgumentException(
                    "#" + predicate + "? expects a capture as argument " + (position + 1) + " but got " + arguments.size()
                            + " argument(s)");
        }
        if (arguments.get(position) instanceof PredicateArgument.Capture capture) {
            return capture.name();
        }
        throw new PredicateArgumentException("#" + predicate + "? expects a capture as argument " + (position + 1)
                + ", found " + arguments.get(position));
    }

    public static String requireLiteral(String predicate, List<PredicateArgument> arguments, int position)
            throws PredicateArgumentException {
        if (arguments.size() <= position) {
            throw new PredicateArgumentException(
                    "#" + predicate + "? expects a literal as argument " + (position + 1));
        }
        if (arguments.get(position) instanceof PredicateArgument.Literal literal) {
            return literal.value();
        }
        throw new PredicateArgumentException("#" + predicate + "? expects a literal as argument " + (position + 1)
                + ", found " + arguments.get(position));
    }

    /** Literals from {@code from} to the end; at least one is required. */
    public static List<String> requireLiterals(String predicate, List<PredicateArgument> arguments, int from)
            throws PredicateArgumentException {
        if (arguments.size() <= from) {
            throw new PredicateArgumentException("#" + predicate + "? expects at least one literal after the capture");
        }
        var values = new ArrayList<String>(arguments.size() - from);
        for (int i = from; i < arguments.size(); i++) {
            values.add(requireLiteral(predicate, arguments, i));
        }
        return values;
    }

    public static void requireCount(String predicate, List<PredicateArgument> arguments, int count)
            throws PredicateArgumentException {
        if (arguments.size() != count) {
            throw new PredicateArgumentException(
                    "#" + predicate + "? takes " + count + " argument(s), got " + arguments.size());
        }
    }
}
