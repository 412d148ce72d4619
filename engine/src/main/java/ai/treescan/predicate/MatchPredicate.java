package ai.treescan.predicate;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * {@code (#match? @a "regex")} and {@code not-match}. Uses {@link java.util.regex.Matcher#find()}, so the expression
 * must be anchored to require a whole-text match.
 */
record MatchPredicate(String name, String capture, Pattern regex, boolean negated) implements QueryPredicate {

    static QueryPredicate create(String name, List<PredicateArgument> arguments, boolean negated)
            throws PredicateArgumentException {
        PredicateArguments.requireCount(name, arguments, 2);
        String capture = PredicateArguments.requireCapture(name, arguments, 0);
        String source = PredicateArguments.requireLiteral(name, arguments, 1);
        try {
            return new MatchPredicate(name, capture, Pattern.compile(source), negated);
        } catch (PatternSyntaxException e) {
            throw new PredicateArgumentException(
                    "#" + name + "? has an invalid regular expression: " + e.getDescription());
        }
    }

    @Override
    public PredicateCost cost() {
        return PredicateCost.REGEX;
    }

    @Override
    public Set<String> captureNames() {
        return Set.of(capture);
    }

    @Override
    public boolean test(Captures captures) {
        for (var node : captures.nodes(capture)) {
            if (regex.matcher(node.text()).find() == negated) {
                return false;
            }
        }
        return true;
    }
}
