package ai.treescan.scan;

import ai.treescan.predicate.Captures;
import ai.treescan.predicate.PredicateArgument;
import ai.treescan.predicate.PredicateArgumentException;
import ai.treescan.predicate.PredicateArguments;
import ai.treescan.predicate.PredicateCost;
import ai.treescan.predicate.QueryPredicate;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/** {@code (#secret-name? @name)}: the bound identifier looks like it holds a credential. */
record SecretNamePredicate(String name, String capture) implements QueryPredicate {
    static final String NAME = "secret-name";

    private static final Pattern SECRET_NAME =
            Pattern.compile("(?i)(secret|password|passwd|token|api_?key|private_?key|credential)");

    static QueryPredicate create(String name, List<PredicateArgument> arguments) throws PredicateArgumentException {
        PredicateArguments.requireCount(name, arguments, 1);
        return new SecretNamePredicate(name, PredicateArguments.requireCapture(name, arguments, 0));
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
            if (!SECRET_NAME.matcher(node.text()).find()) {
                return false;
            }
        }
        return true;
    }
}
