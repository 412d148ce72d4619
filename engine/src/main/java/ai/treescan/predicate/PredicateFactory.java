package ai.treescan.predicate;

import java.util.List;

/** Builds a {@link QueryPredicate} from the arguments of one {@code (#name? ...)} clause. */
@FunctionalInterface
public interface PredicateFactory {

    QueryPredicate create(String name, List<PredicateArgument> arguments) throws PredicateArgumentException;
}
