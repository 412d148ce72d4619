package ai.treescan.query;

import ai.treescan.predicate.QueryPredicate;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One top-level declaration of a query: a matcher tree, the predicates that filter its matches, and its reporting
 * metadata.
 *
 * @param index position of the declaration within its query
 * @param root matcher for the node a match is rooted at
 * @param predicates post-match tests, cheapest first
 * @param captureNames every capture the matcher tree binds, in order of first appearance
 * @param metadata values set by directives
 * @param offset position of the declaration in the query text
 */
public record Pattern(
        int index,
        NodeMatcher root,
        List<QueryPredicate> predicates,
        List<String> captureNames,
        PatternMetadata metadata,
        int offset) {

    public Pattern {
        predicates = List.copyOf(predicates);
        captureNames = List.copyOf(captureNames);
    }

    public boolean binds(String captureName) {
        return captureNames.contains(captureName);
    }

    public Set<String> predicateNames() {
        return predicates.stream().map(QueryPredicate::name).collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
