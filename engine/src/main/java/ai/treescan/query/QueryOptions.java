package ai.treescan.query;

import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Compile-time settings that apply to every pattern of a query.
 *
 * @param name label used in logs and diagnostics, e.g. the resource the text came from
 * @param category default finding category for patterns that do not set one
 * @param tags tags attached to every finding of the query
 */
public record QueryOptions(String name, @Nullable String category, Set<String> tags) {

    public QueryOptions {
        tags = Set.copyOf(tags);
    }

    public static QueryOptions named(String name) {
        return new QueryOptions(name, null, Set.of());
    }

    public QueryOptions withCategory(String newCategory) {
        return new QueryOptions(name, newCategory, tags);
    }

    public QueryOptions withTags(Set<String> newTags) {
        return new QueryOptions(name, category, newTags);
    }
}
