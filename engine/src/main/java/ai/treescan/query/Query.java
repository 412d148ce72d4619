package ai.treescan.query;

import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * A compiled, immutable query. Compiled once by {@link QueryCompiler} and evaluated against any number of trees, from
 * any number of threads.
 */
public record Query(String name, List<Pattern> patterns, @Nullable String category, Set<String> tags, String text) {

    public Query {
        patterns = List.copyOf(patterns);
        tags = Set.copyOf(tags);
    }

    public Pattern pattern(int index) {
        return patterns.get(index);
    }

    public int patternCount() {
        return patterns.size();
    }

    @Override
    public String toString() {
        return "Query[" + name + ", " + patterns.size() + " pattern(s)]";
    }
}
