package ai.treescan.scan;

import ai.treescan.query.Query;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** The compiled queries to run per language, in the order they were added. */
public final class QuerySet {
    public static final QuerySet EMPTY = builder().build();

    private final Map<String, List<Query>> queriesByLanguage;

    private QuerySet(Map<String, List<Query>> queriesByLanguage) {
        var copy = new LinkedHashMap<String, List<Query>>();
        queriesByLanguage.forEach((language, queries) -> copy.put(language, List.copyOf(queries)));
        this.queriesByLanguage = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static QuerySet of(String languageId, Query... queries) {
        var builder = builder();
        for (var query : queries) {
            builder.add(languageId, query);
        }
        return builder.build();
    }

    public List<Query> forLanguage(String languageId) {
        return queriesByLanguage.getOrDefault(normalize(languageId), List.of());
    }

    public Set<String> languages() {
        return queriesByLanguage.keySet();
    }

    public int size() {
        return queriesByLanguage.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    private static String normalize(String languageId) {
        return languageId.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "QuerySet" + queriesByLanguage;
    }

    public static final class Builder {
        private final Map<String, List<Query>> queries = new LinkedHashMap<>();

        private Builder() {}

        public Builder add(String languageId, Query query) {
            queries.computeIfAbsent(normalize(languageId), k -> new ArrayList<>()).add(query);
            return this;
        }

        public QuerySet build() {
            return new QuerySet(queries);
        }
    }
}
