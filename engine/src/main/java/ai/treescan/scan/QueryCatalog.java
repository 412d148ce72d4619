package ai.treescan.scan;

import ai.treescan.predicate.PredicateRegistry;
import ai.treescan.query.Query;
import ai.treescan.query.QueryCompiler;
import ai.treescan.query.QueryException;
import ai.treescan.query.QueryOptions;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The queries bundled with the engine, stored as {@code queries/<language>/<name>.scm} resources.
 *
 * <p>Bundled queries may use {@code #secret-name?} on top of the default predicates. A query file that fails to compile
 * is logged and skipped; the other files still load.
 */
public final class QueryCatalog {
    private static final Logger logger = LogManager.getLogger(QueryCatalog.class);

    private static final Map<String, List<String>> BUNDLED = bundled();

    private static final PredicateRegistry PREDICATES = PredicateRegistry.defaults().toBuilder()
            .register(SecretNamePredicate.NAME, SecretNamePredicate::create)
            .build();

    private QueryCatalog() {}

    private static Map<String, List<String>> bundled() {
        var map = new LinkedHashMap<String, List<String>>();
        map.put("python", List.of("patterns", "security", "comments"));
        map.put("typescript", List.of("patterns", "comments"));
        return map;
    }

    /** Default predicates plus the ones bundled queries rely on. */
    public static PredicateRegistry predicates() {
        return PREDICATES;
    }

    public static QueryCompiler compiler() {
        return new QueryCompiler(PREDICATES);
    }

    public static QuerySet load(ScanConfig config) {
        return load(config.catalogLanguages());
    }

    public static QuerySet load(Collection<String> languages) {
        var compiler = compiler();
        var builder = QuerySet.builder();
        for (var language : languages) {
            var normalized = language.trim().toLowerCase(Locale.ROOT);
            var names = BUNDLED.get(normalized);
            if (names == null) {
                logger.warn("No bundled queries for language '{}'", language);
                continue;
            }
            for (var name : names) {
                load(compiler, normalized, name).ifPresent(query -> builder.add(normalized, query));
            }
        }
        var set = builder.build();
        logger.debug("Loaded {} bundled quer(ies) for {}", set.size(), set.languages());
        return set;
    }

    /** Compiles one bundled query; empty if it is missing or does not compile. */
    static Optional<Query> load(QueryCompiler compiler, String language, String name) {
        var path = resourcePath(language, name);
        String text;
        try {
            text = loadResource(path);
        } catch (UncheckedIOException e) {
            logger.warn("Skipping bundled query {}: {}", path, e.getCause().getMessage());
            return Optional.empty();
        }
        try {
            return Optional.of(compiler.compile(text, QueryOptions.named(language + "/" + name)));
        } catch (QueryException e) {
            logger.warn("Skipping bundled query {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    public static String resourcePath(String language, String name) {
        return "queries/" + language + "/" + name + ".scm";
    }

    static String loadResource(String path) {
        try (InputStream in = QueryCatalog.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) throw new IOException("Resource not found: " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
