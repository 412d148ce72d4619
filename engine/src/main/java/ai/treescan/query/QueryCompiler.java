package ai.treescan.query;

import ai.treescan.predicate.PredicateArgument;
import ai.treescan.predicate.PredicateArgumentException;
import ai.treescan.predicate.PredicateRegistry;
import ai.treescan.predicate.QueryPredicate;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles query text into an immutable {@link Query}. Compilation is deterministic and has no side effects, so one
 * compiler can be shared freely.
 *
 * <p>The text is a list of declarations in tree-sitter query syntax:
 *
 * <pre>
 * ; bare except handlers
 * ((except_clause) @python.bare_except
 *  (#not-has-child? @python.bare_except identifier attribute tuple))
 * </pre>
 *
 * Predicates of a declaration are checked against the registry, their capture arguments must be bound by the same
 * declaration, and they are reordered cheapest first. {@code (#set! key "value")} directives fill in
 * {@link PatternMetadata}.
 */
public final class QueryCompiler {
    private static final Logger logger = LogManager.getLogger(QueryCompiler.class);

    private static final Splitter TAG_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final PredicateRegistry registry;

    public QueryCompiler() {
        this(PredicateRegistry.defaults());
    }

    public QueryCompiler(PredicateRegistry registry) {
        this.registry = registry;
    }

    public PredicateRegistry registry() {
        return registry;
    }

    public Query compile(String text) throws QueryException {
        return compile(text, QueryOptions.named("<inline>"));
    }

    public Query compile(String text, QueryOptions options) throws QueryException {
        var declarations = new PatternParser(text).parse();
        if (declarations.isEmpty()) {
            throw new QuerySyntaxException("Query contains no patterns", 0);
        }
        var patterns = new ArrayList<Pattern>(declarations.size());
        for (var declaration : declarations) {
            patterns.add(compileDeclaration(patterns.size(), declaration));
        }
        logger.debug("Compiled query {} with {} pattern(s)", options.name(), patterns.size());
        return new Query(options.name(), patterns, options.category(), options.tags(), text);
    }

    private Pattern compileDeclaration(int index, PatternParser.Declaration declaration) throws QueryException {
        var captureNames = new LinkedHashSet<String>();
        collectCaptures(declaration.root(), captureNames);

        var predicates = new ArrayList<QueryPredicate>();
        var directives = new ArrayList<PatternParser.Clause>();
        for (var clause : declaration.clauses()) {
            if (clause.directive()) {
                directives.add(clause);
                continue;
            }
            var factory = registry.factory(clause.name())
                    .orElseThrow(() -> new UnknownPredicateException(clause.name(), clause.offset()));
            for (var argument : clause.arguments()) {
                if (argument instanceof PredicateArgument.Capture capture && !captureNames.contains(capture.name())) {
                    throw new UnboundCaptureException(capture.name(), clause.offset());
                }
            }
            try {
                predicates.add(factory.create(clause.name(), clause.arguments()));
            } catch (PredicateArgumentException e) {
                throw new QuerySyntaxException(e.getMessage(), clause.offset());
            }
        }
        // List.sort is stable, so predicates of equal cost keep their written order
        predicates.sort(Comparator.comparing(QueryPredicate::cost));

        var metadata = compileDirectives(directives, captureNames);
        return new Pattern(
                index, declaration.root(), predicates, List.copyOf(captureNames), metadata, declaration.offset());
    }

    private static PatternMetadata compileDirectives(List<PatternParser.Clause> directives, Set<String> captureNames)
            throws QueryException {
        if (directives.isEmpty()) {
            return PatternMetadata.EMPTY;
        }
        String category = null;
        String primary = null;
        String severity = null;
        var tags = new TreeSet<String>();
        for (var directive : directives) {
            if (!directive.name().equals("set")) {
                throw new QuerySyntaxException("Unknown directive #" + directive.name() + "!", directive.offset());
            }
            var arguments = directive.arguments();
            if (arguments.size() != 2) {
                throw new QuerySyntaxException(
                        "#set! takes a key and a value, got " + arguments.size() + " argument(s)", directive.offset());
            }
            String key = literal(arguments.get(0), directive);
            switch (key) {
                case "primary" -> {
                    String capture = arguments.get(1) instanceof PredicateArgument.Capture c
                            ? c.name()
                            : literal(arguments.get(1), directive);
                    if (capture.startsWith("@")) {
                        capture = capture.substring(1);
                    }
                    if (!captureNames.contains(capture)) {
                        throw new UnboundCaptureException(capture, directive.offset());
                    }
                    primary = capture;
                }
                case "category" -> category = literal(arguments.get(1), directive);
                case "severity" -> severity = literal(arguments.get(1), directive);
                case "tags" -> TAG_SPLITTER.split(literal(arguments.get(1), directive)).forEach(tags::add);
                default -> tags.add(key + "=" + literal(arguments.get(1), directive));
            }
        }
        return new PatternMetadata(category, primary, severity, tags);
    }

    private static String literal(PredicateArgument argument, PatternParser.Clause directive)
            throws QuerySyntaxException {
        if (argument instanceof PredicateArgument.Literal literal) {
            return literal.value();
        }
        throw new QuerySyntaxException("#set! expects a literal, found " + argument, directive.offset());
    }

    /** Captures bound by the matcher tree, in order of appearance; captures inside absence assertions never bind. */
    private static void collectCaptures(NodeMatcher matcher, Set<String> out) {
        out.addAll(matcher.captures());
        for (var child : matcher.children()) {
            collectCaptures(child.matcher(), out);
        }
        for (var alternative : matcher.alternatives()) {
            collectCaptures(alternative, out);
        }
    }
}
