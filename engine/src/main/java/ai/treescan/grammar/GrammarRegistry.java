package ai.treescan.grammar;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Maps language identifiers to grammars. A registry is assembled once through {@link Builder} before any parsing starts
 * and is read-only afterwards, so it can be shared by every scan worker without locking.
 */
public final class GrammarRegistry {
    private static final Logger logger = LogManager.getLogger(GrammarRegistry.class);

    private final Map<String, Grammar> grammarsById;
    private final Map<String, String> languageIdByExtension;

    private GrammarRegistry(Map<String, Grammar> grammarsById, Map<String, String> languageIdByExtension) {
        this.grammarsById = Map.copyOf(grammarsById);
        this.languageIdByExtension = Map.copyOf(languageIdByExtension);
    }

    /** Registry with every grammar shipped with the engine. */
    public static GrammarRegistry defaults() {
        return builder().register(new PythonGrammar()).register(new TypescriptGrammar()).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses {@code source} with the grammar registered for {@code languageId}.
     *
     * @throws UnsupportedLanguageException if no grammar is registered under that id
     * @throws ParseException if the grammar cannot produce any usable tree
     */
    public SyntaxTree parse(String languageId, String file, String source)
            throws UnsupportedLanguageException, ParseException {
        return grammar(languageId).parse(file, source);
    }

    public Grammar grammar(String languageId) throws UnsupportedLanguageException {
        var grammar = grammarsById.get(normalize(languageId));
        if (grammar == null) {
            throw new UnsupportedLanguageException(languageId);
        }
        return grammar;
    }

    public boolean supports(String languageId) {
        return grammarsById.containsKey(normalize(languageId));
    }

    public Set<String> languageIds() {
        return grammarsById.keySet();
    }

    /** Resolves a file path to a registered language by its extension. */
    public Optional<String> languageForPath(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        int dot = path.lastIndexOf('.');
        if (dot <= slash + 1 || dot == path.length() - 1) {
            return Optional.empty();
        }
        return languageForExtension(path.substring(dot + 1));
    }

    public Optional<String> languageForExtension(String extension) {
        if (extension.isEmpty()) {
            return Optional.empty();
        }
        String lowerExt = extension.toLowerCase(Locale.ROOT);
        // Ensure the extension does not start with a dot for consistent matching.
        String normalizedExt = lowerExt.startsWith(".") ? lowerExt.substring(1) : lowerExt;
        return Optional.ofNullable(languageIdByExtension.get(normalizedExt));
    }

    private static String normalize(String languageId) {
        return languageId.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<String, Grammar> grammarsById = new LinkedHashMap<>();
        private final Map<String, String> languageIdByExtension = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(Grammar grammar) {
            String id = normalize(grammar.languageId());
            if (id.isEmpty()) {
                throw new IllegalArgumentException("Grammar " + grammar + " has a blank language id");
            }
            if (grammarsById.putIfAbsent(id, grammar) != null) {
                throw new IllegalArgumentException("A grammar is already registered for '" + id + "'");
            }
            for (String ext : grammar.extensions()) {
                String normalizedExt = ext.toLowerCase(Locale.ROOT);
                if (normalizedExt.startsWith(".")) {
                    normalizedExt = normalizedExt.substring(1);
                }
                var previous = languageIdByExtension.putIfAbsent(normalizedExt, id);
                if (previous != null) {
                    logger.warn("Extension .{} already maps to {}; ignoring it for {}", normalizedExt, previous, id);
                }
            }
            return this;
        }

        public GrammarRegistry build() {
            logger.debug("Grammar registry built with languages {}", grammarsById.keySet());
            return new GrammarRegistry(grammarsById, languageIdByExtension);
        }
    }
}
