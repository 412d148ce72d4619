package ai.treescan.grammar;

import java.util.List;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterTypescript;

/** TypeScript without JSX; {@code .tsx} needs the separate TSX grammar. */
public final class TypescriptGrammar extends TreeSitterGrammar {
    public static final String LANGUAGE_ID = "typescript";

    private static final List<String> EXTENSIONS = List.of("ts", "mts", "cts");

    @Override
    public String languageId() {
        return LANGUAGE_ID;
    }

    @Override
    public List<String> extensions() {
        return EXTENSIONS;
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterTypescript();
    }
}
