package ai.treescan.grammar;

import java.util.List;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterPython;

public final class PythonGrammar extends TreeSitterGrammar {
    public static final String LANGUAGE_ID = "python";

    private static final List<String> EXTENSIONS = List.of("py", "pyi");

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
        return new TreeSitterPython();
    }
}
