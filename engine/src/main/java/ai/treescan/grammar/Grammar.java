package ai.treescan.grammar;

import java.util.List;

/**
 * A parser for one language. Implementations must be safe to call from several threads at once, since a registry hands
 * the same instance to every scan worker.
 */
public interface Grammar {

    /** Registry key, e.g. {@code python}. Compared case-insensitively. */
    String languageId();

    /** File extensions without the leading dot. */
    List<String> extensions();

    /**
     * Parses {@code source}. A tree the grammar recovered from local syntax errors is returned normally and reports the
     * damage through {@link SyntaxTree#errorSpan()}.
     *
     * @throws ParseException if no usable tree could be produced at all
     */
    SyntaxTree parse(String file, String source) throws ParseException;
}
