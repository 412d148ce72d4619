package ai.treescan.grammar;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a grammar cannot produce any usable tree for a file. Recovered trees with local errors are not reported
 * this way; see {@link SyntaxTree#errorSpan()}.
 */
public class ParseException extends GrammarException {
    private final String file;
    private final @Nullable Span span;

    public ParseException(String message, String file, @Nullable Span span) {
        super(message);
        this.file = file;
        this.span = span;
    }

    public ParseException(String message, Throwable cause, String file) {
        super(message, cause);
        this.file = file;
        this.span = null;
    }

    public String getFile() {
        return file;
    }

    /** The furthest error span, when the grammar got far enough to report one. */
    public @Nullable Span getSpan() {
        return span;
    }

    @Override
    public String getMessage() {
        return span == null
                ? String.format("Parsing failed for file %s: %s", file, super.getMessage())
                : String.format("Parsing failed for file %s at %s: %s", file, span, super.getMessage());
    }
}
