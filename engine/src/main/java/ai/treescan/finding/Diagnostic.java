package ai.treescan.finding;

import ai.treescan.grammar.Span;
import org.jetbrains.annotations.Nullable;

/**
 * A file-level problem reported next to the findings of a scan.
 *
 * @param span where the problem was detected, if it has a location
 */
public record Diagnostic(Kind kind, String file, @Nullable Span span, String message) {

    public enum Kind {
        /** The file parsed with errors; findings for it may be incomplete. */
        PARSE_ERROR,
        UNSUPPORTED_LANGUAGE,
        READ_ERROR
    }

    public static Diagnostic parseError(String file, @Nullable Span span, String message) {
        return new Diagnostic(Kind.PARSE_ERROR, file, span, message);
    }

    public static Diagnostic unsupportedLanguage(String file, String message) {
        return new Diagnostic(Kind.UNSUPPORTED_LANGUAGE, file, null, message);
    }

    public static Diagnostic readError(String file, String message) {
        return new Diagnostic(Kind.READ_ERROR, file, null, message);
    }

    @Override
    public String toString() {
        return kind + " " + (span == null ? file : span.toString()) + ": " + message;
    }
}
