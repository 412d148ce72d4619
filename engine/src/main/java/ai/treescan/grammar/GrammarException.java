package ai.treescan.grammar;

/** Base class for failures to turn source text into a {@link SyntaxTree}. */
public abstract class GrammarException extends Exception {

    protected GrammarException(String message) {
        super(message);
    }

    protected GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
