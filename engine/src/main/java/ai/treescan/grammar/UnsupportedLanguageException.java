package ai.treescan.grammar;

/** Thrown when no grammar is registered under the requested language identifier. */
public class UnsupportedLanguageException extends GrammarException {
    private final String languageId;

    public UnsupportedLanguageException(String languageId) {
        super("No grammar registered for language '" + languageId + "'");
        this.languageId = languageId;
    }

    public String getLanguageId() {
        return languageId;
    }
}
