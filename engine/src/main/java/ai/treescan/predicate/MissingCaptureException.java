package ai.treescan.predicate;

/**
 * A predicate asked for a capture the matched pattern does not declare. The compiler rejects such queries, so this
 * signals an internal defect rather than bad input.
 */
public class MissingCaptureException extends IllegalStateException {
    private final String captureName;

    public MissingCaptureException(String captureName) {
        super("Capture @" + captureName + " is not bound by the matched pattern");
        this.captureName = captureName;
    }

    public String getCaptureName() {
        return captureName;
    }
}
