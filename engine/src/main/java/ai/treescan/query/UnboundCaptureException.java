package ai.treescan.query;

/** A predicate or directive references a capture that its pattern never binds. */
public class UnboundCaptureException extends QueryException {
    private final String captureName;

    public UnboundCaptureException(String captureName, int offset) {
        super("Capture @" + captureName + " is not bound by the pattern", offset);
        this.captureName = captureName;
    }

    public String getCaptureName() {
        return captureName;
    }
}
