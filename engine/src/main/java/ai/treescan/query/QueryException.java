package ai.treescan.query;

/** Base class for query text that cannot be compiled. Carries the offset of the offending input. */
public abstract class QueryException extends Exception {
    private final int offset;

    protected QueryException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    /** Character offset into the query text. */
    public int getOffset() {
        return offset;
    }

    @Override
    public String getMessage() {
        return String.format("%s at offset %d", super.getMessage(), offset);
    }
}
