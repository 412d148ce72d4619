package ai.treescan.grammar;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A byte range in one source file, together with its row/column end points.
 *
 * @param file the path of the file as supplied by the caller
 * @param startByte inclusive UTF-8 byte offset
 * @param endByte exclusive UTF-8 byte offset
 * @param start zero-based start point
 * @param end zero-based end point
 */
public record Span(String file, int startByte, int endByte, Point start, Point end) {

    public Span {
        if (startByte < 0 || endByte < startByte) {
            throw new IllegalArgumentException("Invalid byte range [" + startByte + ", " + endByte + ")");
        }
    }

    /** One-based line of the start point, the way editors and reports count lines. */
    @JsonIgnore
    public int line() {
        return start.row() + 1;
    }

    @JsonIgnore
    public int length() {
        return endByte - startByte;
    }

    public boolean contains(Span other) {
        return file.equals(other.file) && startByte <= other.startByte && other.endByte <= endByte;
    }

    @Override
    public String toString() {
        return file + ":" + line() + ":" + (start.column() + 1) + " [" + startByte + ", " + endByte + ")";
    }
}
