package ai.treescan.grammar;

/** Zero-based row and byte column of a position in a source file. */
public record Point(int row, int column) implements Comparable<Point> {

    public static final Point ORIGIN = new Point(0, 0);

    @Override
    public int compareTo(Point other) {
        int byRow = Integer.compare(row, other.row);
        return byRow != 0 ? byRow : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return "[" + row + ", " + column + "]";
    }
}
