package ai.treescan.query;

/** How many consecutive siblings a child matcher may consume. */
public enum Quantifier {
    ONE(1, 1, ""),
    OPTIONAL(0, 1, "?"),
    ZERO_OR_MORE(0, Integer.MAX_VALUE, "*"),
    ONE_OR_MORE(1, Integer.MAX_VALUE, "+");

    private final int min;
    private final int max;
    private final String symbol;

    Quantifier(int min, int max, String symbol) {
        this.min = min;
        this.max = max;
        this.symbol = symbol;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isRepeating() {
        return max > 1;
    }
}
