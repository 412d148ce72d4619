package ai.treescan.query;

/** Malformed query text, including predicate clauses with the wrong arguments. */
public class QuerySyntaxException extends QueryException {

    public QuerySyntaxException(String message, int offset) {
        super(message, offset);
    }
}
