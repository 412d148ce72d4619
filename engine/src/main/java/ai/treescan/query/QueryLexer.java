package ai.treescan.query;

import java.util.ArrayList;
import java.util.List;

/** Splits query text into tokens. Comments run from {@code ;} to the end of the line. */
final class QueryLexer {

    enum Type {
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        COLON,
        DOT,
        BANG,
        QUESTION,
        STAR,
        PLUS,
        /** {@code @name}; text is the name. */
        CAPTURE,
        /** {@code "..."}; text is the unescaped content. */
        STRING,
        IDENT,
        /** {@code #name?}; text is the name. */
        PREDICATE,
        /** {@code #name!}; text is the name. */
        DIRECTIVE,
        EOF
    }

    record Token(Type type, String text, int offset) {
        boolean is(Type t) {
            return type == t;
        }

        String describe() {
            return switch (type) {
                case EOF -> "end of query";
                case CAPTURE -> "capture @" + text;
                case STRING -> "string \"" + text + '"';
                case IDENT -> "'" + text + "'";
                case PREDICATE -> "predicate #" + text + "?";
                case DIRECTIVE -> "directive #" + text + "!";
                default -> "'" + text + "'";
            };
        }
    }

    private final String text;
    private int pos;

    QueryLexer(String text) {
        this.text = text;
    }

    List<Token> tokenize() throws QuerySyntaxException {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= text.length()) {
                tokens.add(new Token(Type.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private void skipWhitespaceAndComments() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == ';') {
                while (pos < text.length() && text.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    private Token next() throws QuerySyntaxException {
        int start = pos;
        char c = text.charAt(pos);
        switch (c) {
            case '(':
                return single(Type.LPAREN, start);
            case ')':
                return single(Type.RPAREN, start);
            case '[':
                return single(Type.LBRACKET, start);
            case ']':
                return single(Type.RBRACKET, start);
            case ':':
                return single(Type.COLON, start);
            case '.':
                return single(Type.DOT, start);
            case '!':
                return single(Type.BANG, start);
            case '?':
                return single(Type.QUESTION, start);
            case '*':
                return single(Type.STAR, start);
            case '+':
                return single(Type.PLUS, start);
            case '@':
                return capture(start);
            case '"':
                return string(start);
            case '#':
                return predicate(start);
            default:
                if (isIdentStart(c)) {
                    pos++;
                    while (pos < text.length() && isIdentPart(text.charAt(pos))) {
                        pos++;
                    }
                    return new Token(Type.IDENT, text.substring(start, pos), start);
                }
                throw new QuerySyntaxException("Unexpected character '" + c + "'", start);
        }
    }

    private Token single(Type type, int start) {
        pos++;
        return new Token(type, text.substring(start, pos), start);
    }

    private Token capture(int start) throws QuerySyntaxException {
        pos++;
        int nameStart = pos;
        while (pos < text.length() && isCapturePart(text.charAt(pos))) {
            pos++;
        }
        if (pos == nameStart) {
            throw new QuerySyntaxException("Capture name expected after '@'", start);
        }
        return new Token(Type.CAPTURE, text.substring(nameStart, pos), start);
    }

    private Token string(int start) throws QuerySyntaxException {
        pos++;
        var sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '"') {
                return new Token(Type.STRING, sb.toString(), start);
            }
            if (c == '\\') {
                if (pos >= text.length()) {
                    break;
                }
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '0' -> sb.append('\0');
                    // unknown escapes stay as written so regexes like "\bfoo" survive
                    default -> sb.append('\\').append(escaped);
                }
            } else {
                sb.append(c);
            }
        }
        throw new QuerySyntaxException("Unterminated string", start);
    }

    private Token predicate(int start) throws QuerySyntaxException {
        pos++;
        int nameStart = pos;
        while (pos < text.length() && isPredicatePart(text.charAt(pos))) {
            pos++;
        }
        if (pos == nameStart || pos >= text.length()) {
            throw new QuerySyntaxException("Predicate name expected after '#'", start);
        }
        String name = text.substring(nameStart, pos);
        char suffix = text.charAt(pos);
        if (suffix == '?') {
            pos++;
            return new Token(Type.PREDICATE, name, start);
        }
        if (suffix == '!') {
            pos++;
            return new Token(Type.DIRECTIVE, name, start);
        }
        throw new QuerySyntaxException("Predicate #" + name + " must end with '?' (or '!' for a directive)", start);
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isCapturePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-';
    }

    private static boolean isPredicatePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }
}
