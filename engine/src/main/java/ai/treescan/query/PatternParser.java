package ai.treescan.query;

import ai.treescan.predicate.PredicateArgument;
import ai.treescan.query.QueryLexer.Token;
import ai.treescan.query.QueryLexer.Type;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Recursive-descent parser from query text to uncompiled declarations. Predicate clauses are collected but not yet
 * resolved; {@link QueryCompiler} checks their names and captures.
 */
final class PatternParser {

    /** A predicate or directive clause as written. */
    record Clause(String name, boolean directive, List<PredicateArgument> arguments, int offset) {}

    /** One top-level pattern with the clauses attached to it. */
    record Declaration(NodeMatcher root, List<Clause> clauses, int offset) {}

    private final List<Token> tokens;
    private int pos;
    private int negationDepth;

    PatternParser(String text) throws QuerySyntaxException {
        this.tokens = new QueryLexer(text).tokenize();
    }

    List<Declaration> parse() throws QuerySyntaxException {
        var declarations = new ArrayList<Declaration>();
        List<Clause> lastClauses = null;
        while (!peek().is(Type.EOF)) {
            if (isClauseStart()) {
                if (lastClauses == null) {
                    throw syntax("Predicate clause before any pattern", peek());
                }
                lastClauses.add(parseClause());
            } else if (peek().is(Type.LPAREN) && isGroupStart(peek(1))) {
                var declaration = parseGroup();
                declarations.add(declaration);
                lastClauses = declaration.clauses();
            } else {
                int offset = peek().offset();
                var clauses = new ArrayList<Clause>();
                var root = parseTopLevelPattern(clauses);
                declarations.add(new Declaration(root, clauses, offset));
                lastClauses = clauses;
            }
        }
        return declarations;
    }

    /** {@code ((pattern) clause*)}: a single pattern grouped with its predicates. */
    private Declaration parseGroup() throws QuerySyntaxException {
        var open = expect(Type.LPAREN);
        var clauses = new ArrayList<Clause>();
        var root = parseTopLevelPattern(clauses);
        while (!peek().is(Type.RPAREN)) {
            if (isClauseStart()) {
                clauses.add(parseClause());
            } else if (peek().is(Type.EOF)) {
                throw syntax("Unclosed group", open);
            } else {
                throw syntax("Sibling sequences are not supported; a group holds one pattern", peek());
            }
        }
        expect(Type.RPAREN);
        var outer = parseCaptures();
        if (!outer.isEmpty()) {
            var captures = new ArrayList<>(root.captures());
            captures.addAll(outer);
            root = root.withCaptures(captures);
        }
        return new Declaration(root, clauses, open.offset());
    }

    private NodeMatcher parseTopLevelPattern(List<Clause> clauses) throws QuerySyntaxException {
        var matcher = parsePrimary(clauses);
        if (isQuantifier(peek())) {
            throw syntax("Quantifiers are not allowed on a top-level pattern", peek());
        }
        return matcher.withCaptures(parseCaptures());
    }

    private NodeMatcher parsePrimary(List<Clause> clauses) throws QuerySyntaxException {
        var token = peek();
        switch (token.type()) {
            case LPAREN:
                return parseNode(clauses);
            case LBRACKET:
                return parseAlternation(clauses);
            case STRING:
                advance();
                return leaf(NodeMatcher.Shape.TOKEN, token.text(), token.offset());
            case IDENT:
                if (token.text().equals("_")) {
                    advance();
                    return leaf(NodeMatcher.Shape.ANY, null, token.offset());
                }
                throw syntax("Bare identifier " + token.describe() + "; node patterns are written (" + token.text() + ")",
                        token);
            default:
                throw syntax("Expected a pattern but found " + token.describe(), token);
        }
    }

    private NodeMatcher parseNode(List<Clause> clauses) throws QuerySyntaxException {
        var open = expect(Type.LPAREN);
        var head = peek();
        if (head.is(Type.PREDICATE) || head.is(Type.DIRECTIVE)) {
            throw syntax("Predicate clause where a pattern was expected", head);
        }
        if (head.is(Type.RPAREN)) {
            throw syntax("Empty pattern", open);
        }
        if (!head.is(Type.IDENT)) {
            throw syntax("Expected a node kind but found " + head.describe(), head);
        }
        advance();
        var shape = head.text().equals("_") ? NodeMatcher.Shape.NAMED_WILDCARD : NodeMatcher.Shape.KIND;
        var kind = shape == NodeMatcher.Shape.KIND ? head.text() : null;

        var children = new ArrayList<ChildMatcher>();
        var absentFields = new ArrayList<String>();
        var absentChildren = new ArrayList<NodeMatcher>();
        boolean anchoredEnd = false;
        boolean pendingAnchor = false;
        while (true) {
            var token = peek();
            if (token.is(Type.RPAREN)) {
                if (pendingAnchor) {
                    anchoredEnd = true;
                }
                advance();
                break;
            }
            switch (token.type()) {
                case EOF -> throw syntax("Unclosed pattern (" + head.text(), open);
                case DOT -> {
                    if (pendingAnchor) {
                        throw syntax("Repeated anchor", token);
                    }
                    advance();
                    pendingAnchor = true;
                }
                case BANG -> {
                    if (pendingAnchor) {
                        throw syntax("An anchor cannot precede an absence assertion", token);
                    }
                    advance();
                    parseAbsence(absentFields, absentChildren);
                }
                default -> {
                    if (isClauseStart()) {
                        if (pendingAnchor) {
                            throw syntax("An anchor cannot precede a predicate clause", token);
                        }
                        if (negationDepth > 0) {
                            throw syntax("Predicates are not allowed inside an absence assertion", token);
                        }
                        clauses.add(parseClause());
                    } else {
                        children.add(parseChild(clauses, pendingAnchor));
                        pendingAnchor = false;
                    }
                }
            }
        }
        return new NodeMatcher(
                shape, kind, children, anchoredEnd, absentFields, absentChildren, List.of(), List.of(), open.offset());
    }

    private void parseAbsence(List<String> absentFields, List<NodeMatcher> absentChildren)
            throws QuerySyntaxException {
        var token = peek();
        if (token.is(Type.IDENT) && !token.text().equals("_")) {
            if (peek(1).is(Type.COLON)) {
                throw syntax("Negated fields are written !" + token.text() + " without a child pattern", token);
            }
            advance();
            absentFields.add(token.text());
            return;
        }
        negationDepth++;
        try {
            var discarded = new ArrayList<Clause>();
            var matcher = parsePrimary(discarded);
            if (isQuantifier(peek())) {
                throw syntax("Quantifiers are not allowed inside an absence assertion", peek());
            }
            parseCaptures();
            absentChildren.add(matcher);
        } finally {
            negationDepth--;
        }
    }

    private ChildMatcher parseChild(List<Clause> clauses, boolean anchored) throws QuerySyntaxException {
        String field = null;
        if (peek().is(Type.IDENT) && peek(1).is(Type.COLON)) {
            field = advance().text();
            advance();
        }
        var matcher = parsePrimary(clauses);
        var quantifier = parseQuantifier();
        matcher = matcher.withCaptures(parseCaptures());
        return new ChildMatcher(matcher, field, quantifier, anchored);
    }

    private NodeMatcher parseAlternation(List<Clause> clauses) throws QuerySyntaxException {
        var open = expect(Type.LBRACKET);
        var alternatives = new ArrayList<NodeMatcher>();
        while (!peek().is(Type.RBRACKET)) {
            if (peek().is(Type.EOF)) {
                throw syntax("Unclosed alternation", open);
            }
            var alternative = parsePrimary(clauses);
            if (isQuantifier(peek())) {
                throw syntax("Quantify the whole alternation instead of one branch", peek());
            }
            alternatives.add(alternative.withCaptures(parseCaptures()));
        }
        advance();
        if (alternatives.isEmpty()) {
            throw syntax("Empty alternation", open);
        }
        return new NodeMatcher(
                NodeMatcher.Shape.ALTERNATION,
                null,
                List.of(),
                false,
                List.of(),
                List.of(),
                alternatives,
                List.of(),
                open.offset());
    }

    private Clause parseClause() throws QuerySyntaxException {
        expect(Type.LPAREN);
        var head = advance();
        boolean directive = head.is(Type.DIRECTIVE);
        var arguments = new ArrayList<PredicateArgument>();
        while (!peek().is(Type.RPAREN)) {
            var token = advance();
            switch (token.type()) {
                case CAPTURE -> arguments.add(new PredicateArgument.Capture(token.text()));
                case STRING, IDENT -> arguments.add(new PredicateArgument.Literal(token.text()));
                case EOF -> throw syntax("Unclosed predicate #" + head.text(), head);
                default -> throw syntax("Unexpected " + token.describe() + " in predicate #" + head.text(), token);
            }
        }
        advance();
        return new Clause(head.text(), directive, arguments, head.offset());
    }

    private List<String> parseCaptures() throws QuerySyntaxException {
        List<String> captures = List.of();
        while (peek().is(Type.CAPTURE)) {
            var token = advance();
            if (negationDepth > 0) {
                throw syntax("Captures are not allowed inside an absence assertion", token);
            }
            if (captures.isEmpty()) {
                captures = new ArrayList<>();
            }
            if (!captures.contains(token.text())) {
                captures.add(token.text());
            }
        }
        return captures;
    }

    private Quantifier parseQuantifier() {
        var token = peek();
        Quantifier quantifier = switch (token.type()) {
            case QUESTION -> Quantifier.OPTIONAL;
            case STAR -> Quantifier.ZERO_OR_MORE;
            case PLUS -> Quantifier.ONE_OR_MORE;
            default -> Quantifier.ONE;
        };
        if (quantifier != Quantifier.ONE) {
            advance();
        }
        return quantifier;
    }

    private static NodeMatcher leaf(NodeMatcher.Shape shape, @Nullable String kind, int offset) {
        return new NodeMatcher(shape, kind, List.of(), false, List.of(), List.of(), List.of(), List.of(), offset);
    }

    private boolean isClauseStart() {
        return peek().is(Type.LPAREN) && (peek(1).is(Type.PREDICATE) || peek(1).is(Type.DIRECTIVE));
    }

    private static boolean isGroupStart(Token token) {
        return token.is(Type.LPAREN) || token.is(Type.LBRACKET) || token.is(Type.STRING);
    }

    private static boolean isQuantifier(Token token) {
        return token.is(Type.QUESTION) || token.is(Type.STAR) || token.is(Type.PLUS);
    }

    private Token peek() {
        return peek(0);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private Token advance() {
        var token = peek();
        if (!token.is(Type.EOF)) {
            pos++;
        }
        return token;
    }

    private Token expect(Type type) throws QuerySyntaxException {
        var token = peek();
        if (!token.is(type)) {
            throw syntax("Expected " + type.name().toLowerCase() + " but found " + token.describe(), token);
        }
        return advance();
    }

    private static QuerySyntaxException syntax(String message, Token at) {
        return new QuerySyntaxException(message, at.offset());
    }
}
