package ai.treescan.match;

import static ai.treescan.grammar.TestTrees.leaf;
import static ai.treescan.grammar.TestTrees.node;
import static ai.treescan.grammar.TestTrees.tok;
import static org.junit.jupiter.api.Assertions.*;

import ai.treescan.grammar.Node;
import ai.treescan.grammar.SyntaxTree;
import ai.treescan.grammar.TestTrees;
import ai.treescan.predicate.MissingCaptureException;
import ai.treescan.query.Query;
import ai.treescan.query.QueryCompiler;
import ai.treescan.query.QueryException;
import java.util.List;
import org.junit.jupiter.api.Test;

public class MatcherEngineTest {

    private final QueryCompiler compiler = new QueryCompiler();

    /** {@code f(a, b)} followed by {@code g()}. */
    private static final SyntaxTree CALLS = TestTrees.tree(node(
            "module",
            node(
                    "call",
                    leaf("identifier", "f").as("function"),
                    node("argument_list", tok("("), leaf("identifier", "a"), tok(","), leaf("identifier", "b"), tok(")"))
                            .as("arguments")),
            node(
                    "call",
                    leaf("identifier", "g").as("function"),
                    node("argument_list", tok("("), tok(")")).as("arguments"))));

    private Query compile(String text) throws QueryException {
        return compiler.compile(text);
    }

    private static List<CaptureSet> all(Query query, SyntaxTree tree) {
        return MatcherEngine.evaluate(query, tree).toList();
    }

    private static List<String> texts(List<Node> nodes) {
        return nodes.stream().map(Node::text).toList();
    }

    @Test
    void testOneCaptureSetPerMatchingNodeInPreOrder() throws Exception {
        var matches = all(compile("(call) @c"), CALLS);
        assertEquals(2, matches.size());
        assertEquals("f ( a , b )", matches.get(0).root().text());
        assertEquals("g ( )", matches.get(1).root().text());
        assertTrue(matches.get(0).root().startByte() < matches.get(1).root().startByte());
    }

    @Test
    void testSeveralBindingsStillYieldOneCaptureSet() throws Exception {
        var matches = all(compile("(argument_list (identifier) @arg)"), CALLS);
        assertEquals(1, matches.size(), "two candidate bindings at one node, one capture set");
        assertEquals(List.of("a"), texts(matches.get(0).nodes("arg")));
    }

    @Test
    void testEvaluationIsRestartableAndDeterministic() throws Exception {
        var query = compile("(call function: (identifier) @fn (argument_list (identifier)* @args)) @call");
        var first = all(query, CALLS);
        var second = all(query, CALLS);
        assertEquals(first, second);

        var iterator = MatcherEngine.iterator(query, CALLS, CandidateFilter.ACCEPT_ALL);
        assertTrue(iterator.hasNext());
        assertEquals(first.get(0), iterator.next());
        var restarted = MatcherEngine.evaluate(query, CALLS).findFirst().orElseThrow();
        assertEquals(first.get(0), restarted);
    }

    @Test
    void testZeroOrMoreIsGreedyOverNamedSiblings() throws Exception {
        var matches = all(compile("(argument_list (identifier)* @args) @list"), CALLS);
        assertEquals(2, matches.size());
        assertEquals(List.of("a", "b"), texts(matches.get(0).nodes("args")));
        assertEquals(List.of(), matches.get(1).nodes("args"), "an empty repetition still declares the capture");
    }

    @Test
    void testOneOrMoreRequiresAnOccurrence() throws Exception {
        var matches = all(compile("(argument_list (identifier)+ @args)"), CALLS);
        assertEquals(1, matches.size());
        assertEquals(List.of("a", "b"), texts(matches.get(0).nodes("args")));
    }

    @Test
    void testRepetitionBacktracksToLetLaterMatchersSucceed() throws Exception {
        var matches = all(compile("(argument_list (identifier)* @init (identifier) @last)"), CALLS);
        assertEquals(1, matches.size());
        assertEquals(List.of("a"), texts(matches.get(0).nodes("init")));
        assertEquals(List.of("b"), texts(matches.get(0).nodes("last")));
    }

    @Test
    void testOptionalChild() throws Exception {
        var match = all(compile("(argument_list (string)? @s (identifier) @id)"), CALLS).get(0);
        assertTrue(match.nodes("s").isEmpty());
        assertFalse(match.isBound("s"));
        assertEquals("a", match.first("id").orElseThrow().text());
    }

    @Test
    void testAnchors() throws Exception {
        var first = all(compile("(argument_list . (identifier) @x)"), CALLS);
        assertEquals(List.of("a"), texts(first.get(0).nodes("x")));

        var last = all(compile("(argument_list (identifier) @x .)"), CALLS);
        assertEquals(List.of("b"), texts(last.get(0).nodes("x")));

        var adjacent = all(compile("(argument_list (identifier) @x . (identifier) @y)"), CALLS);
        assertEquals(List.of("a"), texts(adjacent.get(0).nodes("x")));
        assertEquals(List.of("b"), texts(adjacent.get(0).nodes("y")));
    }

    @Test
    void testAnchorRejectsMisalignedChild() throws Exception {
        var tree = TestTrees.tree(node("block", leaf("comment", "#c"), leaf("identifier", "x")));
        assertTrue(all(compile("(block . (identifier))"), tree).isEmpty());
        assertEquals(1, all(compile("(block (identifier))"), tree).size());
        assertEquals(1, all(compile("(block . (comment) . (identifier) .)"), tree).size());
    }

    @Test
    void testFieldConstraints() throws Exception {
        var functions = all(compile("(call function: (identifier) @fn)"), CALLS);
        assertEquals(List.of("f", "g"), functions.stream().map(m -> m.nodes("fn").get(0).text()).toList());
        assertTrue(all(compile("(call arguments: (identifier))"), CALLS).isEmpty());
    }

    @Test
    void testAlternationTriesBranchesInOrder() throws Exception {
        var matches = all(compile("(call function: [(attribute) @attr (identifier) @name])"), CALLS);
        assertEquals(2, matches.size());
        assertTrue(matches.get(0).nodes("attr").isEmpty());
        assertEquals(List.of("f"), texts(matches.get(0).nodes("name")));
    }

    @Test
    void testAbsenceAssertions() throws Exception {
        var empty = all(compile("(argument_list !(identifier)) @empty"), CALLS);
        assertEquals(1, empty.size());
        assertEquals("( )", empty.get(0).root().text());

        assertEquals(2, all(compile("(call !type)"), CALLS).size());
        assertTrue(all(compile("(call !function)"), CALLS).isEmpty());
        assertEquals(1, all(compile("(argument_list !\",\")"), CALLS).size());
    }

    @Test
    void testTokensAndAnyWildcard() throws Exception {
        var commas = all(compile("(argument_list \",\" @comma)"), CALLS);
        assertEquals(1, commas.size());
        assertEquals(",", commas.get(0).nodes("comma").get(0).text());
        assertFalse(commas.get(0).nodes("comma").get(0).isNamed());

        var adjacentParens = all(compile("(argument_list \"(\" . \")\")"), CALLS);
        assertEquals(1, adjacentParens.size());
        assertEquals("( )", adjacentParens.get(0).root().text());

        var firstChild = all(compile("(argument_list . _ @first)"), CALLS);
        assertEquals(List.of("(", "("), firstChild.stream().map(m -> m.nodes("first").get(0).text()).toList());
    }

    @Test
    void testNestedMatchesAreAllReported() throws Exception {
        var named = all(compile("(_) @n"), CALLS);
        long namedNodes = CALLS.nodes().stream().filter(Node::isNamed).count();
        assertEquals(namedNodes, named.size());
    }

    @Test
    void testPatternsRunInDeclarationOrderPerNode() throws Exception {
        var query = compile("(identifier) @id\n(call) @call\n(_ (identifier)) @parent");
        var order = all(query, CALLS).stream()
                .map(m -> m.patternIndex() + ":" + m.root().kind())
                .toList();
        assertEquals(
                List.of(
                        "1:call", "2:call", "0:identifier", "2:argument_list", "0:identifier", "0:identifier",
                        "1:call", "2:call", "0:identifier"),
                order);
    }

    @Test
    void testFilterBacktracksIntoAlternativeBindings() throws Exception {
        var query = compile("(argument_list (identifier) @arg)");
        CandidateFilter onlyB = (pattern, captures) -> captures.nodes("arg").get(0).text().equals("b");
        var matches = MatcherEngine.evaluate(query, CALLS, onlyB).toList();
        assertEquals(1, matches.size());
        assertEquals("b", matches.get(0).nodes("arg").get(0).text());

        CandidateFilter none = (pattern, captures) -> false;
        assertEquals(0, MatcherEngine.evaluate(query, CALLS, none).count());
    }

    @Test
    void testMatchAtSingleNode() throws Exception {
        var pattern = compile("(call function: (identifier) @fn)").pattern(0);
        var secondCall = CALLS.root().child(1);
        var match = MatcherEngine.matchAt(pattern, secondCall).orElseThrow();
        assertSame(secondCall, match.root());
        assertEquals("g", match.nodes("fn").get(0).text());
        assertTrue(MatcherEngine.matchAt(pattern, CALLS.root()).isEmpty());
    }

    @Test
    void testUndeclaredCaptureIsAnInternalFault() throws Exception {
        var match = all(compile("(call) @c"), CALLS).get(0);
        assertThrows(MissingCaptureException.class, () -> match.nodes("nope"));
    }

    @Test
    void testStreamIsLazy() throws Exception {
        var query = compile("(identifier) @id");
        var visited = new int[] {0};
        CandidateFilter counting = (pattern, captures) -> {
            visited[0]++;
            return true;
        };
        var first = MatcherEngine.evaluate(query, CALLS, counting).findFirst().orElseThrow();
        assertEquals("f", first.root().text());
        assertEquals(1, visited[0]);
    }

    @Test
    void testRepetitionOverManySiblings() throws Exception {
        var leaves = new TestTrees.T[50_000];
        for (int i = 0; i < leaves.length; i++) {
            leaves[i] = leaf("identifier", "v" + i);
        }
        var wide = TestTrees.tree(node("block", leaves));

        var greedy = all(compile("(block (identifier)+ @ids .) @b"), wide);
        assertEquals(1, greedy.size());
        assertEquals(50_000, greedy.get(0).nodes("ids").size());

        var split = all(compile("(block (identifier)* @init (identifier) @last .)"), wide).get(0);
        assertEquals(49_999, split.nodes("init").size());
        assertEquals(List.of("v49999"), texts(split.nodes("last")));
    }
}
