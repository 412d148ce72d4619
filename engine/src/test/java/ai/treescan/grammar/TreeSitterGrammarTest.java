package ai.treescan.grammar;

import static ai.treescan.grammar.TestTrees.leaf;
import static ai.treescan.grammar.TestTrees.node;
import static ai.treescan.grammar.TestTrees.tok;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.junit.jupiter.api.Test;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterPython;

public class TreeSitterGrammarTest {

    private final GrammarRegistry registry = GrammarRegistry.defaults();

    private static Node first(SyntaxTree tree, String kind, String text) {
        return tree.nodes().stream()
                .filter(n -> n.kind().equals(kind) && n.text().equals(text))
                .findFirst()
                .orElseThrow(() ->
                        new AssertionError("No " + kind + " '" + text + "' in " + tree.root().toSExpression()));
    }

    @Test
    void testPythonFunctionFields() throws Exception {
        var tree = registry.parse("python", "greet.py", "def greet(name: str) -> str:\n    return 'hi ' + name\n");

        assertEquals("module", tree.root().kind());
        assertFalse(tree.hasErrors());
        var function = tree.root().child(0);
        assertEquals("function_definition", function.kind());
        assertEquals("greet", function.childByField("name").orElseThrow().text());
        assertEquals("str", function.childByField("return_type").orElseThrow().text());
        assertEquals("greet.py", function.span().file());
        assertEquals(1, function.span().line());
    }

    @Test
    void testSpansAreUtf8ByteOffsets() throws Exception {
        String source = "s = \"héllo\"  # ünï\nx = 1\n";
        var tree = registry.parse("python", "text.py", source);
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);

        for (var node : tree.nodes()) {
            var expected =
                    new String(bytes, node.startByte(), node.endByte() - node.startByte(), StandardCharsets.UTF_8);
            assertEquals(expected, node.text(), "text of " + node);
        }

        var comment = first(tree, "comment", "# ünï");
        assertEquals(0, comment.startPoint().row());

        var x = first(tree, "identifier", "x");
        int secondLine = source.substring(0, source.indexOf('\n') + 1).getBytes(StandardCharsets.UTF_8).length;
        assertEquals(secondLine, x.startByte());
        assertEquals(new Point(1, 0), x.startPoint());
        assertEquals(2, x.span().line());

        first(tree, "string", "\"héllo\"");
    }

    @Test
    void testBomIsHiddenFromParserButCountedInSpans() throws Exception {
        var source = "\uFEFFx = 1\ny = 2\n";
        var tree = registry.parse("python", "bom.py", source);
        assertFalse(tree.hasErrors());
        assertEquals(source, tree.source().text());

        var x = first(tree, "identifier", "x");
        assertEquals(3, x.startByte());
        assertEquals(3, x.span().start().column());
        assertEquals("x", x.text());

        var y = first(tree, "identifier", "y");
        assertEquals(0, y.span().start().column(), "only the first row moves");
        var bytes = source.getBytes(StandardCharsets.UTF_8);
        assertEquals("y", new String(bytes, y.startByte(), y.span().length(), StandardCharsets.UTF_8));
    }

    @Test
    void testDegradedParseReturnsTreeWithErrorSpan() throws Exception {
        String source = "x = 1\ndef broken(:\n    pass\ny = 2\n";
        var tree = registry.parse("python", "broken.py", source);

        assertTrue(tree.hasErrors(), "tree should report recovered errors");
        var errorSpan = tree.errorSpan().orElseThrow();
        assertEquals("broken.py", errorSpan.file());
        assertTrue(errorSpan.line() >= 2, "error should be reported after the first line: " + errorSpan);
        first(tree, "identifier", "x");
    }

    @Test
    void testTypescriptParses() throws Exception {
        var tree = registry.parse("typescript", "f.ts", "function f(): number {\n  return 1;\n}\n");
        assertEquals("program", tree.root().kind());
        assertFalse(tree.hasErrors());
        var function = tree.root().child(0);
        assertEquals("function_declaration", function.kind());
        assertEquals("f", function.childByField("name").orElseThrow().text());
    }

    @Test
    void testEmptySourceParsesToEmptyRoot() throws Exception {
        var tree = registry.parse("python", "empty.py", "");
        assertEquals("module", tree.root().kind());
        assertEquals(1, tree.size());
    }

    @Test
    void testParsersArePerThread() throws Exception {
        var errors = new ConcurrentLinkedQueue<Throwable>();
        var threads = new Thread[4];
        for (int t = 0; t < threads.length; t++) {
            int id = t;
            threads[t] = new Thread(() -> {
                try {
                    for (int i = 0; i < 20; i++) {
                        var tree = registry.parse("python", "t" + id + ".py", "v" + id + " = " + i + "\n");
                        assertEquals("v" + id, first(tree, "identifier", "v" + id).text());
                    }
                } catch (Throwable e) {
                    errors.add(e);
                }
            });
            threads[t].start();
        }
        for (var thread : threads) {
            thread.join();
        }
        assertTrue(errors.isEmpty(), "parse failures: " + errors);
    }

    @Test
    void testUnrecoverableTreeDetection() {
        var allErrors = TestTrees.tree(node(
                "module", node(Node.ERROR_KIND, tok("(")), node(Node.ERROR_KIND, tok(")"))));
        assertTrue(TreeSitterGrammar.isUnrecoverable(allErrors));

        var errorRoot = TestTrees.tree(node(Node.ERROR_KIND, leaf("identifier", "x")));
        assertTrue(TreeSitterGrammar.isUnrecoverable(errorRoot));

        var partial = TestTrees.tree(node(
                "module", leaf("identifier", "x"), node(Node.ERROR_KIND, tok("("))));
        assertFalse(TreeSitterGrammar.isUnrecoverable(partial));

        var clean = TestTrees.tree(node("module", leaf("identifier", "x")));
        assertFalse(TreeSitterGrammar.isUnrecoverable(clean));
    }

    /** Stands in for a grammar built against an incompatible Tree-sitter runtime. */
    private static final class RejectedLanguageGrammar extends TreeSitterGrammar {
        @Override
        public String languageId() {
            return "rejected";
        }

        @Override
        public List<String> extensions() {
            return List.of();
        }

        @Override
        protected TSLanguage createTSLanguage() {
            return new TreeSitterPython();
        }

        @Override
        protected boolean configureParser(TSParser parser, TSLanguage language) {
            return false;
        }
    }

    @Test
    void testRejectedLanguageFailsLoudly() {
        var grammar = new RejectedLanguageGrammar();
        var e = assertThrows(IllegalStateException.class, () -> grammar.parse("a.py", "x = 1\n"));
        assertTrue(e.getMessage().contains("TreeSitterPython"), e.getMessage());
        assertThrows(IllegalStateException.class, () -> grammar.parse("b.py", "y = 2\n"), "every use fails");
    }
}
