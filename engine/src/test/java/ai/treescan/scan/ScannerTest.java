package ai.treescan.scan;

import static org.junit.jupiter.api.Assertions.*;

import ai.treescan.finding.Diagnostic;
import ai.treescan.finding.Finding;
import ai.treescan.grammar.Grammar;
import ai.treescan.grammar.GrammarRegistry;
import ai.treescan.grammar.ParseException;
import ai.treescan.grammar.PythonGrammar;
import ai.treescan.grammar.SyntaxTree;
import ai.treescan.match.MatcherEngine;
import ai.treescan.predicate.Captures;
import ai.treescan.predicate.MissingCaptureException;
import ai.treescan.predicate.PredicateCost;
import ai.treescan.predicate.PredicateRegistry;
import ai.treescan.predicate.QueryPredicate;
import ai.treescan.query.Query;
import ai.treescan.query.QueryCompiler;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ScannerTest {

    private static final String BARE_EXCEPT = """
            ((except_clause) @python.bare_except
             (#not-has-child? @python.bare_except identifier attribute tuple as_pattern))
            """;

    private static final String EVAL_EXEC = """
            ((call function: (identifier) @fn) @security.eval_exec
             (#match? @fn "^(eval|exec)$"))
            """;

    private static final String HANDLERS = """
            def load(path):
                try:
                    return open(path).read()
                except:
                    return None


            def parse(text):
                try:
                    return int(text)
                except ValueError:
                    return 0
            """;

    /** Grammar whose parser never produces a tree. */
    private record FailingGrammar(String languageId) implements Grammar {
        @Override
        public List<String> extensions() {
            return List.of("broken");
        }

        @Override
        public SyntaxTree parse(String file, String source) throws ParseException {
            throw new ParseException("grammar cannot handle this input", file, null);
        }
    }

    private final QueryCompiler compiler = new QueryCompiler();
    private Scanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new Scanner(GrammarRegistry.defaults(), ScanConfig.defaults().withParallelism(4));
    }

    @AfterEach
    void tearDown() {
        scanner.close();
    }

    private Query compile(String text) throws Exception {
        return compiler.compile(text);
    }

    @Test
    void testBareExceptIsReportedOnce() throws Exception {
        var queries = QuerySet.of("python", compile(BARE_EXCEPT));
        var result = scanner.scan(List.of(new SourceFile("python", "handlers.py", HANDLERS)), queries);

        assertTrue(result.diagnostics().isEmpty(), "unexpected diagnostics: " + result.diagnostics());
        assertEquals(1, result.findings().size(), "findings: " + result.findings());
        var finding = result.findings().get(0);
        assertEquals("python.bare_except", finding.category());
        assertEquals("python.bare_except", finding.captureName());
        assertEquals("handlers.py", finding.span().file());
        assertEquals(4, finding.span().line());
        assertTrue(finding.boundText().startsWith("except:"), finding.boundText());
    }

    @Test
    void testEvalAndExecButNotPrint() throws Exception {
        var source = "eval(user_input)\nprint(\"hello\")\nexec(code)\n";
        var queries = QuerySet.of("python", compile(EVAL_EXEC));
        var result = scanner.scan(List.of(new SourceFile("python", "calls.py", source)), queries);

        var texts = result.findings().stream().map(Finding::boundText).toList();
        assertEquals(List.of("eval(user_input)", "exec(code)"), texts);
        assertEquals(
                List.of(1, 3),
                result.findings().stream().map(f -> f.span().line()).toList());
        assertTrue(result.findings().stream().allMatch(f -> f.category().equals("security.eval_exec")));
    }

    @Test
    void testFailingGrammarDoesNotStopOtherFiles() throws Exception {
        var registry = GrammarRegistry.builder()
                .register(new PythonGrammar())
                .register(new FailingGrammar("broken"))
                .build();
        var query = compile(BARE_EXCEPT);
        var queries = QuerySet.builder().add("python", query).add("broken", query).build();
        var files = List.of(
                new SourceFile("python", "first.py", HANDLERS),
                new SourceFile("broken", "middle.broken", "anything"),
                new SourceFile("python", "last.py", HANDLERS));

        try (var isolated = new Scanner(registry, ScanConfig.defaults().withParallelism(2))) {
            var result = isolated.scan(files, queries);

            assertEquals(
                    List.of("first.py", "last.py"),
                    result.findings().stream().map(Finding::file).toList());
            assertEquals(1, result.diagnostics().size());
            var diagnostic = result.diagnostics().get(0);
            assertEquals(Diagnostic.Kind.PARSE_ERROR, diagnostic.kind());
            assertEquals("middle.broken", diagnostic.file());
            assertTrue(diagnostic.message().contains("grammar cannot handle this input"), diagnostic.message());
        }
    }

    @Test
    void testUnsupportedLanguageIsADiagnostic() throws Exception {
        var queries = QuerySet.of("python", compile(BARE_EXCEPT));
        var result = scanner.scan(List.of(new SourceFile("ruby", "app.rb", "puts 1")), queries);

        assertTrue(result.findings().isEmpty());
        assertEquals(Diagnostic.Kind.UNSUPPORTED_LANGUAGE, result.diagnostics().get(0).kind());
        assertEquals("app.rb", result.diagnostics().get(0).file());
    }

    @Test
    void testLanguageWithoutQueriesIsSkipped() throws Exception {
        var queries = QuerySet.of("python", compile(BARE_EXCEPT));
        var result = scanner.scan(List.of(new SourceFile("typescript", "a.ts", "let x = 1;")), queries);
        assertEquals(ScanResult.EMPTY, result);
    }

    @Test
    void testDegradedParseKeepsFindingsAndAddsDiagnostic() throws Exception {
        var source = "x = 1\ndef broken(:\n    pass\ny = 2\n";
        var queries = QuerySet.of("python", compile("((identifier) @id (#eq? @id \"x\"))"));
        var result = scanner.scan(List.of(new SourceFile("python", "degraded.py", source)), queries);

        assertEquals(1, result.diagnostics().size());
        var diagnostic = result.diagnostics().get(0);
        assertEquals(Diagnostic.Kind.PARSE_ERROR, diagnostic.kind());
        assertNotNull(diagnostic.span());
        assertFalse(result.findings().isEmpty(), "the statement before the error still matches");
        assertEquals(1, result.findings().get(0).span().line());
    }

    @Test
    void testFindingsFollowQueryOrderThenTraversalOrder() throws Exception {
        var source = "eval(a)\ntry:\n    pass\nexcept:\n    exec(b)\n";
        var queries = QuerySet.builder()
                .add("python", compile(BARE_EXCEPT))
                .add("python", compile(EVAL_EXEC))
                .build();
        var result = scanner.scan(List.of(new SourceFile("python", "order.py", source)), queries);

        assertEquals(
                List.of("python.bare_except", "security.eval_exec", "security.eval_exec"),
                result.findings().stream().map(Finding::category).toList());
        assertEquals("eval(a)", result.findings().get(1).boundText());
        assertEquals("exec(b)", result.findings().get(2).boundText());
    }

    @Test
    void testResultsFollowInputOrder() throws Exception {
        var queries = QuerySet.of("python", compile(EVAL_EXEC));
        var files = new ArrayList<SourceFile>();
        for (int i = 0; i < 40; i++) {
            files.add(new SourceFile("python", "f" + i + ".py", "x = 1\n".repeat(i * 10) + "eval(v" + i + ")\n"));
        }
        var result = scanner.scan(files, queries);

        assertEquals(40, result.findings().size());
        for (int i = 0; i < 40; i++) {
            assertEquals("f" + i + ".py", result.findings().get(i).file());
        }
    }

    @Test
    void testPredicateRejectionBacktracksToAnotherBinding() throws Exception {
        var query = compile("((argument_list (identifier) @arg) @args (#eq? @arg \"second\"))");
        var source = "f(first, second)\n";
        var result = scanner.scan(List.of(new SourceFile("python", "args.py", source)), QuerySet.of("python", query));

        assertEquals(1, result.findings().size());
        assertEquals("(first, second)", result.findings().get(0).boundText());
    }

    @Test
    void testInternalFaultPropagates() throws Exception {
        var registry = PredicateRegistry.defaults().toBuilder()
                .register("ghost", (name, args) -> new QueryPredicate() {
                    @Override
                    public String name() {
                        return name;
                    }

                    @Override
                    public PredicateCost cost() {
                        return PredicateCost.STRUCTURAL;
                    }

                    @Override
                    public Set<String> captureNames() {
                        return Set.of();
                    }

                    @Override
                    public boolean test(Captures captures) {
                        return !captures.nodes("never-declared").isEmpty();
                    }
                })
                .build();
        var query = new QueryCompiler(registry).compile("((identifier) @id (#ghost?))");
        var files = List.of(new SourceFile("python", "ghost.py", "x = 1\n"));

        assertThrows(MissingCaptureException.class, () -> scanner.scan(files, QuerySet.of("python", query)));
    }

    @Test
    void testScanPathsReportsReadErrors(@TempDir Path dir) throws Exception {
        var good = Files.writeString(dir.resolve("good.py"), "eval(x)\n");
        var big = Files.writeString(dir.resolve("big.py"), "eval(y)\n" + "#".repeat(200) + "\n");
        var binary = Files.write(dir.resolve("binary.py"), new byte[] {'x', '=', (byte) 0xC3, (byte) 0x28});
        var missing = dir.resolve("missing.py");
        var text = Files.writeString(dir.resolve("notes.txt"), "eval(z)\n", StandardCharsets.UTF_8);

        try (var small = new Scanner(GrammarRegistry.defaults(), ScanConfig.defaults().withMaxFileBytes(64))) {
            var result = small.scanPaths(List.of(good, big, binary, missing, text), QuerySet.of("python", compile(EVAL_EXEC)));

            assertEquals(1, result.findings().size());
            assertEquals(good.toString(), result.findings().get(0).file());

            var kinds = result.diagnostics().stream()
                    .map(d -> d.kind() + " " + Path.of(d.file()).getFileName())
                    .toList();
            assertEquals(
                    List.of(
                            "READ_ERROR big.py",
                            "READ_ERROR binary.py",
                            "READ_ERROR missing.py",
                            "UNSUPPORTED_LANGUAGE notes.txt"),
                    kinds);
        }
    }

    @Test
    void testRepetitionOverTensOfThousandsOfStatements() throws Exception {
        var large = new StringBuilder();
        for (int i = 0; i < 20_000; i++) {
            large.append('x').append(i).append(" = 1\n");
        }
        var query = compile("(module (_)* @stmt) @m");
        var files = List.of(
                new SourceFile("python", "large.py", large.toString()),
                new SourceFile("python", "small.py", "y = 2\n"));
        var result = scanner.scan(files, QuerySet.of("python", query));

        assertTrue(result.diagnostics().isEmpty(), "unexpected diagnostics: " + result.diagnostics());
        assertEquals(
                List.of("large.py", "small.py"),
                result.findings().stream().map(Finding::file).toList());

        var tree = GrammarRegistry.defaults().parse("python", "large.py", large.toString());
        var captures = MatcherEngine.matchAt(query.pattern(0), tree.root()).orElseThrow();
        assertEquals(20_000, captures.nodes("stmt").size());
    }

    @Test
    void testSpansIndexFileBytesWhenFileStartsWithBom(@TempDir Path dir) throws Exception {
        var bytes = "\uFEFFeval(x)\n".getBytes(StandardCharsets.UTF_8);
        var file = Files.write(dir.resolve("bom.py"), bytes);
        var result = scanner.scanPaths(List.of(file), QuerySet.of("python", compile(EVAL_EXEC)));

        assertEquals(1, result.findings().size(), "findings: " + result.findings());
        var finding = result.findings().get(0);
        var span = finding.span();
        assertEquals(3, span.startByte());
        assertEquals("eval(x)", finding.boundText());
        assertEquals("eval(x)", new String(bytes, span.startByte(), span.length(), StandardCharsets.UTF_8));
    }
}
