package ai.treescan.finding;

import static org.junit.jupiter.api.Assertions.*;

import ai.treescan.grammar.Point;
import ai.treescan.grammar.Span;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class FindingJsonTest {

    private static final Finding FINDING = new Finding(
            "bare_except",
            "python.bare_except",
            new Span("app/handlers.py", 10, 32, new Point(1, 0), new Point(2, 8)),
            "except:\n        pass",
            Set.of("severity:low", "python"));

    @Test
    void testFindingSerializesSpanAndTags() throws Exception {
        var tree = FindingJson.getMapper().readTree(FindingJson.toJson(FINDING));

        assertEquals("bare_except", tree.get("category").asText());
        assertEquals("python.bare_except", tree.get("captureName").asText());
        assertEquals("app/handlers.py", tree.get("span").get("file").asText());
        assertEquals(10, tree.get("span").get("startByte").asInt());
        assertEquals(2, tree.get("span").get("end").get("row").asInt());
        assertFalse(tree.get("span").has("line"));
        assertEquals("python", tree.get("tags").get(0).asText());
        assertEquals("severity:low", tree.get("tags").get(1).asText());
    }

    @Test
    void testFindingReadsBack() {
        assertEquals(FINDING, FindingJson.fromJson(FindingJson.toJson(FINDING)));
    }

    @Test
    void testScanOutputOmitsMissingDiagnosticSpan() throws Exception {
        var diagnostic = Diagnostic.unsupportedLanguage("notes.rb", "No grammar registered for language 'rb'");
        var json = FindingJson.toJson(List.of(FINDING), List.of(diagnostic));
        var tree = FindingJson.getMapper().readTree(json);

        assertEquals(1, tree.get("findings").size());
        var written = tree.get("diagnostics").get(0);
        assertEquals("UNSUPPORTED_LANGUAGE", written.get("kind").asText());
        assertEquals("notes.rb", written.get("file").asText());
        assertFalse(written.has("span"));
    }
}
