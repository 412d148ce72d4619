package ai.treescan.finding;

import ai.treescan.grammar.Node;
import ai.treescan.grammar.Span;
import ai.treescan.match.CaptureSet;
import ai.treescan.query.Pattern;
import ai.treescan.query.Query;
import java.util.TreeSet;

/** Turns capture sets into findings. Pure: the same inputs always produce an equal finding. */
public final class FindingEmitter {

    private FindingEmitter() {}

    public static Finding emit(Query query, CaptureSet captures) {
        return emit(query, captures, captures.root().span().file());
    }

    /**
     * Builds the finding for one match.
     *
     * <p>The primary capture is the pattern's {@code #set! primary} capture, else the first capture on the pattern's
     * root matcher, else the match root itself (reported with an empty capture name). A primary capture that bound no
     * node also falls back to the match root. The category is the pattern's {@code #set! category}, else the query's
     * default category, else the primary capture name.
     *
     * @param sourceFile file path recorded in the finding's span
     */
    public static Finding emit(Query query, CaptureSet captures, String sourceFile) {
        Pattern pattern = query.pattern(captures.patternIndex());
        var metadata = pattern.metadata();

        String captureName = metadata.primaryCapture();
        if (captureName == null && !pattern.root().captures().isEmpty()) {
            captureName = pattern.root().captures().get(0);
        }
        Node node = captures.root();
        if (captureName != null && captures.isBound(captureName)) {
            node = captures.nodes(captureName).get(0);
        } else {
            captureName = "";
        }

        String category = metadata.category();
        if (category == null) {
            category = query.category();
        }
        if (category == null) {
            category = captureName.isEmpty() ? query.name() : captureName;
        }

        var tags = new TreeSet<String>(query.tags());
        tags.addAll(metadata.tags());
        if (metadata.severity() != null) {
            tags.add("severity:" + metadata.severity());
        }

        var span = node.span();
        if (!span.file().equals(sourceFile)) {
            span = new Span(sourceFile, span.startByte(), span.endByte(), span.start(), span.end());
        }
        return new Finding(category, captureName, span, node.text(), tags);
    }
}
