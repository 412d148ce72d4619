package ai.treescan.finding;

import ai.treescan.grammar.Span;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * One reported occurrence of a code pattern. Immutable; produced from exactly one capture set of one query evaluated
 * against one tree.
 *
 * @param category what was found, e.g. {@code bare_except}
 * @param captureName the capture whose node the span and text come from, or empty when the match root was used
 * @param span location of that node
 * @param boundText source text of that node
 * @param tags sorted free-form labels such as {@code security} or {@code severity:high}
 */
public record Finding(String category, String captureName, Span span, String boundText, Set<String> tags) {

    public Finding {
        tags = Collections.unmodifiableSortedSet(new TreeSet<>(tags));
    }

    public String file() {
        return span.file();
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    @Override
    public String toString() {
        return category + " @ " + span;
    }
}
