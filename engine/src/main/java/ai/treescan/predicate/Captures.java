package ai.treescan.predicate;

import ai.treescan.grammar.Node;
import java.util.List;

/** Read access to the nodes bound by one match, as seen by predicates. */
public interface Captures {

    /**
     * Nodes bound to {@code captureName}, in binding order. A quantified or alternative capture that bound nothing
     * yields an empty list.
     *
     * @throws MissingCaptureException if the name was never declared by the matched pattern
     */
    List<Node> nodes(String captureName);
}
