package ai.treescan.match;

import ai.treescan.grammar.Node;
import ai.treescan.predicate.Captures;
import ai.treescan.predicate.MissingCaptureException;
import ai.treescan.query.Pattern;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The bindings of one successful match.
 *
 * @param patternIndex index of the matched declaration within its query
 * @param root node the match is rooted at
 * @param captures every capture name the declaration binds, mapped to its nodes in binding order; captures that bound
 *     nothing (an unmatched optional, say) map to an empty list
 */
public record CaptureSet(int patternIndex, Node root, Map<String, List<Node>> captures) implements Captures {

    public CaptureSet {
        var copy = new LinkedHashMap<String, List<Node>>();
        captures.forEach((name, nodes) -> copy.put(name, List.copyOf(nodes)));
        captures = Collections.unmodifiableMap(copy);
    }

    static CaptureSet of(Pattern pattern, Node root, Bindings bindings) {
        var captures = new LinkedHashMap<String, List<Node>>();
        for (var name : pattern.captureNames()) {
            captures.put(name, new ArrayList<>(1));
        }
        bindings.forEachInOrder((name, node) -> captures.computeIfAbsent(name, n -> new ArrayList<>(1)).add(node));
        return new CaptureSet(pattern.index(), root, captures);
    }

    @Override
    public List<Node> nodes(String captureName) {
        var nodes = captures.get(captureName);
        if (nodes == null) {
            throw new MissingCaptureException(captureName);
        }
        return nodes;
    }

    public Optional<Node> first(String captureName) {
        var nodes = nodes(captureName);
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(0));
    }

    public boolean isBound(String captureName) {
        var nodes = captures.get(captureName);
        return nodes != null && !nodes.isEmpty();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("CaptureSet[").append(patternIndex).append(", ").append(root);
        captures.forEach((name, nodes) -> sb.append(", @").append(name).append('=').append(nodes));
        return sb.append(']').toString();
    }
}
