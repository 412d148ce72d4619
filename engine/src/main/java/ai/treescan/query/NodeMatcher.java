package ai.treescan.query;

import java.util.List;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/**
 * One node of a compiled pattern.
 *
 * @param shape which nodes this matcher can accept at all
 * @param kind node kind for {@link Shape#KIND}, token text for {@link Shape#TOKEN}, otherwise null
 * @param children positive child matchers, matched as an ordered subsequence of the node's children
 * @param anchoredEnd whether the last matched child must be the node's last named child
 * @param absentFields fields the node must not have
 * @param absentChildren patterns no direct child of the node may match
 * @param alternatives branches of an {@link Shape#ALTERNATION}
 * @param captures capture names bound to the matched node
 * @param offset position of the matcher in the pattern text
 */
public record NodeMatcher(
        Shape shape,
        @Nullable String kind,
        List<ChildMatcher> children,
        boolean anchoredEnd,
        List<String> absentFields,
        List<NodeMatcher> absentChildren,
        List<NodeMatcher> alternatives,
        List<String> captures,
        int offset) {

    public enum Shape {
        /** {@code (kind ...)}: a named node of one kind. */
        KIND,
        /** {@code (_ ...)}: any named node. */
        NAMED_WILDCARD,
        /** {@code _}: any node, named or anonymous. */
        ANY,
        /** {@code "text"}: an anonymous token with that text. */
        TOKEN,
        /** {@code [a b ...]}: the first alternative that matches. */
        ALTERNATION
    }

    public NodeMatcher {
        children = List.copyOf(children);
        absentFields = List.copyOf(absentFields);
        absentChildren = List.copyOf(absentChildren);
        alternatives = List.copyOf(alternatives);
        captures = List.copyOf(captures);
    }

    /** Whether only named nodes can satisfy this matcher, which lets child matching skip anonymous tokens. */
    public boolean requiresNamedNode() {
        return switch (shape) {
            case KIND, NAMED_WILDCARD -> true;
            case ANY, TOKEN -> false;
            case ALTERNATION -> alternatives.stream().allMatch(NodeMatcher::requiresNamedNode);
        };
    }

    public NodeMatcher withCaptures(List<String> newCaptures) {
        return new NodeMatcher(
                shape, kind, children, anchoredEnd, absentFields, absentChildren, alternatives, newCaptures, offset);
    }

    @Override
    public String toString() {
        var body = switch (shape) {
            case KIND, NAMED_WILDCARD -> {
                var sb = new StringBuilder("(").append(shape == Shape.KIND ? kind : "_");
                for (var child : children) {
                    sb.append(' ').append(child);
                }
                if (anchoredEnd) {
                    sb.append(" .");
                }
                for (var field : absentFields) {
                    sb.append(" !").append(field);
                }
                for (var absent : absentChildren) {
                    sb.append(" !").append(absent);
                }
                yield sb.append(')').toString();
            }
            case ANY -> "_";
            case TOKEN -> '"' + kind + '"';
            case ALTERNATION -> alternatives.stream()
                    .map(NodeMatcher::toString)
                    .collect(Collectors.joining(" ", "[", "]"));
        };
        return captures.isEmpty()
                ? body
                : body + captures.stream().map(c -> " @" + c).collect(Collectors.joining());
    }
}
