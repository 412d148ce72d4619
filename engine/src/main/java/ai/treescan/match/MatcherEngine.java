package ai.treescan.match;

import ai.treescan.grammar.Node;
import ai.treescan.grammar.SyntaxTree;
import ai.treescan.query.ChildMatcher;
import ai.treescan.query.NodeMatcher;
import ai.treescan.query.Pattern;
import ai.treescan.query.Query;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.jetbrains.annotations.Nullable;

/**
 * Evaluates compiled queries against syntax trees.
 *
 * <p>Every node of the tree, visited in pre-order, is a candidate root for every pattern of the query in declaration
 * order. Unification is a depth-first backtracking search whose solutions are enumerated lazily, and the first solution
 * the filter accepts wins. A (node, pattern) pair therefore yields at most one {@link CaptureSet}, and matches rooted at
 * nested or overlapping nodes are all reported.
 *
 * <p>The search over the children of one node keeps its own frame stack on the heap, so Java stack depth grows with
 * the nesting of the pattern and never with the number of siblings a repetition consumes.
 *
 * <p>Evaluation is lazy and read-only: the returned stream can be abandoned at any point, and evaluating the same query
 * against the same tree again produces an equal sequence.
 */
public final class MatcherEngine {

    private MatcherEngine() {}

    public static Stream<CaptureSet> evaluate(Query query, SyntaxTree tree) {
        return evaluate(query, tree, CandidateFilter.ACCEPT_ALL);
    }

    /**
     * Like {@link #evaluate(Query, SyntaxTree)}, but a binding the filter rejects does not end the search at that node:
     * the engine backtracks into the next alternative binding and reports the first one the filter accepts.
     */
    public static Stream<CaptureSet> evaluate(Query query, SyntaxTree tree, CandidateFilter filter) {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(
                        iterator(query, tree, filter), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    public static Iterator<CaptureSet> iterator(Query query, SyntaxTree tree, CandidateFilter filter) {
        return new MatchIterator(query, tree.root(), filter);
    }

    /** Matches one pattern rooted at one node. */
    public static Optional<CaptureSet> matchAt(Pattern pattern, Node node) {
        return matchAt(pattern, node, CandidateFilter.ACCEPT_ALL);
    }

    public static Optional<CaptureSet> matchAt(Pattern pattern, Node node, CandidateFilter filter) {
        var solutions = solutions(pattern.root(), node, Bindings.EMPTY);
        while (solutions.hasNext()) {
            var captures = CaptureSet.of(pattern, node, solutions.next());
            if (filter.accept(pattern, captures)) {
                return Optional.of(captures);
            }
        }
        return Optional.empty();
    }

    /** Every way {@code matcher} matches {@code node}, in backtracking order. */
    private static Iterator<Bindings> solutions(NodeMatcher matcher, Node node, Bindings bindings) {
        switch (matcher.shape()) {
            case ALTERNATION -> {
                return new AlternationSolutions(matcher.alternatives(), node, bindings.bind(matcher.captures(), node));
            }
            case ANY -> {
                return List.of(bindings.bind(matcher.captures(), node)).iterator();
            }
            case TOKEN -> {
                if (node.isNamed() || !node.kind().equals(matcher.kind())) {
                    return Collections.emptyIterator();
                }
                return List.of(bindings.bind(matcher.captures(), node)).iterator();
            }
            default -> {
                if (!node.isNamed()) {
                    return Collections.emptyIterator();
                }
                if (matcher.shape() == NodeMatcher.Shape.KIND && !node.kind().equals(matcher.kind())) {
                    return Collections.emptyIterator();
                }
                for (var field : matcher.absentFields()) {
                    if (node.hasField(field)) {
                        return Collections.emptyIterator();
                    }
                }
                if (!matcher.absentChildren().isEmpty() && hasForbiddenChild(matcher, node)) {
                    return Collections.emptyIterator();
                }
                return new ChildSearch(node, matcher, bindings.bind(matcher.captures(), node));
            }
        }
    }

    /** Absence assertions bind nothing, so they are decided once per node, before any child is matched. */
    private static boolean hasForbiddenChild(NodeMatcher matcher, Node node) {
        for (var child : node.children()) {
            for (var absent : matcher.absentChildren()) {
                if (solutions(absent, child, Bindings.EMPTY).hasNext()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean fieldMatches(@Nullable String field, Node candidate) {
        return field == null || field.equals(candidate.fieldName());
    }

    private static boolean hasNamedChildFrom(Node parent, int childIndex) {
        for (int i = childIndex; i < parent.childCount(); i++) {
            if (parent.child(i).isNamed()) {
                return true;
            }
        }
        return false;
    }

    /** Solutions of each alternative in turn. */
    private static final class AlternationSolutions implements Iterator<Bindings> {
        private final Iterator<NodeMatcher> alternatives;
        private final Node node;
        private final Bindings bindings;
        private Iterator<Bindings> current = Collections.emptyIterator();

        AlternationSolutions(List<NodeMatcher> alternatives, Node node, Bindings bindings) {
            this.alternatives = alternatives.iterator();
            this.node = node;
            this.bindings = bindings;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext()) {
                if (!alternatives.hasNext()) {
                    return false;
                }
                current = solutions(alternatives.next(), node, bindings);
            }
            return true;
        }

        @Override
        public Bindings next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }

    /**
     * Position in the child search: child matcher {@code matcherIndex} has consumed {@code count} repetitions and the
     * next candidate child is {@code childIndex}.
     */
    private record State(int matcherIndex, int childIndex, int count, Bindings bindings) {}

    /**
     * Lines the child matchers of one pattern node up with the children of one tree node: an ordered subsequence where
     * named matchers skip anonymous tokens, and anchored children and repetitions sit on the next significant sibling.
     * Each frame on the stack is one search state with its untried successors.
     */
    private static final class ChildSearch implements Iterator<Bindings> {
        private final Node parent;
        private final NodeMatcher matcher;
        private final Deque<Frame> frames = new ArrayDeque<>();
        private @Nullable State start;
        private @Nullable Bindings pending;

        ChildSearch(Node parent, NodeMatcher matcher, Bindings bindings) {
            this.parent = parent;
            this.matcher = matcher;
            this.start = new State(0, 0, 0, bindings);
        }

        @Override
        public boolean hasNext() {
            while (pending == null) {
                State state;
                if (start != null) {
                    state = start;
                    start = null;
                } else {
                    var top = frames.peek();
                    if (top == null) {
                        return false;
                    }
                    state = top.advance();
                    if (state == null) {
                        frames.pop();
                        continue;
                    }
                }
                if (state.matcherIndex() == matcher.children().size()) {
                    if (!matcher.anchoredEnd() || !hasNamedChildFrom(parent, state.childIndex())) {
                        pending = state.bindings();
                    }
                } else {
                    frames.push(new Frame(parent, matcher.children().get(state.matcherIndex()), state));
                }
            }
            return true;
        }

        @Override
        public Bindings next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            var result = pending;
            pending = null;
            return result;
        }
    }

    /** Successors of one state: one more occurrence first (greedy), then moving on to the next child matcher. */
    private static final class Frame {
        private final Node parent;
        private final ChildMatcher child;
        private final State state;
        private final boolean adjacent;
        private final boolean namedOnly;
        private int nextCandidate;
        private boolean candidatesDone;
        private Iterator<Bindings> occurrences = Collections.emptyIterator();
        private int following;
        private boolean movedOn;

        Frame(Node parent, ChildMatcher child, State state) {
            this.parent = parent;
            this.child = child;
            this.state = state;
            this.adjacent = child.anchored() || state.count() > 0;
            this.namedOnly = child.matcher().requiresNamedNode();
            this.nextCandidate = state.childIndex();
            this.candidatesDone = state.count() >= child.quantifier().max();
        }

        @Nullable
        State advance() {
            while (true) {
                if (occurrences.hasNext()) {
                    return new State(state.matcherIndex(), following, state.count() + 1, occurrences.next());
                }
                if (candidatesDone || nextCandidate >= parent.childCount()) {
                    break;
                }
                int i = nextCandidate++;
                var candidate = parent.child(i);
                if (namedOnly && !candidate.isNamed()) {
                    continue;
                }
                if (adjacent) {
                    candidatesDone = true;
                }
                if (fieldMatches(child.field(), candidate)) {
                    occurrences = solutions(child.matcher(), candidate, state.bindings());
                    following = i + 1;
                }
            }
            if (!movedOn) {
                movedOn = true;
                if (state.count() >= child.quantifier().min()) {
                    return new State(state.matcherIndex() + 1, state.childIndex(), 0, state.bindings());
                }
            }
            return null;
        }
    }

    /**
     * Pre-order walk over the tree with an explicit stack, trying every pattern at every node. Matching happens on
     * {@link #hasNext()}, so a caller that stops early pays only for the nodes it reached.
     */
    private static final class MatchIterator implements Iterator<CaptureSet> {
        private final Query query;
        private final CandidateFilter filter;
        private final Deque<Node> stack = new ArrayDeque<>();
        private @Nullable Node current;
        private int patternIndex;
        private @Nullable CaptureSet pending;

        MatchIterator(Query query, Node root, CandidateFilter filter) {
            this.query = query;
            this.filter = filter;
            stack.push(root);
        }

        @Override
        public boolean hasNext() {
            while (pending == null) {
                if (current == null || patternIndex >= query.patternCount()) {
                    if (stack.isEmpty()) {
                        return false;
                    }
                    current = stack.pop();
                    patternIndex = 0;
                    var children = current.children();
                    for (int i = children.size() - 1; i >= 0; i--) {
                        stack.push(children.get(i));
                    }
                }
                var pattern = query.pattern(patternIndex++);
                pending = matchAt(pattern, current, filter).orElse(null);
            }
            return true;
        }

        @Override
        public CaptureSet next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            var result = pending;
            pending = null;
            return result;
        }
    }
}
