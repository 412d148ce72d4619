package ai.treescan.match;

import ai.treescan.query.Pattern;

/**
 * Decides whether a syntactic match is acceptable. When a filter rejects a binding the engine keeps backtracking for
 * another binding rooted at the same node.
 */
@FunctionalInterface
public interface CandidateFilter {
    CandidateFilter ACCEPT_ALL = (pattern, captures) -> true;

    boolean accept(Pattern pattern, CaptureSet captures);
}
