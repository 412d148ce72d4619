package ai.treescan.query;

import org.jetbrains.annotations.Nullable;

/**
 * A child position inside a node pattern.
 *
 * @param matcher what the child must look like
 * @param field field name the child must hang under, or null for any
 * @param quantifier how many consecutive siblings it consumes
 * @param anchored whether the child must immediately follow the previous match (or be the first named child)
 */
public record ChildMatcher(NodeMatcher matcher, @Nullable String field, Quantifier quantifier, boolean anchored) {

    @Override
    public String toString() {
        return (anchored ? ". " : "") + (field == null ? "" : field + ": ") + matcher + quantifier.symbol();
    }
}
