package ai.treescan.query;

import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Reporting metadata a pattern declares through {@code (#set! key "value")} directives.
 *
 * @param category finding category, overriding the query default
 * @param primaryCapture capture that determines a finding's span and text
 * @param severity free-form severity level such as {@code high}
 * @param tags extra finding tags
 */
public record PatternMetadata(
        @Nullable String category, @Nullable String primaryCapture, @Nullable String severity, Set<String> tags) {

    public static final PatternMetadata EMPTY = new PatternMetadata(null, null, null, Set.of());

    public PatternMetadata {
        tags = Set.copyOf(tags);
    }
}
