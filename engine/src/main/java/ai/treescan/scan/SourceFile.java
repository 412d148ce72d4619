package ai.treescan.scan;

import ai.treescan.grammar.GrammarRegistry;
import ai.treescan.util.TextCanonicalizer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * One unit of scan input.
 *
 * @param languageId grammar identifier, e.g. {@code python}
 * @param path file path as it should appear in findings
 * @param text full source text
 */
public record SourceFile(String languageId, String path, String text) {

    /**
     * Reads a UTF-8 file and resolves its language from the extension. Files with an unknown extension keep the bare
     * extension as language id, so a scan reports them as unsupported instead of silently dropping them.
     *
     * @throws java.nio.charset.CharacterCodingException if the file is not valid UTF-8
     */
    public static SourceFile read(Path path, GrammarRegistry registry) throws IOException {
        String name = path.toString();
        String languageId = registry.languageForPath(name).orElseGet(() -> extensionOf(path));
        String text = TextCanonicalizer.decodeUtf8(Files.readAllBytes(path));
        return new SourceFile(languageId, name, text);
    }

    private static String extensionOf(Path path) {
        var fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "SourceFile[" + languageId + ", " + path + ", " + text.length() + " chars]";
    }
}
