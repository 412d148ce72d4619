package ai.treescan.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

public final class TextCanonicalizer {
    private TextCanonicalizer() {
        /* utility class – no instances */
    }

    /**
     * Strips a leading UTF-8 BOM (U+FEFF) from the provided String, if present. Returns the original string if no BOM
     * is present.
     */
    public static String stripUtf8Bom(String s) {
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') {
            return s.substring(1);
        }
        return s;
    }

    /**
     * Decodes file bytes as strict UTF-8. A leading BOM is kept as U+FEFF, so byte offsets into the re-encoded text
     * are byte offsets into the file.
     *
     * @throws CharacterCodingException if the bytes are not valid UTF-8, which usually means a binary file
     */
    public static String decodeUtf8(byte[] bytes) throws CharacterCodingException {
        var decoder = StandardCharsets.UTF_8
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    }
}
