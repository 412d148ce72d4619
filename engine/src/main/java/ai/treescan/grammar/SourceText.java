package ai.treescan.grammar;

import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The text of one source file in both decoded and UTF-8 encoded form. Grammars report byte offsets, so node text is
 * always sliced from the encoded bytes and never from the Java string.
 */
public final class SourceText {
    private static final Logger logger = LogManager.getLogger(SourceText.class);

    private final String file;
    private final String text;
    private final byte[] bytes;

    public SourceText(String file, String text) {
        this.file = file;
        this.text = text;
        this.bytes = text.getBytes(StandardCharsets.UTF_8);
    }

    public String file() {
        return file;
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return bytes.length;
    }

    /** Decodes the bytes in {@code [startByte, endByte)}, clamping the end to the source length. */
    public String slice(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            logger.warn(
                    "Requested bytes outside valid range for {} (length: {} bytes): startByte={}, endByte={}",
                    file,
                    bytes.length,
                    startByte,
                    endByte);
            return "";
        }
        if (startByte == endByte || startByte >= bytes.length) {
            return "";
        }
        int end = Math.min(endByte, bytes.length);
        return new String(bytes, startByte, end - startByte, StandardCharsets.UTF_8);
    }
}
