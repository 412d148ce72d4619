package ai.treescan.finding;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * JSON form of findings and diagnostics, for whatever consumes a scan downstream. Output is one object per finding
 * with the span nested; null spans of diagnostics are omitted.
 */
public final class FindingJson {

    private static final ObjectMapper MAPPER = createMapper();

    private FindingJson() {}

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static String toJson(List<Finding> findings, List<Diagnostic> diagnostics) {
        return write(Map.of("findings", findings, "diagnostics", diagnostics));
    }

    public static String toJson(Finding finding) {
        return write(finding);
    }

    public static Finding fromJson(String json) {
        try {
            return MAPPER.readValue(json, Finding.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to deserialize finding", e);
        }
    }

    public static ObjectMapper getMapper() {
        return MAPPER;
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize to JSON", e);
        }
    }
}
