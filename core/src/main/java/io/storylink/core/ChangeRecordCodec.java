package io.storylink.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * JSON framing of change records as stored in the page store.
 * <p>
 * Layout (UTF-8):
 * <pre>
 *   {"key":"...","op":"SET","path":["a","b"],"json":"{\"x\":1}"}
 * </pre>
 * The payload is kept as JSON text (not a nested tree) so that a record is
 * stored exactly as the writer produced it. {@code json} is omitted for ERASE.
 */
public final class ChangeRecordCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ChangeRecordCodec() {
        // utility
    }

    /** Wire shape; public fields for Jackson. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class Wire {
        public String key;
        public ChangeOp op;
        public List<String> path;
        public String json;
    }

    public static byte[] encode(ChangeRecord change) {
        if (!change.hasKey()) {
            throw new IllegalArgumentException("only keyed changes can be stored");
        }
        var w = new Wire();
        w.key = change.key();
        w.op = change.op();
        w.path = change.path();
        w.json = change.json();
        try {
            return MAPPER.writeValueAsBytes(w);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode change " + change.key(), e);
        }
    }

    /**
     * Decode a stored change record.
     *
     * @throws IllegalArgumentException if the bytes are not a valid record
     */
    public static ChangeRecord decode(byte[] bytes) {
        Wire w;
        try {
            w = MAPPER.readValue(bytes, Wire.class);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "malformed change record: " + new String(bytes, StandardCharsets.UTF_8), e);
        }
        if (w == null || w.key == null || w.op == null) {
            throw new IllegalArgumentException("change record misses key or op");
        }
        return new ChangeRecord(w.key, w.op, w.path == null ? List.of() : w.path, w.json);
    }
}
