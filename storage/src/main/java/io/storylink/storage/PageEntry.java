package io.storylink.storage;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One key/value entry of a {@link PageStore}.
 * Values are opaque bytes; callers must treat the array as read-only.
 */
public record PageEntry(String key, byte[] value) {

    public PageEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    /** Value decoded as UTF-8, for logs and tests. */
    public String valueAsString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "PageEntry[" + key + ", " + value.length + " bytes]";
    }
}
