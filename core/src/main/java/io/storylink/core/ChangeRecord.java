package io.storylink.core;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable entry of a link's change log.
 * <p>
 * Fields:
 *  - key:  ordered change key (see {@link KeyGenerator}); null for a local change
 *          that has not been assigned a key yet.
 *  - op:   patch operation.
 *  - path: path segments from the document root; empty means the root.
 *  - json: JSON text payload for SET/UPDATE, null for ERASE.
 */
public record ChangeRecord(String key, ChangeOp op, List<String> path, String json) {

    /** Orders records by key; records without a key sort first. */
    public static final Comparator<ChangeRecord> BY_KEY =
            Comparator.comparing(ChangeRecord::key, Comparator.nullsFirst(Comparator.naturalOrder()));

    public ChangeRecord {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(path, "path");
        path = List.copyOf(path);
        if (op.hasPayload() && json == null) {
            throw new IllegalArgumentException(op + " requires a JSON payload");
        }
        if (!op.hasPayload()) {
            json = null;
        }
    }

    public static ChangeRecord set(List<String> path, String json) {
        return new ChangeRecord(null, ChangeOp.SET, path, json);
    }

    public static ChangeRecord update(List<String> path, String json) {
        return new ChangeRecord(null, ChangeOp.UPDATE, path, json);
    }

    public static ChangeRecord erase(List<String> path) {
        return new ChangeRecord(null, ChangeOp.ERASE, path, null);
    }

    public boolean hasKey() {
        return key != null;
    }

    /** Copy of this record carrying the given key. */
    public ChangeRecord withKey(String newKey) {
        return new ChangeRecord(Objects.requireNonNull(newKey, "newKey"), op, path, json);
    }
}
