package io.storylink.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.storylink.core.ChangeRecord;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable JSON value of one link, plus the three patch operations applied to it.
 * <p>
 * Paths are lists of segments from the root. While walking a path:
 *  - a segment addressing an existing array is an index if it is a
 *    non-negative integer, or "-" meaning "one past the end";
 *  - every other segment is an object member name.
 * When a write needs intermediate containers they are created as objects
 * (replacing scalars in the way), and arrays are padded with nulls up to
 * the addressed index. A write whose index lies more than
 * {@link #MAX_ARRAY_GAP} past the end of an existing array is rejected.
 * <p>
 * Not thread safe: owned by a single link and only touched from inside its
 * operation queue.
 */
public final class JsonDocument {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    /** Most nulls a single write may pad an array with. */
    public static final int MAX_ARRAY_GAP = 1024;

    private JsonNode root = NullNode.getInstance();

    public JsonDocument() {
    }

    /** Parse a JSON text, or return null if it is malformed or has anything after its root value. */
    public static JsonNode parse(String json) {
        if (json == null) {
            return null;
        }
        try {
            JsonNode node = MAPPER.readTree(json);
            // readTree() returns a MissingNode for blank input.
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /** Compact JSON text of a node. */
    public static String toJson(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON tree could not be serialized", e);
        }
    }

    public JsonNode root() { return root; }

    public String toJson() { return toJson(root); }

    /** Deep copy of the current value, for before/after comparisons. */
    public JsonNode snapshot() { return root.deepCopy(); }

    /** Drop the current value; the document becomes JSON null. */
    public void reset() { root = NullNode.getInstance(); }

    /** Value at {@code path}, or null if nothing is there. The returned node must not be mutated. */
    public JsonNode get(List<String> path) {
        JsonNode cur = root;
        for (String seg : path) {
            cur = child(cur, seg);
            if (cur == null) {
                return null;
            }
        }
        return cur;
    }

    /** JSON text of the value at {@code path}, or null if nothing is there. */
    public String getJson(List<String> path) {
        JsonNode node = get(path);
        return node == null ? null : toJson(node);
    }

    /** Apply one change record. */
    public PatchResult apply(ChangeRecord change) {
        return switch (change.op()) {
            case SET -> set(change.path(), change.json());
            case UPDATE -> update(change.path(), change.json());
            case ERASE -> erase(change.path());
        };
    }

    /** Replace the value at {@code path}. Rejected if {@code json} does not parse or an index is out of reach. */
    public PatchResult set(List<String> path, String json) {
        Objects.requireNonNull(path, "path");
        JsonNode value = parse(json);
        if (value == null || !withinArrayGap(path)) {
            return PatchResult.REJECTED;
        }
        root = setAt(root, path, 0, value);
        return PatchResult.CHANGED;
    }

    /**
     * Shallow key-union merge of a JSON object into the value at {@code path}.
     * <p>
     *  - source is not an object: rejected.
     *  - target is not an object (or absent): replaced by the source wholesale.
     *  - otherwise every top-level member of the source is added to, or
     *    overwrites, the target; nested objects are not merged recursively.
     * Returns UNCHANGED when no member differed.
     */
    public PatchResult update(List<String> path, String json) {
        Objects.requireNonNull(path, "path");
        JsonNode source = parse(json);
        if (source == null || !source.isObject()) {
            return PatchResult.REJECTED;
        }
        JsonNode target = get(path);
        if (target == null || !target.isObject()) {
            if (!withinArrayGap(path)) {
                return PatchResult.REJECTED;
            }
            root = setAt(root, path, 0, source);
            return PatchResult.CHANGED;
        }
        return mergeObject((ObjectNode) target, (ObjectNode) source)
                ? PatchResult.CHANGED
                : PatchResult.UNCHANGED;
    }

    /** Remove the value at {@code path}. Erasing the root resets the document to null. */
    public PatchResult erase(List<String> path) {
        Objects.requireNonNull(path, "path");
        if (path.isEmpty()) {
            if (root.isNull()) {
                return PatchResult.UNCHANGED;
            }
            reset();
            return PatchResult.CHANGED;
        }
        JsonNode parent = get(path.subList(0, path.size() - 1));
        String last = path.get(path.size() - 1);
        if (parent instanceof ObjectNode obj) {
            return obj.remove(last) != null ? PatchResult.CHANGED : PatchResult.UNCHANGED;
        }
        if (parent instanceof ArrayNode arr && isIndex(last)) {
            int idx = Integer.parseInt(last);
            if (idx < arr.size()) {
                arr.remove(idx);
                return PatchResult.CHANGED;
            }
        }
        return PatchResult.UNCHANGED;
    }

    // ---------- helpers ----------

    /**
     * Merge members of {@code source} into {@code target}.
     * Returns true if any member was added or replaced.
     */
    static boolean mergeObject(ObjectNode target, ObjectNode source) {
        boolean diff = false;
        Iterator<Map.Entry<String, JsonNode>> it = source.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode existing = target.get(e.getKey());
            if (existing == null || !existing.equals(e.getValue())) {
                target.set(e.getKey(), e.getValue());
                diff = true;
            }
        }
        return diff;
    }

    private static JsonNode child(JsonNode node, String seg) {
        if (node instanceof ObjectNode obj) {
            return obj.get(seg);
        }
        if (node instanceof ArrayNode arr && isIndex(seg)) {
            int idx = Integer.parseInt(seg);
            return idx < arr.size() ? arr.get(idx) : null;
        }
        return null;
    }

    /** Write {@code value} at {@code path[i..]} below {@code node}; returns the node to store in node's place. */
    private static JsonNode setAt(JsonNode node, List<String> path, int i, JsonNode value) {
        if (i == path.size()) {
            return value;
        }
        String seg = path.get(i);
        if (node instanceof ArrayNode arr) {
            if ("-".equals(seg)) {
                arr.add(setAt(NullNode.getInstance(), path, i + 1, value));
                return arr;
            }
            if (isIndex(seg)) {
                int idx = Integer.parseInt(seg);
                while (arr.size() <= idx) {
                    arr.addNull();
                }
                arr.set(idx, setAt(arr.get(idx), path, i + 1, value));
                return arr;
            }
        }
        ObjectNode obj = node instanceof ObjectNode o ? o : JsonNodeFactory.instance.objectNode();
        JsonNode existing = obj.get(seg);
        obj.set(seg, setAt(existing == null ? NullNode.getInstance() : existing, path, i + 1, value));
        return obj;
    }

    /** False if writing {@code path} would pad an existing array by more than {@link #MAX_ARRAY_GAP}. */
    private boolean withinArrayGap(List<String> path) {
        JsonNode cur = root;
        for (String seg : path) {
            if (cur instanceof ArrayNode arr && isIndex(seg)
                    && Integer.parseInt(seg) - arr.size() > MAX_ARRAY_GAP) {
                return false;
            }
            cur = child(cur, seg);
            if (cur == null) {
                return true;
            }
        }
        return true;
    }

    static boolean isIndex(String seg) {
        if (seg.isEmpty() || seg.length() > 9) {
            return false;
        }
        if (seg.length() > 1 && seg.charAt(0) == '0') {
            return false;
        }
        for (int i = 0; i < seg.length(); i++) {
            char c = seg.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
