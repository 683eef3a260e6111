package io.storylink.core.json;

/** Outcome of applying one patch operation to a {@link JsonDocument}. */
public enum PatchResult {
    /** The document value changed. */
    CHANGED,
    /** Input was valid but the document already had that value. */
    UNCHANGED,
    /** Input was malformed (unparseable JSON, non-object merge source); nothing was touched. */
    REJECTED
}
