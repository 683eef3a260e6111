package io.storylink.core;

/**
 * The three patch operations a link's change log can hold.
 * <ul>
 *   <li>SET:    replace the value at the path.</li>
 *   <li>UPDATE: shallow key-union merge of an object into the value at the path.</li>
 *   <li>ERASE:  remove the value at the path.</li>
 * </ul>
 */
public enum ChangeOp {
    SET, UPDATE, ERASE;

    /** True for operations that carry a JSON payload. */
    public boolean hasPayload() {
        return switch (this) {
            case SET, UPDATE -> true;
            case ERASE -> false;
        };
    }
}
