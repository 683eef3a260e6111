package io.storylink.server.link;

/** Who may write to a link. */
public enum LinkPermissions {
    /** Every connection may write. */
    READ_WRITE,
    /** Only primary connections may write; writes from others are dropped. */
    READ_ONLY_FOR_OTHERS
}
