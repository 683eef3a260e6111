package io.storylink.server.link;

/**
 * Kind of a link connection. A PRIMARY connection may always write, even to a
 * link created {@link LinkPermissions#READ_ONLY_FOR_OTHERS}.
 */
public enum ConnectionType {
    PRIMARY,
    SECONDARY
}
