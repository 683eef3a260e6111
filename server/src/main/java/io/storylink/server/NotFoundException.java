package io.storylink.server;

/** A story, connection or watcher named in a request does not exist. Maps to HTTP 404. */
public final class NotFoundException extends RuntimeException {
    public NotFoundException(String message) {
        super(message);
    }
}
