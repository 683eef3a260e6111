package io.storylink.server.link;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A registered {@link LinkWatcher}, bound to the connection id it was
 * registered through ({@link LinkImpl#WATCH_ALL_CONNECTION_ID} for watch-all).
 * <p>
 * A change is not delivered to watchers bound to the connection it came
 * from. The watch-all id never originates a change, so watch-all watchers
 * see everything.
 */
public final class LinkWatcherConnection implements AutoCloseable {
    private final LinkImpl impl;
    private final LinkWatcher watcher;
    private final int connectionId;
    private final AtomicBoolean closed = new AtomicBoolean();

    LinkWatcherConnection(LinkImpl impl, LinkWatcher watcher, int connectionId) {
        this.impl = impl;
        this.watcher = Objects.requireNonNull(watcher, "watcher");
        this.connectionId = connectionId;
    }

    public int connectionId() { return connectionId; }

    public boolean isClosed() { return closed.get(); }

    void notify(String value, int src) {
        if (connectionId != src) {
            deliver(value);
        }
    }

    void deliver(String value) {
        if (!closed.get()) {
            watcher.notify(value);
        }
    }

    /** Stop notifications and unregister from the link. */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            impl.removeWatcher(this);
        }
    }

    void markClosed() {
        closed.set(true);
    }
}
