package io.storylink.server.link;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * One client's handle on a {@link LinkImpl}.
 * <p>
 * Writes made through a connection carry its id, so watchers registered
 * through the same connection do not hear about them. Closing the last
 * connection of a link makes it orphaned.
 * <p>
 * Calls after close() fail with {@link IllegalStateException}.
 */
public final class LinkConnection implements AutoCloseable {
    private final LinkImpl impl;
    private final int id;
    private final boolean primary;
    private final AtomicBoolean closed = new AtomicBoolean();

    LinkConnection(LinkImpl impl, int id, boolean primary) {
        this.impl = impl;
        this.id = id;
        this.primary = primary;
    }

    public int id() { return id; }

    public boolean isPrimary() { return primary; }

    public boolean isClosed() { return closed.get(); }

    public LinkImpl link() { return impl; }

    /** Watch changes made by every connection except this one. */
    public CompletableFuture<LinkWatcherConnection> watch(LinkWatcher watcher) {
        return ifOpen(() -> impl.watch(watcher, id));
    }

    /** Watch every change, including the ones made through this connection. */
    public CompletableFuture<LinkWatcherConnection> watchAll(LinkWatcher watcher) {
        return ifOpen(() -> impl.watchAll(watcher));
    }

    public CompletableFuture<Void> sync() {
        return ifOpen(impl::sync);
    }

    public CompletableFuture<Void> setSchema(String jsonSchema) {
        return ifOpen(() -> impl.setSchema(jsonSchema));
    }

    public CompletableFuture<String> get(List<String> path) {
        return ifOpen(() -> impl.get(path));
    }

    public CompletableFuture<Void> set(List<String> path, String json) {
        return ifOpen(() -> impl.set(path, json, id));
    }

    public CompletableFuture<Void> update(List<String> path, String json) {
        return ifOpen(() -> impl.update(path, json, id));
    }

    public CompletableFuture<Void> erase(List<String> path) {
        return ifOpen(() -> impl.erase(path, id));
    }

    public CompletableFuture<String> getEntity() {
        return ifOpen(impl::getEntity);
    }

    public CompletableFuture<Void> setEntity(String entityReference) {
        return ifOpen(() -> impl.setEntity(entityReference, id));
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            impl.removeConnection(this);
        }
    }

    private <T> CompletableFuture<T> ifOpen(Supplier<CompletableFuture<T>> call) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("connection " + id + " is closed"));
        }
        return call.get();
    }

    @Override
    public String toString() {
        return "LinkConnection[" + impl.linkPath() + "#" + id + (primary ? ", primary" : "") + "]";
    }
}
