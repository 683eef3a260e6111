package io.storylink.storage;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Narrow view of a versioned key-value store, as consumed by links.
 * <p>
 * Contract:
 *  - put() writes one entry. The future fails if the write could not be made
 *    durable; there is no retry at this layer.
 *  - getSnapshot() is a point-in-time read of every entry under a prefix,
 *    sorted by key ascending.
 *  - watch() pushes every later change under a prefix to the watcher. Delivery
 *    is asynchronous, in write order, and includes this process's own writes.
 * <p>
 * Implementations must be safe for use from multiple threads.
 */
public interface PageStore extends AutoCloseable {

    CompletableFuture<Void> put(String key, byte[] value);

    CompletableFuture<List<PageEntry>> getSnapshot(String prefix);

    PageSubscription watch(String prefix, PageWatcher watcher);

    @Override
    void close();
}
