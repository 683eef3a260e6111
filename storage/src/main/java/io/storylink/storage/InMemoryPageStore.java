package io.storylink.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Page store kept entirely in memory.
 * <p>
 * Responsibilities:
 *  - Hold entries in a sorted map so prefix reads are a single range scan.
 *  - Fan out every put to the watchers whose prefix matches.
 * <p>
 * Notification model:
 *  - Watchers are called on the notifier {@link Executor}, never on the
 *    writer's thread (unless the caller passes a direct executor).
 *  - The default notifier is a single daemon thread, so notifications arrive
 *    in write order.
 * <p>
 * Several links sharing one instance behave like the same link open on
 * different devices of a synchronized store.
 */
public class InMemoryPageStore implements PageStore {
    private static final Logger log = Logger.getLogger(InMemoryPageStore.class.getName());

    private final NavigableMap<String, byte[]> entries = new ConcurrentSkipListMap<>();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Executor notifier;
    private final ExecutorService ownedNotifier;
    private volatile boolean closed;

    /** Store with its own single notifier thread. */
    public InMemoryPageStore() {
        ExecutorService ex = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "page-store-notifier");
            t.setDaemon(true);
            return t;
        });
        this.notifier = ex;
        this.ownedNotifier = ex;
    }

    /** Store that dispatches notifications on the given executor (not shut down on close). */
    public InMemoryPageStore(Executor notifier) {
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.ownedNotifier = null;
    }

    @Override
    public CompletableFuture<Void> put(String key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("page store closed"));
        }
        byte[] copy = value.clone();
        synchronized (this) {
            entries.put(key, copy);
            publish(new PageEntry(key, copy));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<List<PageEntry>> getSnapshot(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        var out = new ArrayList<PageEntry>();
        for (Map.Entry<String, byte[]> e : entries.tailMap(prefix, true).entrySet()) {
            if (!e.getKey().startsWith(prefix)) {
                break;
            }
            out.add(new PageEntry(e.getKey(), e.getValue()));
        }
        return CompletableFuture.completedFuture(out);
    }

    @Override
    public PageSubscription watch(String prefix, PageWatcher watcher) {
        var sub = new Subscription(Objects.requireNonNull(prefix, "prefix"), Objects.requireNonNull(watcher, "watcher"));
        subscriptions.add(sub);
        return sub;
    }

    /** Number of entries currently stored. */
    public int size() {
        return entries.size();
    }

    /**
     * Insert an entry without notifying watchers. Used to seed the map from a
     * durable log during recovery.
     */
    void load(String key, byte[] value) {
        entries.put(key, value);
    }

    @Override
    public void close() {
        closed = true;
        subscriptions.clear();
        if (ownedNotifier != null) {
            ownedNotifier.shutdown();
        }
    }

    // Called under the instance lock so notifications are queued in write order.
    private void publish(PageEntry entry) {
        for (Subscription sub : subscriptions) {
            if (!entry.key().startsWith(sub.prefix)) {
                continue;
            }
            try {
                notifier.execute(() -> sub.deliver(entry));
            } catch (RejectedExecutionException e) {
                log.log(Level.FINE, "notifier rejected change for {0}, store closing", entry.key());
            }
        }
    }

    private final class Subscription implements PageSubscription {
        private final String prefix;
        private final PageWatcher watcher;
        private volatile boolean active = true;

        Subscription(String prefix, PageWatcher watcher) {
            this.prefix = prefix;
            this.watcher = watcher;
        }

        void deliver(PageEntry entry) {
            if (!active) {
                return;
            }
            try {
                watcher.onChange(entry);
            } catch (RuntimeException e) {
                log.log(Level.SEVERE, "page watcher for prefix " + prefix + " failed on " + entry.key(), e);
            }
        }

        @Override
        public void close() {
            active = false;
            subscriptions.remove(this);
        }
    }
}
