package io.storylink.server.link;

import com.fasterxml.jackson.databind.JsonNode;
import io.storylink.core.ChangeLogMerger;
import io.storylink.core.ChangeRecord;
import io.storylink.core.ChangeRecordCodec;
import io.storylink.core.KeyGenerator;
import io.storylink.core.LinkPath;
import io.storylink.core.json.EntityReferences;
import io.storylink.core.json.JsonDocument;
import io.storylink.core.json.PatchResult;
import io.storylink.core.operation.FutureOperation;
import io.storylink.core.operation.Operation;
import io.storylink.core.operation.OperationObserver;
import io.storylink.core.operation.OperationQueue;
import io.storylink.core.operation.SyncOperation;
import io.storylink.core.schema.LinkSchema;
import io.storylink.core.schema.SchemaViolation;
import io.storylink.storage.PageEntry;
import io.storylink.storage.PageStore;
import io.storylink.storage.PageSubscription;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One shared JSON document ("link") of a story, kept as an ordered change log
 * in a {@link PageStore}.
 * <p>
 * Responsibilities:
 *  - Serialize every read and write of the document through one
 *    {@link OperationQueue}.
 *  - Record each local write as a keyed {@link ChangeRecord}, persist it,
 *    and notify watchers (except those on the originating connection).
 *  - Fold change records written elsewhere into the local value: in place
 *    when they arrive in key order, by a full replay of the log otherwise.
 * <p>
 * The document value is never stored directly; it is always the fold of the
 * change log in key order.
 * <p>
 * Threading: public methods may be called from any thread. The document,
 * pending changes and latest key are only touched inside the running
 * operation of the queue.
 */
public final class LinkImpl implements AutoCloseable {
    private static final Logger log = Logger.getLogger(LinkImpl.class.getName());

    /** Connection id of watch-all watchers; never the source of a change. */
    public static final int WATCH_ALL_CONNECTION_ID = 0;
    /** Source id of changes that arrive from the store; matches no connection. */
    public static final int ON_CHANGE_CONNECTION_ID = 1;
    private static final int FIRST_CONNECTION_ID = 2;

    private final PageStore page;
    private final LinkPath linkPath;
    private final CreateLinkInfo createLinkInfo;
    private final KeyGenerator keys;
    private final OperationObserver observer;
    private final OperationQueue queue;

    // Queue-confined state.
    private final JsonDocument doc = new JsonDocument();
    private final List<ChangeRecord> pendingOps = new ArrayList<>();
    private String latestKey = "";
    private LinkSchema schema;

    // Connection bookkeeping, guarded by 'lock'.
    private final Object lock = new Object();
    private final Map<Integer, LinkConnection> connections = new LinkedHashMap<>();
    private final List<PendingConnect> pendingConnects = new ArrayList<>();
    private int nextConnectionId = FIRST_CONNECTION_ID;
    private boolean ready;
    private boolean closed;
    private Runnable orphanedHandler;

    private final Set<Integer> primaryConnectionIds = ConcurrentHashMap.newKeySet();
    private final List<LinkWatcherConnection> watchers = new CopyOnWriteArrayList<>();
    private final PageSubscription subscription;

    private record PendingConnect(boolean primary, CompletableFuture<LinkConnection> result) {}

    private record Flushed(CompletableFuture<LinkConnection> result, LinkConnection connection) {}

    public LinkImpl(PageStore page, LinkPath linkPath, CreateLinkInfo createLinkInfo) {
        this(page, linkPath, createLinkInfo, new KeyGenerator(), OperationObserver.NONE);
    }

    /**
     * @param createLinkInfo seed and permissions for a link that may be new; null to
     *                       attach to an existing link without restrictions
     * @param keys           key source for local changes
     * @param observer       told about every operation this link starts
     */
    public LinkImpl(PageStore page, LinkPath linkPath, CreateLinkInfo createLinkInfo,
                    KeyGenerator keys, OperationObserver observer) {
        this.page = Objects.requireNonNull(page, "page");
        this.linkPath = Objects.requireNonNull(linkPath, "linkPath");
        this.createLinkInfo = createLinkInfo;
        this.keys = Objects.requireNonNull(keys, "keys");
        this.observer = Objects.requireNonNull(observer, "observer");
        this.queue = new OperationQueue("Link " + linkPath, observer);

        // Subscribe before the initial read so no change can fall between the two.
        this.subscription = page.watch(linkPath.changeLogPrefix(), this::onPageChange);
        queue.add(new ReloadCall(true)).whenComplete((v, e) -> flushPendingConnects());
    }

    public LinkPath linkPath() { return linkPath; }

    // ---------- connections ----------

    /**
     * Open a connection. Before the initial load has finished the request is
     * buffered; buffered requests are served in arrival order.
     */
    public CompletableFuture<LinkConnection> connect(ConnectionType type) {
        Objects.requireNonNull(type, "type");
        boolean primary = type == ConnectionType.PRIMARY;
        synchronized (lock) {
            if (closed) {
                return CompletableFuture.failedFuture(new IllegalStateException("link " + linkPath + " is closed"));
            }
            if (!ready) {
                var result = new CompletableFuture<LinkConnection>();
                pendingConnects.add(new PendingConnect(primary, result));
                return result;
            }
            return CompletableFuture.completedFuture(newConnection(primary));
        }
    }

    /**
     * Install the callback that runs when the last connection has closed and
     * every queued operation has drained. It runs on the link's queue thread.
     */
    public void setOrphanedHandler(Runnable handler) {
        synchronized (lock) {
            orphanedHandler = handler;
        }
    }

    public int connectionCount() {
        synchronized (lock) {
            return connections.size();
        }
    }

    public int watcherCount() {
        return watchers.size();
    }

    public boolean isReady() {
        synchronized (lock) {
            return ready;
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    // ---------- document API ----------

    /** JSON text of the value at {@code path}, or null if there is none. */
    public CompletableFuture<String> get(List<String> path) {
        return queue.add(new GetCall(path));
    }

    public CompletableFuture<Void> set(List<String> path, String json, int src) {
        return queue.add(new IncrementalChangeCall(ChangeRecord.set(path, json), src));
    }

    public CompletableFuture<Void> update(List<String> path, String json, int src) {
        return queue.add(new IncrementalChangeCall(ChangeRecord.update(path, json), src));
    }

    public CompletableFuture<Void> erase(List<String> path, int src) {
        return queue.add(new IncrementalChangeCall(ChangeRecord.erase(path), src));
    }

    /** Replace the whole value with an entity reference envelope. */
    public CompletableFuture<Void> setEntity(String entityReference, int src) {
        Objects.requireNonNull(entityReference, "entityReference");
        return set(List.of(), EntityReferences.toJson(entityReference), src);
    }

    /** The entity reference held by the value, or null if the value is not one. */
    public CompletableFuture<String> getEntity() {
        return queue.add(new GetEntityCall());
    }

    /** Install a schema for advisory validation. An invalid schema removes the current one. */
    public CompletableFuture<Void> setSchema(String jsonSchema) {
        return queue.add(new SetSchemaCall(jsonSchema));
    }

    /**
     * Register a watcher bound to connection {@code connectionId}. The watcher
     * receives the current value first, then every later change not made
     * through that connection.
     */
    public CompletableFuture<LinkWatcherConnection> watch(LinkWatcher watcher, int connectionId) {
        return queue.add(new WatchCall(watcher, connectionId));
    }

    public CompletableFuture<LinkWatcherConnection> watchAll(LinkWatcher watcher) {
        return watch(watcher, WATCH_ALL_CONNECTION_ID);
    }

    /** Completes once everything enqueued before it, including store writes, has finished. */
    public CompletableFuture<Void> sync() {
        return queue.add(new SyncOperation());
    }

    /** Destroy the link: pending operations are dropped and watchers detached. */
    @Override
    public void close() {
        List<PendingConnect> dropped;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            dropped = new ArrayList<>(pendingConnects);
            pendingConnects.clear();
            connections.clear();
            orphanedHandler = null;
        }
        queue.close();
        subscription.close();
        for (LinkWatcherConnection w : watchers) {
            w.markClosed();
        }
        watchers.clear();
        for (PendingConnect p : dropped) {
            p.result().cancel(false);
        }
        log.log(Level.FINE, "link {0} closed", linkPath);
    }

    // ---------- store notifications ----------

    void onPageChange(PageEntry entry) {
        if (linkPath.changeKeyOf(entry.key()) == null) {
            return;
        }
        ChangeRecord change;
        try {
            change = ChangeRecordCodec.decode(entry.value());
        } catch (IllegalArgumentException e) {
            log.log(Level.WARNING, "link " + linkPath + ": ignoring unreadable change " + entry.key(), e);
            return;
        }
        queue.add(new IncrementalChangeCall(change, ON_CHANGE_CONNECTION_ID));
    }

    // ---------- internals ----------

    private LinkConnection newConnection(boolean primary) {
        int id = nextConnectionId++;
        if (primary) {
            primaryConnectionIds.add(id);
        }
        var connection = new LinkConnection(this, id, primary);
        connections.put(id, connection);
        log.log(Level.FINE, "link {0}: connection {1} opened", new Object[]{linkPath, id});
        return connection;
    }

    private void flushPendingConnects() {
        List<Flushed> flush;
        synchronized (lock) {
            if (closed) {
                return;
            }
            ready = true;
            flush = new ArrayList<>(pendingConnects.size());
            for (PendingConnect p : pendingConnects) {
                flush.add(new Flushed(p.result(), newConnection(p.primary())));
            }
            pendingConnects.clear();
        }
        for (Flushed f : flush) {
            f.result().complete(f.connection());
        }
    }

    void removeConnection(LinkConnection connection) {
        boolean orphaned;
        synchronized (lock) {
            if (connections.remove(connection.id()) == null) {
                return;
            }
            orphaned = connections.isEmpty() && orphanedHandler != null;
        }
        for (LinkWatcherConnection w : watchers) {
            if (w.connectionId() == connection.id()) {
                w.close();
            }
        }
        log.log(Level.FINE, "link {0}: connection {1} closed", new Object[]{linkPath, connection.id()});

        // Connections can be re-established by name while the sync runs, so the
        // orphaned state is checked again once everything has drained.
        if (orphaned) {
            sync().thenRun(() -> {
                Runnable handler;
                synchronized (lock) {
                    handler = connections.isEmpty() ? orphanedHandler : null;
                }
                if (handler != null) {
                    handler.run();
                }
            });
        }
    }

    /** Local changes whose echo has not come back from the store yet. */
    CompletableFuture<Integer> pendingChangeCount() {
        return queue.add(new Operation<Integer>("LinkImpl::PendingChangeCountCall") {
            @Override
            protected void run() {
                done(pendingOps.size());
            }
        });
    }

    void removeWatcher(LinkWatcherConnection watcher) {
        watchers.remove(watcher);
    }

    private boolean isClientReadOnly(int src) {
        if (src == ON_CHANGE_CONNECTION_ID) {
            // The link's own writes (the initial seed) are never restricted.
            return false;
        }
        return createLinkInfo != null
                && createLinkInfo.permissions() == LinkPermissions.READ_ONLY_FOR_OTHERS
                && !primaryConnectionIds.contains(src);
    }

    private void notifyWatchers(int src) {
        String value = doc.toJson();
        for (LinkWatcherConnection w : watchers) {
            try {
                w.notify(value, src);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "link " + linkPath + ": watcher failed, removing it", e);
                w.close();
            }
        }
    }

    private void validateSchema(String entryPoint, ChangeRecord change) {
        LinkSchema s = schema;
        if (s == null) {
            return;
        }
        List<SchemaViolation> violations = s.validate(doc.root());
        if (violations.isEmpty()) {
            return;
        }
        log.log(Level.WARNING, "Schema constraint violation in {0}: {1} (API {2}, path {3}, json {4})",
                new Object[]{linkPath, violations.get(0), entryPoint, change.path(), change.json()});
    }

    /** Decode the change records of a store snapshot, sorted by key. Unreadable entries are skipped. */
    private List<ChangeRecord> decodeHistory(List<PageEntry> entries) {
        var out = new ArrayList<ChangeRecord>(entries.size());
        for (PageEntry e : entries) {
            if (linkPath.changeKeyOf(e.key()) == null) {
                continue;
            }
            try {
                out.add(ChangeRecordCodec.decode(e.value()));
            } catch (IllegalArgumentException ex) {
                log.log(Level.WARNING, "link " + linkPath + ": skipping unreadable change " + e.key(), ex);
            }
        }
        out.sort(ChangeRecord.BY_KEY);
        return out;
    }

    /** Rebuild the value from {@code history} merged with the unconfirmed local changes. */
    private void replay(List<ChangeRecord> history) {
        JsonNode before = doc.snapshot();
        List<ChangeRecord> merged = ChangeLogMerger.merge(history, pendingOps);
        doc.reset();
        for (ChangeRecord change : merged) {
            if (doc.apply(change) == PatchResult.REJECTED) {
                log.log(Level.WARNING, "link {0}: change {1} could not be applied during replay",
                        new Object[]{linkPath, change.key()});
            }
        }
        latestKey = merged.isEmpty() ? "" : merged.get(merged.size() - 1).key();
        log.log(Level.FINE, "link {0}: replayed {1} changes ({2} pending), latest key {3}",
                new Object[]{linkPath, merged.size(), pendingOps.size(), latestKey});
        if (!before.equals(doc.root())) {
            notifyWatchers(ON_CHANGE_CONNECTION_ID);
        }
    }

    private OperationQueue subQueue(String owner) {
        return new OperationQueue(owner + " " + linkPath, observer);
    }

    // ---------- operations ----------

    /**
     * Load the change log from the store and rebuild the value from it.
     * The initial load also plants the seed value of a brand new link.
     */
    private final class ReloadCall extends Operation<Void> {
        private final boolean initial;
        private final OperationQueue operationQueue = subQueue("LinkImpl::ReloadCall");

        ReloadCall(boolean initial) {
            super("LinkImpl::ReloadCall");
            this.initial = initial;
        }

        @Override
        protected void run() {
            operationQueue.add(new FutureOperation<>("ReadAllDataCall",
                            () -> page.getSnapshot(linkPath.changeLogPrefix())))
                    .whenComplete((entries, error) -> {
                        if (error != null) {
                            log.log(Level.SEVERE, traceName() + " " + linkPath + ": reading the change log failed", error);
                            done(null);
                            return;
                        }
                        try {
                            load(entries);
                        } catch (RuntimeException e) {
                            log.log(Level.SEVERE, traceName() + " " + linkPath + ": rebuilding the value failed", e);
                            done(null);
                        }
                    });
        }

        private void load(List<PageEntry> entries) {
            List<ChangeRecord> history = decodeHistory(entries);
            String seed = createLinkInfo == null ? null : createLinkInfo.initialData();
            if (initial && history.isEmpty() && seed != null) {
                operationQueue.add(new IncrementalChangeCall(ChangeRecord.set(List.of(), seed), ON_CHANGE_CONNECTION_ID))
                        .whenComplete((v, e) -> done(null));
                return;
            }
            replay(history);
            done(null);
        }
    }

    /**
     * Apply one change. A change without a key is a local write: it gets a key,
     * is applied, persisted and announced. A keyed change came from the store
     * and is either the echo of a local write, the next change in key order,
     * or an out-of-order arrival that forces a replay.
     */
    private final class IncrementalChangeCall extends Operation<Void> {
        private final ChangeRecord change;
        private final int src;
        private final OperationQueue operationQueue = subQueue("LinkImpl::IncrementalChangeCall");

        IncrementalChangeCall(ChangeRecord change, int src) {
            super("LinkImpl::IncrementalChangeCall");
            this.change = change;
            this.src = src;
        }

        @Override
        protected void run() {
            if (change.hasKey()) {
                applyRemote();
            } else {
                applyLocal();
            }
        }

        private void applyLocal() {
            if (isClientReadOnly(src)) {
                log.log(Level.WARNING, "{0} {1}: no write access for connection {2}",
                        new Object[]{traceName(), linkPath, src});
                done(null);
                return;
            }
            ChangeRecord keyed = change.withKey(keys.create());
            PatchResult result = doc.apply(keyed);
            switch (result) {
                case REJECTED -> {
                    log.log(Level.WARNING, "{0} {1}: {2} at {3} rejected, payload {4}",
                            new Object[]{traceName(), linkPath, keyed.op(), keyed.path(), keyed.json()});
                    done(null);
                    return;
                }
                case UNCHANGED -> {
                    log.log(Level.FINE, "{0} {1}: {2} at {3} changed nothing",
                            new Object[]{traceName(), linkPath, keyed.op(), keyed.path()});
                    done(null);
                    return;
                }
                case CHANGED -> {
                }
            }
            pendingOps.add(keyed);
            boolean behind = keyed.key().compareTo(latestKey) < 0;
            if (!behind) {
                latestKey = keyed.key();
            }
            validateSchema(traceName(), keyed);

            // Watchers hear about the change once its write has been issued, not confirmed.
            CompletableFuture<Void> written = operationQueue.add(new IncrementalWriteCall(keyed));
            notifyWatchers(src);
            if (!behind) {
                written.whenComplete((v, e) -> done(null));
                return;
            }
            // A change with a later key is already folded in, so the value is
            // rebuilt in key order once this write has been issued.
            log.log(Level.FINE, "{0} {1}: local change {2} sorts behind {3}, replaying",
                    new Object[]{traceName(), linkPath, keyed.key(), latestKey});
            operationQueue.add(new ReloadCall(false)).whenComplete((v, e) -> done(null));
        }

        private void applyRemote() {
            String key = change.key();
            // Echo of a local write; echoes may arrive in any order.
            if (pendingOps.removeIf(c -> c.key().equals(key))) {
                done(null);
                return;
            }
            if (key.equals(latestKey)) {
                log.log(Level.FINE, "{0} {1}: change {2} already applied", new Object[]{traceName(), linkPath, key});
                done(null);
                return;
            }
            if (key.compareTo(latestKey) < 0) {
                log.log(Level.FINE, "{0} {1}: change {2} arrived behind {3}, replaying",
                        new Object[]{traceName(), linkPath, key, latestKey});
                operationQueue.add(new ReloadCall(false)).whenComplete((v, e) -> done(null));
                return;
            }
            JsonNode before = doc.snapshot();
            if (doc.apply(change) == PatchResult.REJECTED) {
                log.log(Level.WARNING, "{0} {1}: remote change {2} could not be applied",
                        new Object[]{traceName(), linkPath, key});
            }
            latestKey = key;
            validateSchema(traceName(), change);
            if (!before.equals(doc.root())) {
                notifyWatchers(ON_CHANGE_CONNECTION_ID);
            }
            done(null);
        }
    }

    /** Persist one keyed change record. Failures are logged, never retried. */
    private final class IncrementalWriteCall extends Operation<Void> {
        private final ChangeRecord change;
        private final OperationQueue operationQueue = subQueue("LinkImpl::IncrementalWriteCall");

        IncrementalWriteCall(ChangeRecord change) {
            super("LinkImpl::IncrementalWriteCall");
            this.change = change;
        }

        @Override
        protected void run() {
            String storageKey = linkPath.changeKey(change.key());
            operationQueue.add(new FutureOperation<>("WriteDataCall",
                            () -> page.put(storageKey, ChangeRecordCodec.encode(change))))
                    .whenComplete((v, error) -> {
                        if (error != null) {
                            log.log(Level.SEVERE, traceName() + " " + storageKey + ": write failed", error);
                        }
                        done(null);
                    });
        }
    }

    private final class GetCall extends Operation<String> {
        private final List<String> path;

        GetCall(List<String> path) {
            super("LinkImpl::GetCall");
            this.path = List.copyOf(path);
        }

        @Override
        protected void run() {
            done(doc.getJson(path));
        }
    }

    private final class GetEntityCall extends Operation<String> {
        private final OperationQueue operationQueue = subQueue("LinkImpl::GetEntityCall");

        GetEntityCall() {
            super("LinkImpl::GetEntityCall");
        }

        @Override
        protected void run() {
            operationQueue.add(new GetCall(List.of()))
                    .whenComplete((json, error) -> done(error == null ? EntityReferences.fromJson(json) : null));
        }
    }

    private final class SetSchemaCall extends Operation<Void> {
        private final String jsonSchema;

        SetSchemaCall(String jsonSchema) {
            super("LinkImpl::SetSchemaCall");
            this.jsonSchema = jsonSchema;
        }

        @Override
        protected void run() {
            try {
                schema = LinkSchema.compile(jsonSchema);
            } catch (IllegalArgumentException e) {
                log.log(Level.WARNING, "{0} {1}: schema not installed: {2}",
                        new Object[]{traceName(), linkPath, e.getMessage()});
                schema = null;
            }
            done(null);
        }
    }

    private final class WatchCall extends Operation<LinkWatcherConnection> {
        private final LinkWatcher watcher;
        private final int connectionId;

        WatchCall(LinkWatcher watcher, int connectionId) {
            super("LinkImpl::WatchCall");
            this.watcher = Objects.requireNonNull(watcher, "watcher");
            this.connectionId = connectionId;
        }

        @Override
        protected void run() {
            boolean open;
            synchronized (lock) {
                open = connectionId == WATCH_ALL_CONNECTION_ID || connections.containsKey(connectionId);
            }
            if (!open) {
                fail(new IllegalStateException("no open connection " + connectionId + " on " + linkPath));
                return;
            }
            var registration = new LinkWatcherConnection(LinkImpl.this, watcher, connectionId);
            registration.deliver(doc.toJson());
            watchers.add(registration);
            done(registration);
        }
    }
}
