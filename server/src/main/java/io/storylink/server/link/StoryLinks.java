package io.storylink.server.link;

import io.storylink.core.KeyGenerator;
import io.storylink.core.LinkPath;
import io.storylink.core.operation.Operation;
import io.storylink.core.operation.OperationObserver;
import io.storylink.core.operation.OperationQueue;
import io.storylink.storage.PageStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * All live links of one story.
 * <p>
 * Responsibilities:
 *  - Keep exactly one {@link LinkImpl} per {@link LinkPath}; connecting to a
 *    path reuses the live link or creates it.
 *  - Dispose a link once it has been orphaned (last connection closed and
 *    everything drained).
 *  - Tell link watchers about every link connected through this registry.
 * <p>
 * Connects and disposals are serialized on the story's own queue, so two
 * concurrent connects to a new path create a single link, and a link is
 * never disposed while a connect to it is in progress.
 */
public final class StoryLinks implements AutoCloseable {
    private static final Logger log = Logger.getLogger(StoryLinks.class.getName());

    private final String storyId;
    private final PageStore page;
    private final Supplier<KeyGenerator> keys;
    private final OperationObserver observer;
    private final OperationQueue queue;

    private final Map<LinkPath, LinkImpl> links = new LinkedHashMap<>();
    private final List<Consumer<LinkPath>> linksWatchers = new CopyOnWriteArrayList<>();

    public StoryLinks(String storyId, PageStore page) {
        this(storyId, page, KeyGenerator::new, OperationObserver.NONE);
    }

    public StoryLinks(String storyId, PageStore page, Supplier<KeyGenerator> keys, OperationObserver observer) {
        this.storyId = Objects.requireNonNull(storyId, "storyId");
        this.page = Objects.requireNonNull(page, "page");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.observer = Objects.requireNonNull(observer, "observer");
        this.queue = new OperationQueue("Story " + storyId, observer);
    }

    public String storyId() { return storyId; }

    /**
     * Connect to the link at {@code path}, creating it if it is not live.
     * {@code createLinkInfo} only matters when the link is created here.
     */
    public CompletableFuture<LinkConnection> connectLink(LinkPath path, CreateLinkInfo createLinkInfo,
                                                         ConnectionType type) {
        return queue.add(new ConnectLinkCall(path, createLinkInfo, type));
    }

    /** Paths of the links that are currently live. */
    public List<LinkPath> activeLinks() {
        synchronized (links) {
            return new ArrayList<>(links.keySet());
        }
    }

    /** The live link at {@code path}, or null. */
    public LinkImpl link(LinkPath path) {
        synchronized (links) {
            return links.get(path);
        }
    }

    /**
     * Register a listener told about each link connected through
     * {@link #connectLink}. Returns a handle that unregisters it.
     */
    public AutoCloseable watchLinks(Consumer<LinkPath> listener) {
        Objects.requireNonNull(listener, "listener");
        linksWatchers.add(listener);
        return () -> linksWatchers.remove(listener);
    }

    /** Close every link and drop pending connects. */
    @Override
    public void close() {
        queue.close();
        List<LinkImpl> all;
        synchronized (links) {
            all = new ArrayList<>(links.values());
            links.clear();
        }
        for (LinkImpl link : all) {
            link.close();
        }
        linksWatchers.clear();
        log.log(Level.INFO, "story {0}: closed {1} links", new Object[]{storyId, all.size()});
    }

    /** Dispose an orphaned link once the connects queued before it have run. */
    CompletableFuture<Void> disposeLink(LinkImpl link) {
        return queue.add(new DisposeLinkCall(link));
    }

    private final class ConnectLinkCall extends Operation<LinkConnection> {
        private final LinkPath path;
        private final CreateLinkInfo createLinkInfo;
        private final ConnectionType type;

        ConnectLinkCall(LinkPath path, CreateLinkInfo createLinkInfo, ConnectionType type) {
            super("StoryLinks::ConnectLinkCall");
            this.path = Objects.requireNonNull(path, "path");
            this.createLinkInfo = createLinkInfo;
            this.type = Objects.requireNonNull(type, "type");
        }

        @Override
        protected void run() {
            LinkImpl link;
            synchronized (links) {
                link = links.get(path);
                if (link == null) {
                    link = new LinkImpl(page, path, createLinkInfo, keys.get(), observer);
                    LinkImpl created = link;
                    link.setOrphanedHandler(() -> disposeLink(created));
                    links.put(path, link);
                    log.log(Level.FINE, "story {0}: created link {1}", new Object[]{storyId, path});
                }
            }
            LinkImpl target = link;
            target.connect(type).whenComplete((connection, error) -> {
                if (error != null) {
                    fail(error);
                    return;
                }
                // Hand out the connection only once the link has caught up with the store.
                target.sync().whenComplete((v, e) -> {
                    for (Consumer<LinkPath> w : linksWatchers) {
                        try {
                            w.accept(path);
                        } catch (RuntimeException ex) {
                            log.log(Level.WARNING, "story " + storyId + ": links watcher failed on " + path, ex);
                        }
                    }
                    done(connection);
                });
            });
        }
    }

    private final class DisposeLinkCall extends Operation<Void> {
        private final LinkImpl link;

        DisposeLinkCall(LinkImpl link) {
            super("StoryLinks::DisposeLinkCall");
            this.link = link;
        }

        @Override
        protected void run() {
            boolean removed;
            synchronized (links) {
                // A connect that ran while this call was queued keeps the link alive.
                removed = link.connectionCount() == 0 && links.remove(link.linkPath(), link);
            }
            if (removed) {
                log.log(Level.FINE, "story {0}: disposing orphaned link {1}", new Object[]{storyId, link.linkPath()});
                link.close();
            } else {
                log.log(Level.FINE, "story {0}: link {1} reconnected, kept", new Object[]{storyId, link.linkPath()});
            }
            done(null);
        }
    }
}
