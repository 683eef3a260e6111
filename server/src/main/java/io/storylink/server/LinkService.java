package io.storylink.server;

import io.storylink.core.LinkPath;
import io.storylink.server.link.ConnectionType;
import io.storylink.server.link.CreateLinkInfo;
import io.storylink.server.link.LinkConnection;
import io.storylink.server.link.LinkWatcher;
import io.storylink.server.link.LinkWatcherConnection;
import io.storylink.server.link.StoryLinks;
import io.storylink.storage.PageStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Application service behind the HTTP layer.
 *
 * Responsibilities:
 *  - Own one {@link StoryLinks} (and its page store) per story, created on
 *    first use.
 *  - Keep the open {@link LinkConnection}s so requests can address them by
 *    (story, link path, connection id).
 *  - Buffer watcher notifications until a client drains them.
 *  - Turn the asynchronous link API into blocking calls with a timeout.
 */
public class LinkService implements AutoCloseable {
    private static final Logger log = Logger.getLogger(LinkService.class.getName());

    private static final Pattern STORY_ID = Pattern.compile("[A-Za-z0-9_-][A-Za-z0-9._-]{0,127}");
    static final int MAX_BUFFERED_NOTIFICATIONS = 1024;
    private static final long CALL_TIMEOUT_SECONDS = 10;

    private final Function<String, PageStore> storeFactory;
    private final Map<String, Story> stories = new ConcurrentHashMap<>();
    private final Map<SessionKey, LinkConnection> connections = new ConcurrentHashMap<>();
    private final Map<Long, WatchBuffer> watchers = new ConcurrentHashMap<>();
    private final AtomicLong nextWatcherId = new AtomicLong(1);

    private record Story(PageStore store, StoryLinks links) {}

    /** Address of an open connection. */
    public record SessionKey(String storyId, LinkPath linkPath, int connectionId) {}

    /**
     * @param storeFactory creates the page store of a story the first time it is used
     */
    public LinkService(Function<String, PageStore> storeFactory) {
        this.storeFactory = Objects.requireNonNull(storeFactory, "storeFactory");
    }

    // ---------- connections ----------

    public LinkConnection connect(String storyId, LinkPath path, boolean primary, CreateLinkInfo info) {
        Story story = story(storyId);
        ConnectionType type = primary ? ConnectionType.PRIMARY : ConnectionType.SECONDARY;
        LinkConnection connection = await(story.links().connectLink(path, info, type));
        connections.put(new SessionKey(storyId, path, connection.id()), connection);
        log.log(Level.FINE, "story {0}: opened connection {1} on {2}", new Object[]{storyId, connection.id(), path});
        return connection;
    }

    public LinkConnection connection(SessionKey key) {
        LinkConnection connection = connections.get(key);
        if (connection == null) {
            throw new NotFoundException("no connection " + key.connectionId() + " on " + key.linkPath());
        }
        return connection;
    }

    /** Close a connection and drop the watchers registered through it. */
    public void disconnect(SessionKey key) {
        LinkConnection connection = connections.remove(key);
        if (connection == null) {
            throw new NotFoundException("no connection " + key.connectionId() + " on " + key.linkPath());
        }
        watchers.values().removeIf(w -> {
            if (w.owner.equals(key)) {
                w.close();
                return true;
            }
            return false;
        });
        connection.close();
    }

    /** Paths of the live links of a story; empty for a story nobody has connected to. */
    public List<LinkPath> activeLinks(String storyId) {
        Story story = stories.get(checkStoryId(storyId));
        return story == null ? List.of() : story.links().activeLinks();
    }

    // ---------- watchers ----------

    /**
     * Register a buffering watcher on a connection.
     *
     * @param all true to also buffer changes made through this connection
     * @return the watcher id to drain with {@link #drain}
     */
    public long watch(SessionKey key, boolean all) {
        LinkConnection connection = connection(key);
        long id = nextWatcherId.getAndIncrement();
        var buffer = new WatchBuffer(id, key);
        buffer.registration = await(all ? connection.watchAll(buffer) : connection.watch(buffer));
        watchers.put(id, buffer);
        return id;
    }

    /** Take every notification buffered for a watcher, oldest first. */
    public List<String> drain(SessionKey key, long watcherId) {
        WatchBuffer buffer = watchers.get(watcherId);
        if (buffer == null || !buffer.owner.equals(key)) {
            throw new NotFoundException("no watcher " + watcherId + " on connection " + key.connectionId());
        }
        return buffer.drain();
    }

    /** Wait for a link call to finish, surfacing its failure as an unchecked exception. */
    public <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(CALL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("link call failed", e.getCause());
        } catch (CancellationException e) {
            throw new IllegalStateException("link call cancelled, link closed", e);
        } catch (TimeoutException e) {
            throw new IllegalStateException("link call timed out after " + CALL_TIMEOUT_SECONDS + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for link call", e);
        }
    }

    @Override
    public void close() {
        watchers.values().forEach(WatchBuffer::close);
        watchers.clear();
        connections.clear();
        for (Map.Entry<String, Story> e : stories.entrySet()) {
            e.getValue().links().close();
            try {
                e.getValue().store().close();
            } catch (RuntimeException ex) {
                log.log(Level.SEVERE, "closing page store of story " + e.getKey() + " failed", ex);
            }
        }
        stories.clear();
    }

    // ---------- internals ----------

    private Story story(String storyId) {
        return stories.computeIfAbsent(checkStoryId(storyId), id -> {
            PageStore store = storeFactory.apply(id);
            log.log(Level.INFO, "story {0}: opened page store", id);
            return new Story(store, new StoryLinks(id, store));
        });
    }

    private static String checkStoryId(String storyId) {
        if (storyId == null || !STORY_ID.matcher(storyId).matches()) {
            throw new IllegalArgumentException("story id must match " + STORY_ID.pattern());
        }
        return storyId;
    }

    /** Bounded FIFO of values delivered to one watcher; the oldest value is dropped on overflow. */
    private static final class WatchBuffer implements LinkWatcher {
        private final long id;
        private final SessionKey owner;
        private final Deque<String> values = new ArrayDeque<>();
        private volatile LinkWatcherConnection registration;

        WatchBuffer(long id, SessionKey owner) {
            this.id = id;
            this.owner = owner;
        }

        @Override
        public synchronized void notify(String json) {
            if (values.size() == MAX_BUFFERED_NOTIFICATIONS) {
                values.removeFirst();
                log.log(Level.FINE, "watcher {0}: buffer full, dropped oldest notification", id);
            }
            values.addLast(json);
        }

        synchronized List<String> drain() {
            var out = new ArrayList<>(values);
            values.clear();
            return out;
        }

        void close() {
            LinkWatcherConnection r = registration;
            if (r != null) {
                r.close();
            }
        }
    }
}
