package io.storylink.core.operation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * FIFO of {@link Operation}s for one owning object; runs at most one at a time.
 * <p>
 * Semantics:
 *  - add(): appends; if the queue is idle the operation starts immediately
 *    on the calling thread.
 *  - When the running operation signals completion, the next queued
 *    operation starts synchronously inside that completion call.
 *  - close(): drops all operations that have not started (their result
 *    futures are cancelled). An operation that is already running may still
 *    complete, but nothing further is started.
 * <p>
 * Invariant: at most one operation body is active per queue. Different queues
 * are fully independent.
 * <p>
 * Thread safety: add() and completion may happen on any thread (e.g. a store
 * notifier thread). Bookkeeping is guarded by a lock; operation bodies are
 * always invoked outside of it.
 */
public final class OperationQueue implements AutoCloseable {
    private static final Logger log = Logger.getLogger(OperationQueue.class.getName());

    private final String name;
    private final OperationObserver observer;

    private final Object lock = new Object();
    private final Deque<Operation<?>> pending = new ArrayDeque<>();
    private Operation<?> active;
    private boolean closed;

    public OperationQueue(String name) {
        this(name, OperationObserver.NONE);
    }

    public OperationQueue(String name, OperationObserver observer) {
        this.name = Objects.requireNonNull(name, "name");
        this.observer = Objects.requireNonNull(observer, "observer");
    }

    public String name() { return name; }

    /**
     * Enqueue an operation.
     *
     * @return the operation's result future. Cancelled if the queue is closed
     *         before the operation starts.
     */
    public <T> CompletableFuture<T> add(Operation<T> op) {
        Objects.requireNonNull(op, "op");
        boolean startNow;
        synchronized (lock) {
            if (closed) {
                log.log(Level.FINE, "{0}: dropping {1}, queue closed", new Object[]{name, op.traceName()});
                op.drop();
                return op.result();
            }
            op.attach(() -> onCompleted(op));
            if (active == null) {
                active = op;
                startNow = true;
            } else {
                pending.addLast(op);
                startNow = false;
            }
        }
        if (startNow) {
            startOperation(op);
        }
        return op.result();
    }

    /** True when no operation is running or waiting. */
    public boolean isIdle() {
        synchronized (lock) {
            return active == null && pending.isEmpty();
        }
    }

    /** Number of operations waiting behind the running one. */
    public int queuedCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /** Drop every operation that has not started yet. Idempotent. */
    @Override
    public void close() {
        List<Operation<?>> dropped;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            dropped = new ArrayList<>(pending);
            pending.clear();
        }
        if (!dropped.isEmpty()) {
            log.log(Level.FINE, "{0}: closed with {1} queued operations dropped",
                    new Object[]{name, dropped.size()});
        }
        for (Operation<?> op : dropped) {
            op.drop();
        }
    }

    // ---------- internals ----------

    private void onCompleted(Operation<?> finished) {
        Operation<?> next;
        synchronized (lock) {
            if (active != finished) {
                // Completion of an operation this queue no longer tracks.
                return;
            }
            if (closed) {
                active = null;
                return;
            }
            next = pending.pollFirst();
            active = next;
        }
        if (next != null) {
            startOperation(next);
        }
    }

    private void startOperation(Operation<?> op) {
        log.log(Level.FINE, "{0}: start {1}", new Object[]{name, op.traceName()});
        observer.started(op.traceName());
        op.start();
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "OperationQueue[" + name + ", active=" + active + ", queued=" + pending.size()
                    + (closed ? ", closed" : "") + "]";
        }
    }
}
