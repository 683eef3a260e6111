package io.storylink.core.operation;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A unit of asynchronous work with a single entry point and a single-shot
 * completion signal.
 * <p>
 * Lifecycle: QUEUED -> RUNNING -> COMPLETED.
 *  - The owning {@link OperationQueue} calls {@link #run()} when the operation
 *    reaches the head of the queue.
 *  - The body may return before the work is finished (e.g. while waiting on a
 *    store callback). The operation only counts as finished once
 *    {@link #done(Object)} (or {@link #fail(Throwable)}) is called.
 *  - Completion is accepted exactly once; later calls are ignored and logged.
 * <p>
 * Success and failure are not distinguished by the queue: both simply let the
 * next operation start. Error handling belongs to the operation itself.
 *
 * @param <T> result type delivered through {@link #result()}
 */
public abstract class Operation<T> {
    private static final Logger log = Logger.getLogger(Operation.class.getName());

    public enum State { QUEUED, RUNNING, COMPLETED }

    private final String traceName;
    private final CompletableFuture<T> result = new CompletableFuture<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.QUEUED);

    // Set by the queue when the operation is added; cleared on completion.
    private volatile Runnable onCompleted;

    protected Operation(String traceName) {
        this.traceName = Objects.requireNonNull(traceName, "traceName");
    }

    /** Human readable name, used for logging and by {@link OperationObserver}s. */
    public final String traceName() { return traceName; }

    public final State state() { return state.get(); }

    /** Future completed with the operation's result once it signals completion. */
    public final CompletableFuture<T> result() { return result; }

    /**
     * Operation body. Called at most once, by the owning queue.
     * Must eventually lead to exactly one call of {@link #done(Object)} or {@link #fail(Throwable)}.
     */
    protected abstract void run();

    /** Signal successful completion. */
    protected final void done(T value) {
        if (!state.compareAndSet(State.RUNNING, State.COMPLETED)) {
            log.log(Level.WARNING, "{0} signaled completion twice or before it started", traceName);
            return;
        }
        Runnable next = onCompleted;
        onCompleted = null;
        result.complete(value);
        if (next != null) {
            next.run();
        }
    }

    /** Signal completion with an error. The queue moves on just like after {@link #done(Object)}. */
    protected final void fail(Throwable error) {
        if (!state.compareAndSet(State.RUNNING, State.COMPLETED)) {
            log.log(Level.WARNING, "{0} signaled failure twice or before it started", traceName);
            return;
        }
        Runnable next = onCompleted;
        onCompleted = null;
        result.completeExceptionally(error);
        if (next != null) {
            next.run();
        }
    }

    // ---------- queue hooks ----------

    void attach(Runnable onCompleted) {
        this.onCompleted = onCompleted;
    }

    /** Transition QUEUED -> RUNNING and invoke the body. A throwing body fails the operation. */
    void start() {
        if (!state.compareAndSet(State.QUEUED, State.RUNNING)) {
            throw new IllegalStateException(traceName + " started twice");
        }
        try {
            run();
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, traceName + " threw from its body", e);
            if (state.get() == State.RUNNING) {
                fail(e);
            }
        }
    }

    /** Drop an operation that never started. */
    void drop() {
        if (state.compareAndSet(State.QUEUED, State.COMPLETED)) {
            onCompleted = null;
            result.cancel(false);
        }
    }

    @Override
    public String toString() {
        return traceName + "[" + state.get() + "]";
    }
}
