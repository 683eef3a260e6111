package io.storylink.core.operation;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OperationQueueTest {

    /** Operation whose completion is triggered by the test. */
    static final class ManualOperation extends Operation<String> {
        final List<String> log;
        boolean ran;

        ManualOperation(String name, List<String> log) {
            super(name);
            this.log = log;
        }

        @Override
        protected void run() {
            ran = true;
            log.add("run " + traceName());
        }

        void finish() {
            log.add("done " + traceName());
            done(traceName());
        }

        void finishTwice() {
            done(traceName());
            done(traceName());
        }
    }

    @Test
    void operations_run_one_at_a_time_in_fifo_order() {
        var log = new ArrayList<String>();
        var q = new OperationQueue("test");
        var a = new ManualOperation("A", log);
        var b = new ManualOperation("B", log);
        var c = new ManualOperation("C", log);

        q.add(a);
        q.add(b);
        q.add(c);

        // Only A started; B and C wait.
        assertTrue(a.ran);
        assertFalse(b.ran);
        assertEquals(2, q.queuedCount());

        a.finish();
        assertTrue(b.ran);
        assertFalse(c.ran);

        b.finish();
        c.finish();

        assertEquals(List.of("run A", "done A", "run B", "done B", "run C", "done C"), log);
        assertTrue(q.isIdle());
    }

    @Test
    void result_future_carries_the_completion_value() throws Exception {
        var q = new OperationQueue("test");
        var op = new ManualOperation("A", new ArrayList<>());
        CompletableFuture<String> f = q.add(op);
        assertFalse(f.isDone());
        op.finish();
        assertEquals("A", f.get(1, TimeUnit.SECONDS));
    }

    @Test
    void second_completion_is_ignored() {
        var log = new ArrayList<String>();
        var q = new OperationQueue("test");
        var a = new ManualOperation("A", log);
        var b = new ManualOperation("B", log);
        var c = new ManualOperation("C", log);
        q.add(a);
        q.add(b);
        q.add(c);

        a.finishTwice();

        // B started exactly once and C still waits behind it.
        assertTrue(b.ran);
        assertFalse(c.ran);
        assertEquals(Operation.State.RUNNING, b.state());
    }

    @Test
    void close_drops_operations_that_have_not_started() {
        var log = new ArrayList<String>();
        var q = new OperationQueue("test");
        var a = new ManualOperation("A", log);
        var b = new ManualOperation("B", log);
        q.add(a);
        CompletableFuture<String> fb = q.add(b);

        q.close();
        assertTrue(fb.isCancelled());

        // The running operation may still finish but nothing else starts.
        a.finish();
        assertFalse(b.ran);

        // Additions after close are dropped as well.
        var c = new ManualOperation("C", log);
        assertTrue(q.add(c).isCancelled());
        assertFalse(c.ran);
    }

    @Test
    void throwing_body_fails_the_operation_and_the_queue_moves_on() {
        var q = new OperationQueue("test");
        var boom = new Operation<Void>("Boom") {
            @Override
            protected void run() {
                throw new IllegalStateException("boom");
            }
        };
        CompletableFuture<Void> f1 = q.add(boom);
        CompletableFuture<Void> f2 = q.add(new SyncOperation());

        assertTrue(f1.isCompletedExceptionally());
        assertTrue(f2.isDone());
        assertFalse(f2.isCompletedExceptionally());
    }

    @Test
    void sync_operation_completes_after_everything_queued_before_it() {
        var log = new ArrayList<String>();
        var q = new OperationQueue("test");
        var a = new ManualOperation("A", log);
        q.add(a);
        CompletableFuture<Void> sync = q.add(new SyncOperation());
        assertFalse(sync.isDone());
        a.finish();
        assertTrue(sync.isDone());
    }

    @Test
    void nested_queue_delays_the_outer_operation_until_its_sub_steps_finish() {
        var log = new ArrayList<String>();
        var outerQueue = new OperationQueue("outer");
        var inner = new ManualOperation("inner", log);

        var outer = new Operation<Void>("outer") {
            private final OperationQueue sub = new OperationQueue("outer.sub");

            @Override
            protected void run() {
                log.add("run outer");
                sub.add(inner).thenRun(() -> {
                    log.add("done outer");
                    done(null);
                });
            }
        };
        var after = new ManualOperation("after", log);

        outerQueue.add(outer);
        outerQueue.add(after);
        assertFalse(after.ran);

        inner.finish();
        assertTrue(after.ran);
        assertEquals(List.of("run outer", "run inner", "done inner", "done outer", "run after"), log);
    }

    @Test
    void future_operation_completes_with_the_supplied_stage() {
        var q = new OperationQueue("test");
        var pending = new CompletableFuture<Integer>();
        CompletableFuture<Integer> f = q.add(new FutureOperation<>("Fut", () -> pending));
        CompletableFuture<Void> sync = q.add(new SyncOperation());
        assertFalse(sync.isDone());

        pending.complete(7);
        assertEquals(7, f.join());
        assertTrue(sync.isDone());
    }

    @Test
    void observer_sees_every_started_operation_by_trace_name() {
        var seen = new ArrayList<String>();
        var q = new OperationQueue("test", seen::add);
        q.add(new SyncOperation("First"));
        q.add(new SyncOperation());
        assertEquals(List.of("First", "SyncCall"), seen);
    }

    @Test
    void concurrent_adders_never_run_two_bodies_at_once() throws Exception {
        var q = new OperationQueue("test");
        var running = new java.util.concurrent.atomic.AtomicInteger();
        var maxSeen = new java.util.concurrent.atomic.AtomicInteger();
        var completed = new CountDownLatch(400);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 400; i++) {
                pool.submit(() -> q.add(new Operation<Void>("Step") {
                    @Override
                    protected void run() {
                        int now = running.incrementAndGet();
                        maxSeen.accumulateAndGet(now, Math::max);
                        running.decrementAndGet();
                        completed.countDown();
                        done(null);
                    }
                }));
            }
            assertTrue(completed.await(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, maxSeen.get());
        assertTrue(q.isIdle());
    }
}
