package io.storylink.server.link;

import io.storylink.storage.InMemoryPageStore;
import io.storylink.storage.PageEntry;
import io.storylink.storage.PageStore;
import io.storylink.storage.PageSubscription;
import io.storylink.storage.PageWatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/** Hand-written page store doubles for link tests. */
final class FakePageStores {

    private FakePageStores() {
    }

    /** In-memory store that delivers notifications inline on the writer's thread. */
    static InMemoryPageStore direct() {
        return new InMemoryPageStore(Runnable::run);
    }

    /** Executor that holds tasks until the test runs them. */
    static final class ManualExecutor implements Executor {
        private final List<Runnable> tasks = new ArrayList<>();

        @Override
        public synchronized void execute(Runnable command) {
            tasks.add(command);
        }

        synchronized int pending() {
            return tasks.size();
        }

        /** Run the task at {@code index} among the pending ones. */
        void runAt(int index) {
            Runnable r;
            synchronized (this) {
                r = tasks.remove(index);
            }
            r.run();
        }

        void runAll() {
            while (pending() > 0) {
                runAt(0);
            }
        }
    }

    /** Store whose snapshot reads stay pending until released. */
    static final class GatedPageStore implements PageStore {
        private final InMemoryPageStore delegate = direct();
        private final List<Runnable> gated = new ArrayList<>();

        @Override
        public CompletableFuture<Void> put(String key, byte[] value) {
            return delegate.put(key, value);
        }

        @Override
        public synchronized CompletableFuture<List<PageEntry>> getSnapshot(String prefix) {
            var result = new CompletableFuture<List<PageEntry>>();
            gated.add(() -> delegate.getSnapshot(prefix).thenAccept(result::complete));
            return result;
        }

        @Override
        public PageSubscription watch(String prefix, PageWatcher watcher) {
            return delegate.watch(prefix, watcher);
        }

        void release() {
            List<Runnable> run;
            synchronized (this) {
                run = new ArrayList<>(gated);
                gated.clear();
            }
            run.forEach(Runnable::run);
        }

        @Override
        public void close() {
            delegate.close();
        }
    }

    /** Store whose writes always fail. */
    static final class FailingPageStore implements PageStore {
        private final InMemoryPageStore delegate = direct();
        int attemptedWrites;

        @Override
        public CompletableFuture<Void> put(String key, byte[] value) {
            attemptedWrites++;
            return CompletableFuture.failedFuture(new IllegalStateException("store unavailable"));
        }

        @Override
        public CompletableFuture<List<PageEntry>> getSnapshot(String prefix) {
            return delegate.getSnapshot(prefix);
        }

        @Override
        public PageSubscription watch(String prefix, PageWatcher watcher) {
            return delegate.watch(prefix, watcher);
        }

        @Override
        public void close() {
            delegate.close();
        }
    }

    /** Store whose writes are applied only when the test releases them. */
    static final class HeldWritesPageStore implements PageStore {
        private final InMemoryPageStore delegate = direct();
        private final List<Runnable> held = new ArrayList<>();

        @Override
        public synchronized CompletableFuture<Void> put(String key, byte[] value) {
            var result = new CompletableFuture<Void>();
            held.add(() -> delegate.put(key, value).thenAccept(result::complete));
            return result;
        }

        @Override
        public CompletableFuture<List<PageEntry>> getSnapshot(String prefix) {
            return delegate.getSnapshot(prefix);
        }

        @Override
        public PageSubscription watch(String prefix, PageWatcher watcher) {
            return delegate.watch(prefix, watcher);
        }

        void release() {
            List<Runnable> run;
            synchronized (this) {
                run = new ArrayList<>(held);
                held.clear();
            }
            run.forEach(Runnable::run);
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
