package io.storylink.storage;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPageStoreTest {

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void snapshot_returns_only_the_prefix_sorted_by_key() {
        try (var store = new InMemoryPageStore(Runnable::run)) {
            store.put("Link/m/a/2", b("two"));
            store.put("Link/m/a/1", b("one"));
            store.put("Link/m/ab/1", b("other link"));
            store.put("Link/m/b/1", b("elsewhere"));

            List<PageEntry> snap = store.getSnapshot("Link/m/a/").join();

            assertEquals(List.of("Link/m/a/1", "Link/m/a/2"), snap.stream().map(PageEntry::key).toList());
            assertEquals("one", snap.get(0).valueAsString());
        }
    }

    @Test
    void later_put_overwrites_earlier_value() {
        try (var store = new InMemoryPageStore(Runnable::run)) {
            store.put("k", b("v1"));
            store.put("k", b("v2"));
            assertEquals("v2", store.getSnapshot("k").join().get(0).valueAsString());
            assertEquals(1, store.size());
        }
    }

    @Test
    void watchers_see_matching_writes_including_their_own() {
        try (var store = new InMemoryPageStore(Runnable::run)) {
            var seen = new ArrayList<String>();
            store.watch("Link/m/a/", e -> seen.add(e.key()));

            store.put("Link/m/a/1", b("x"));
            store.put("Link/m/b/1", b("y"));
            store.put("Link/m/a/2", b("z"));

            assertEquals(List.of("Link/m/a/1", "Link/m/a/2"), seen);
        }
    }

    @Test
    void closed_subscription_receives_nothing() {
        try (var store = new InMemoryPageStore(Runnable::run)) {
            var seen = new ArrayList<String>();
            PageSubscription sub = store.watch("", e -> seen.add(e.key()));
            store.put("a", b("1"));
            sub.close();
            store.put("b", b("2"));
            assertEquals(List.of("a"), seen);
        }
    }

    @Test
    void default_notifier_delivers_asynchronously_in_write_order() throws Exception {
        try (var store = new InMemoryPageStore()) {
            var seen = new CopyOnWriteArrayList<String>();
            var latch = new CountDownLatch(50);
            var writer = Thread.currentThread();
            var offThread = new java.util.concurrent.atomic.AtomicBoolean(true);
            store.watch("k/", e -> {
                if (Thread.currentThread() == writer) offThread.set(false);
                seen.add(e.valueAsString());
                latch.countDown();
            });
            var expected = new ArrayList<String>();
            for (int i = 0; i < 50; i++) {
                store.put("k/" + i, b(Integer.toString(i)));
                expected.add(Integer.toString(i));
            }
            assertTrue(latch.await(5, TimeUnit.SECONDS));
            assertEquals(expected, seen);
            assertTrue(offThread.get());
        }
    }

    @Test
    void a_throwing_watcher_does_not_block_others() {
        try (var store = new InMemoryPageStore(Runnable::run)) {
            var seen = new ArrayList<String>();
            store.watch("", e -> { throw new IllegalStateException("boom"); });
            store.watch("", e -> seen.add(e.key()));
            store.put("a", b("1"));
            assertEquals(List.of("a"), seen);
        }
    }

    @Test
    void stored_values_are_isolated_from_the_callers_array() {
        try (var store = new InMemoryPageStore(Runnable::run)) {
            byte[] value = b("abc");
            store.put("k", value);
            value[0] = 'X';
            assertEquals("abc", store.getSnapshot("k").join().get(0).valueAsString());
        }
    }

    @Test
    void put_after_close_fails() {
        var store = new InMemoryPageStore(Runnable::run);
        store.close();
        assertTrue(store.put("k", b("v")).isCompletedExceptionally());
    }
}
