package io.storylink.storage;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable page store.
 * <p>
 * Responsibilities:
 *  - On put:
 *      1) Frame key+value as a WAL record.
 *      2) Append+fsync to the WAL.
 *      3) Apply to the in-memory view, which notifies watchers.
 *      4) Rotate the WAL segment if needed.
 *  - On startup:
 *      1) Replay every WAL segment in order into the in-memory view
 *         (later puts of a key overwrite earlier ones).
 * <p>
 * A failed append surfaces as a failed future and leaves the in-memory view
 * untouched.
 */
public class FilePageStore implements PageStore {
    private static final Logger log = Logger.getLogger(FilePageStore.class.getName());

    private final Wal wal;
    private final InMemoryPageStore memory;

    public FilePageStore(Path dir, long rotateBytes) {
        this(new FileWal(dir, rotateBytes), new InMemoryPageStore());
    }

    public FilePageStore(Wal wal, InMemoryPageStore memory) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.memory = Objects.requireNonNull(memory, "memory");
        recover();
    }

    @Override
    public synchronized CompletableFuture<Void> put(String key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        try {
            wal.append(RecordCodec.encode(key, value));
            wal.rotateIfNeeded();
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "durable write of " + key + " failed", e);
            return CompletableFuture.failedFuture(e);
        }
        return memory.put(key, value);
    }

    @Override
    public CompletableFuture<List<PageEntry>> getSnapshot(String prefix) {
        return memory.getSnapshot(prefix);
    }

    @Override
    public PageSubscription watch(String prefix, PageWatcher watcher) {
        return memory.watch(prefix, watcher);
    }

    public int size() {
        return memory.size();
    }

    @Override
    public void close() {
        memory.close();
        wal.close();
    }

    private void recover() {
        int count = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                PageEntry e = RecordCodec.decode(payload);
                memory.load(e.key(), e.value());
                count++;
            }
        } catch (RuntimeException e) {
            throw new IllegalStateException("page store recovery failed", e);
        }
        log.log(Level.INFO, "page store recovered {0} records ({1} keys)", new Object[]{count, memory.size()});
    }
}
