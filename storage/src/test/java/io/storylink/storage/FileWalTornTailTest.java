package io.storylink.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTornTailTest {

    @TempDir Path walDir;

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private void writeTornRecord() throws Exception {
        byte[] r3 = RecordCodec.encode("k3", b("v3"));
        Path seg = walDir.resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(r3, 0, r3.length - 2); // header says "len" but payload is short
            out.flush();
        }
    }

    @Test
    void replay_ignores_truncated_tail_and_applies_all_prior_records() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(RecordCodec.encode("k1", b("v1")));
        wal.append(RecordCodec.encode("k2", b("v2")));
        writeTornRecord();
        wal.close();

        var store = new FilePageStore(walDir, 1L << 60);
        assertEquals("v1", store.getSnapshot("k1").join().get(0).valueAsString());
        assertEquals("v2", store.getSnapshot("k2").join().get(0).valueAsString());
        assertTrue(store.getSnapshot("k3").join().isEmpty());
        store.close();
    }

    @Test
    void writes_after_a_torn_tail_are_not_lost() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(RecordCodec.encode("k1", b("v1")));
        writeTornRecord();
        wal.close();

        var store1 = new FilePageStore(walDir, 1L << 60);
        store1.put("k4", b("v4")).join();
        store1.close();

        var store2 = new FilePageStore(walDir, 1L << 60);
        assertEquals(2, store2.size());
        assertEquals("v4", store2.getSnapshot("k4").join().get(0).valueAsString());
        store2.close();
    }

    @Test
    void corrupt_payload_is_detected_by_crc() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        byte[] rec = RecordCodec.encode("k1", b("v1"));
        rec[rec.length - 1] ^= 0x7f;
        wal.append(rec);
        wal.close();

        var reopened = new FileWal(walDir, 1L << 60);
        try (var reader = reopened.openReader()) {
            assertNull(reader.next());
        }
        reopened.close();
    }
}
