package io.storylink.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * File-backed WAL that appends framed records to numbered segment files
 * ("00000001.log", "00000002.log", ...).
 * <p>
 *  - On construction: creates the directory if needed and opens a fresh
 *    segment after the newest non-empty one, so nothing is ever appended
 *    behind a torn record left by a crash.
 *  - append(): writes, fsyncs (data and metadata), counts bytes in segment.
 *  - rotateIfNeeded(): once the segment reaches rotateBytes, opens the next one.
 *  - Reader: walks all segments in name order; within a segment validates
 *    magic/version/length/CRC and abandons the rest of that segment at the
 *    first bad or truncated record.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());
    private static final String SUFFIX = ".log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) {
            throw new IllegalArgumentException("rotateBytes must be > 0");
        }
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL append failed on " + current, e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            current = dir.resolve(segmentName(indexOf(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
            log.log(Level.FINE, "WAL rotated to {0}", current.getFileName());
        } catch (IOException e) {
            throw new UncheckedIOException("WAL rotation failed", e);
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(segments(dir));
    }

    /** Current segment files, oldest first. */
    List<Path> segments() {
        return segments(dir);
    }

    @Override
    public synchronized void close() {
        if (ch == null) return;
        try {
            ch.close();
        } catch (IOException e) {
            throw new UncheckedIOException("WAL close failed", e);
        }
    }

    private void openNewestOrCreate() {
        List<Path> all = segments(dir);
        try {
            if (all.isEmpty()) {
                current = dir.resolve(segmentName(1));
            } else {
                Path newest = all.get(all.size() - 1);
                current = Files.size(newest) == 0 ? newest : dir.resolve(segmentName(indexOf(newest) + 1));
            }
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot open WAL segment " + current, e);
        }
    }

    private static int indexOf(Path segment) {
        return Integer.parseInt(segment.getFileName().toString().replace(SUFFIX, ""));
    }

    private static String segmentName(int index) {
        return String.format("%08d%s", index, SUFFIX);
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list WAL directory " + dir, e);
        }
    }

    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segmentIndex = -1;
        private FileChannel ch;
        private long pos;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            try {
                while (true) {
                    if (ch == null && !openNext()) {
                        return null;
                    }
                    ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
                    int read = ch.read(hdr, pos);
                    if (read <= 0) {
                        // clean end of this segment
                        ch.close();
                        ch = null;
                        continue;
                    }
                    if (read < RecordCodec.HEADER_BYTES) {
                        skipSegment("truncated header");
                        continue;
                    }
                    hdr.flip();
                    short magic = hdr.getShort();
                    byte ver = hdr.get();
                    int len = hdr.getInt();
                    int crc = hdr.getInt();
                    if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) {
                        skipSegment("bad header");
                        continue;
                    }
                    if (len > ch.size() - pos - RecordCodec.HEADER_BYTES) {
                        skipSegment("truncated payload");
                        continue;
                    }
                    ByteBuffer payload = ByteBuffer.allocate(len);
                    while (payload.hasRemaining()) {
                        if (ch.read(payload, pos + RecordCodec.HEADER_BYTES + payload.position()) < 0) {
                            break;
                        }
                    }
                    if (payload.hasRemaining()) {
                        skipSegment("truncated payload");
                        continue;
                    }
                    byte[] bytes = payload.array();
                    if (RecordCodec.crc32(bytes) != crc) {
                        skipSegment("CRC mismatch");
                        continue;
                    }
                    pos += RecordCodec.HEADER_BYTES + (long) len;
                    return bytes;
                }
            } catch (IOException e) {
                throw new UncheckedIOException("WAL read failed", e);
            }
        }

        private boolean openNext() throws IOException {
            segmentIndex++;
            if (segmentIndex >= segments.size()) {
                return false;
            }
            ch = FileChannel.open(segments.get(segmentIndex), READ);
            pos = 0;
            return true;
        }

        private void skipSegment(String reason) throws IOException {
            log.log(Level.WARNING, "WAL segment {0} ends in a torn record at offset {1} ({2}); rest ignored",
                    new Object[]{segments.get(segmentIndex).getFileName(), pos, reason});
            ch.close();
            ch = null;
        }

        @Override
        public void close() {
            if (ch == null) return;
            try {
                ch.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
