package io.storylink.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x5A1C
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - key:   int32 len + UTF-8 bytes
 *     - value: int32 len + bytes
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x5A1C;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private RecordCodec() {
    }

    /** Encode one page entry into header+payload bytes ready for append. */
    static byte[] encode(String key, byte[] value) {
        byte[] k = key.getBytes(StandardCharsets.UTF_8);
        ByteBuffer payload = ByteBuffer.allocate(4 + k.length + 4 + value.length).order(ByteOrder.LITTLE_ENDIAN);
        payload.putInt(k.length).put(k);
        payload.putInt(value.length).put(value);
        byte[] body = payload.array();

        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + body.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(body.length).putInt(crc32(body));
        out.put(body);
        return out.array();
    }

    /**
     * Decode a payload (without header).
     *
     * @throws IllegalArgumentException if the payload is structurally invalid
     */
    static PageEntry decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        try {
            String key = new String(readBytes(b), StandardCharsets.UTF_8);
            byte[] value = readBytes(b);
            return new PageEntry(key, value);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("corrupt WAL payload", e);
        }
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalArgumentException("bad length " + len);
        }
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }
}
