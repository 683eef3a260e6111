package io.storylink.storage;

/**
 * Write-ahead log backing {@link FilePageStore}.
 * <p>
 * Contract:
 *  - append() is atomic at record granularity: a partial write is treated
 *    as absent during recovery (the reader stops at the first corrupt or
 *    truncated record).
 *  - append() fsyncs the record before returning, so a record whose append
 *    returned survives a crash.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single framed record and fsync it.
     *
     * @param serializedRecord header+payload bytes from {@link RecordCodec#encode}
     */
    void append(byte[] serializedRecord);

    /** Start a new segment once the current one has grown past the rotation threshold. */
    void rotateIfNeeded();

    /**
     * Open a sequential reader over every segment, oldest first.
     */
    WalReader openReader();

    @Override
    void close();

    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (without header), or null at the end of
         *         the log or at the first corrupt/truncated record
         */
        byte[] next();

        @Override
        void close();
    }
}
