package com.jreinhal.oplogstats.oplog;

import java.util.Iterator;

/**
 * In-order, blocking view of the oplog from a subscription point onwards.
 *
 * <p>{@link #hasNext()} blocks until an entry is available. It returns {@code false} only once
 * the underlying cursor is gone (closed here or by the server). Driver failures surface as
 * {@link com.jreinhal.oplogstats.exception.StreamBrokenException}. A stream cannot be restarted.</p>
 */
public interface ChangeStream extends Iterator<OplogEntry>, AutoCloseable {

    /**
     * Releases the cursor. Safe to call from another thread to unblock a waiting reader.
     */
    @Override
    void close();
}
