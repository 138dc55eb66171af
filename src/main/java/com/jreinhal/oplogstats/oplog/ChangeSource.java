package com.jreinhal.oplogstats.oplog;

import java.util.Optional;

/**
 * A resumable, totally ordered change log.
 */
public interface ChangeSource {

    /**
     * Most recent entry of the log, or empty when the log holds none.
     *
     * @throws com.jreinhal.oplogstats.exception.SourceUnavailableException when the log cannot be read
     */
    Optional<OplogEntry> latest();

    /**
     * Opens an indefinitely blocking subscription delivering the entries accepted by {@code filter}
     * in log order.
     */
    ChangeStream tail(OplogFilter filter);
}
