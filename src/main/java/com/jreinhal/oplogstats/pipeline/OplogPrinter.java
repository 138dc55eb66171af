package com.jreinhal.oplogstats.pipeline;

import com.jreinhal.oplogstats.exception.StreamBrokenException;
import com.jreinhal.oplogstats.oplog.ChangeSource;
import com.jreinhal.oplogstats.oplog.ChangeStream;
import com.jreinhal.oplogstats.oplog.OplogEntry;
import com.jreinhal.oplogstats.oplog.OplogFilter;
import com.jreinhal.oplogstats.oplog.ResumePointResolver;
import com.jreinhal.oplogstats.oplog.ResumePosition;
import com.jreinhal.oplogstats.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diagnostic mode: logs every oplog entry, across all namespaces, starting with the newest one
 * already in the log.
 */
public class OplogPrinter {
    private static final Logger log = LoggerFactory.getLogger(OplogPrinter.class);

    private final ResumePointResolver resumePointResolver;
    private final ChangeSource changeSource;

    public OplogPrinter(ResumePointResolver resumePointResolver, ChangeSource changeSource) {
        this.resumePointResolver = resumePointResolver;
        this.changeSource = changeSource;
    }

    /**
     * Blocks until the stream fails.
     *
     * @throws StreamBrokenException once the tailing cursor is gone
     */
    public void run() {
        ResumePosition position = this.resumePointResolver.resolveResumePosition();
        try (ChangeStream stream = this.changeSource.tail(OplogFilter.from(position))) {
            while (stream.hasNext()) {
                log.info("{}", describe(stream.next()));
            }
        }
        throw new StreamBrokenException("Tailing cursor was closed by the server");
    }

    static String describe(OplogEntry entry) {
        StringBuilder sb = new StringBuilder()
                .append("ts=").append(entry.position())
                .append(" h=").append(entry.historyId())
                .append(" v=").append(entry.version())
                .append(" op=").append(entry.operation())
                .append(" ns=").append(LogSanitizer.sanitize(entry.namespace()))
                .append(" o=").append(LogSanitizer.abbreviate(entry.object()));
        if (entry.queryObject() != null) {
            sb.append(" o2=").append(LogSanitizer.abbreviate(entry.queryObject()));
        }
        return sb.toString();
    }
}
