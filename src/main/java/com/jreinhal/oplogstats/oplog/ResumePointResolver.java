package com.jreinhal.oplogstats.oplog;

import com.jreinhal.oplogstats.exception.NoResumePointException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the position tailing resumes after: the newest entry already in the log.
 *
 * <p>Must run before subscribing. The subscription then asks for entries strictly greater than
 * this position, since the entry at the position itself has already been observed.</p>
 */
public class ResumePointResolver {
    private static final Logger log = LoggerFactory.getLogger(ResumePointResolver.class);

    private final ChangeSource changeSource;

    public ResumePointResolver(ChangeSource changeSource) {
        this.changeSource = changeSource;
    }

    public ResumePosition resolveResumePosition() {
        ResumePosition position = this.changeSource.latest()
                .map(OplogEntry::position)
                .orElseThrow(() -> new NoResumePointException("Oplog is empty; no position to resume from"));
        log.info("Resuming after oplog position {}", position);
        return position;
    }
}
