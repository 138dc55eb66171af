package com.jreinhal.oplogstats.oplog;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscribes to the inserts and updates of one namespace, strictly after a resume position.
 */
public class ChangeStreamSubscriber {
    private static final Logger log = LoggerFactory.getLogger(ChangeStreamSubscriber.class);
    public static final Set<OplogOperation> WATCHED_OPERATIONS =
            Collections.unmodifiableSet(EnumSet.of(OplogOperation.INSERT, OplogOperation.UPDATE));

    private final ChangeSource changeSource;
    private final String namespace;

    public ChangeStreamSubscriber(ChangeSource changeSource, String namespace) {
        this.changeSource = changeSource;
        this.namespace = namespace;
    }

    public String getNamespace() {
        return this.namespace;
    }

    public ChangeStream subscribe(ResumePosition afterPosition) {
        return this.subscribe(afterPosition, this.namespace, WATCHED_OPERATIONS);
    }

    public ChangeStream subscribe(ResumePosition afterPosition, String namespace, Set<OplogOperation> operationKinds) {
        log.info("Tailing {} for {} after {}", namespace, operationKinds, afterPosition);
        return this.changeSource.tail(OplogFilter.after(afterPosition, namespace, operationKinds));
    }
}
