package com.jreinhal.oplogstats.oplog;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.junit.jupiter.api.Test;

class OplogFilterTest {
    private static final ResumePosition POSITION = ResumePosition.of(100, 5);

    private static OplogEntry entry(int seconds, int inc, OplogOperation operation, String namespace) {
        return new OplogEntry(new BsonTimestamp(seconds, inc), null, 2, operation, namespace,
                new Document("_id", "x"), null);
    }

    @Test
    void afterExcludesTheResumeEntryItself() {
        OplogFilter filter = OplogFilter.after(POSITION, "metrics.raw", EnumSet.of(OplogOperation.INSERT));

        assertFalse(filter.matches(entry(100, 5, OplogOperation.INSERT, "metrics.raw")));
        assertFalse(filter.matches(entry(100, 4, OplogOperation.INSERT, "metrics.raw")));
        assertTrue(filter.matches(entry(100, 6, OplogOperation.INSERT, "metrics.raw")));
        assertTrue(filter.matches(entry(101, 0, OplogOperation.INSERT, "metrics.raw")));
    }

    @Test
    void afterRestrictsNamespaceAndOperation() {
        OplogFilter filter = OplogFilter.after(POSITION, "metrics.raw",
                EnumSet.of(OplogOperation.INSERT, OplogOperation.UPDATE));

        assertTrue(filter.matches(entry(200, 1, OplogOperation.UPDATE, "metrics.raw")));
        assertFalse(filter.matches(entry(200, 1, OplogOperation.DELETE, "metrics.raw")));
        assertFalse(filter.matches(entry(200, 1, OplogOperation.INSERT, "metrics.summary")));
    }

    @Test
    void fromIncludesTheStartEntryAndEverythingElse() {
        OplogFilter filter = OplogFilter.from(POSITION);

        assertTrue(filter.inclusive());
        assertTrue(filter.matches(entry(100, 5, OplogOperation.COMMAND, "admin.$cmd")));
        assertTrue(filter.matches(entry(300, 1, OplogOperation.DELETE, "other.coll")));
        assertFalse(filter.matches(entry(99, 1, OplogOperation.INSERT, "metrics.raw")));
    }
}
