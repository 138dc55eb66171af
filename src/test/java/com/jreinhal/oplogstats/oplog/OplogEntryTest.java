package com.jreinhal.oplogstats.oplog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Date;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.junit.jupiter.api.Test;

class OplogEntryTest {

    @Test
    void decodesUpdateEntry() {
        Document raw = new Document("ts", new BsonTimestamp(1700000000, 3))
                .append("h", -4213771234L)
                .append("v", 2)
                .append("op", "u")
                .append("ns", "metrics.raw")
                .append("o", new Document("$set", new Document("value", 7)))
                .append("o2", new Document("_id", "abc"));

        OplogEntry entry = OplogEntry.fromDocument(raw);

        assertEquals(ResumePosition.of(1700000000, 3), entry.position());
        assertEquals(-4213771234L, entry.historyId());
        assertEquals(2, entry.version());
        assertEquals(OplogOperation.UPDATE, entry.operation());
        assertEquals("metrics.raw", entry.namespace());
        assertEquals("abc", entry.queryObject().get("_id"));
    }

    @Test
    void missingOptionalFieldsDecodeAsNull() {
        Document raw = new Document("ts", new BsonTimestamp(10, 1))
                .append("op", "n")
                .append("ns", "")
                .append("o", new Document("msg", "periodic noop"));

        OplogEntry entry = OplogEntry.fromDocument(raw);

        assertNull(entry.historyId());
        assertNull(entry.version());
        assertNull(entry.queryObject());
        assertEquals(OplogOperation.NOOP, entry.operation());
    }

    @Test
    void unknownOperationCodeMapsToUnknown() {
        assertEquals(OplogOperation.UNKNOWN, OplogOperation.fromCode("xi"));
        assertEquals(OplogOperation.UNKNOWN, OplogOperation.fromCode(null));
        assertEquals(OplogOperation.UNKNOWN, OplogOperation.fromCode(""));
        assertEquals(OplogOperation.INSERT, OplogOperation.fromCode("I"));
    }

    @Test
    void entryWithoutTimestampIsRejected() {
        Document raw = new Document("op", "i").append("ns", "metrics.raw");

        assertThrows(IllegalArgumentException.class, () -> OplogEntry.fromDocument(raw));
        assertThrows(IllegalArgumentException.class, () -> OplogEntry.fromDocument(null));
    }

    @Test
    void timestampMustBeABsonTimestamp() {
        Document dated = new Document("ts", new Date(1700000000000L)).append("op", "i").append("ns", "metrics.raw");
        Document packed = new Document("ts", 7300000000000000001L).append("op", "i").append("ns", "metrics.raw");

        assertThrows(IllegalArgumentException.class, () -> OplogEntry.fromDocument(dated));
        assertThrows(IllegalArgumentException.class, () -> OplogEntry.fromDocument(packed));
    }

    @Test
    void positionsOrderBySecondsThenIncrement() {
        assertTrue(ResumePosition.of(10, 2).compareTo(ResumePosition.of(10, 1)) > 0);
        assertTrue(ResumePosition.of(11, 0).compareTo(ResumePosition.of(10, 9)) > 0);
        assertEquals(0, ResumePosition.of(10, 1).compareTo(ResumePosition.of(10, 1)));
        assertEquals("Timestamp(10, 1)", ResumePosition.of(10, 1).toString());
    }
}
