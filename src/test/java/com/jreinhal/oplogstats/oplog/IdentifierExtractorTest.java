package com.jreinhal.oplogstats.oplog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jreinhal.oplogstats.model.SeriesId;
import java.util.Optional;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

class IdentifierExtractorTest {
    private final IdentifierExtractor extractor = new IdentifierExtractor();

    private static OplogEntry entry(OplogOperation operation, Document object, Document queryObject) {
        return new OplogEntry(new BsonTimestamp(100, 1), 1L, 2, operation, "metrics.raw", object, queryObject);
    }

    @Test
    void insertYieldsIdOfInsertedDocument() {
        Optional<SeriesId> id = extractor.extract(entry(OplogOperation.INSERT,
                new Document("_id", "abc").append("value", 5), null));

        assertEquals(Optional.of(new SeriesId("abc")), id);
    }

    @Test
    void updateYieldsIdFromSelectorNotPayload() {
        Optional<SeriesId> id = extractor.extract(entry(OplogOperation.UPDATE,
                new Document("$set", new Document("value", 7)), new Document("_id", "abc")));

        assertEquals(Optional.of(new SeriesId("abc")), id);
    }

    @Test
    void updateIgnoresIdInPayloadWhenSelectorIsMissing() {
        Optional<SeriesId> id = extractor.extract(entry(OplogOperation.UPDATE,
                new Document("_id", "from-payload").append("value", 7), null));

        assertTrue(id.isEmpty());
    }

    @Test
    void objectIdIsRenderedAsHex() {
        ObjectId objectId = new ObjectId("5f1d7f0c2b3a4c5d6e7f8091");

        Optional<SeriesId> id = extractor.extract(entry(OplogOperation.INSERT, new Document("_id", objectId), null));

        assertEquals(objectId, id.orElseThrow().value());
        assertEquals("5f1d7f0c2b3a4c5d6e7f8091", id.orElseThrow().toString());
    }

    @Test
    void hexLookingStringIdStaysAString() {
        Optional<SeriesId> id = extractor.extract(entry(OplogOperation.INSERT,
                new Document("_id", "5f1d7f0c2b3a4c5d6e7f8091"), null));

        assertEquals("5f1d7f0c2b3a4c5d6e7f8091", id.orElseThrow().value());
    }

    @Test
    void insertWithoutIdIsDropped() {
        Optional<SeriesId> id = extractor.extract(entry(OplogOperation.INSERT, new Document("value", 5), null));

        assertTrue(id.isEmpty());
    }

    @Test
    void unsupportedIdTypesAreDropped() {
        assertTrue(extractor.extract(entry(OplogOperation.INSERT, new Document("_id", 42), null)).isEmpty());
        assertTrue(extractor.extract(entry(OplogOperation.INSERT, new Document("_id", "  "), null)).isEmpty());
        assertTrue(extractor.extract(entry(OplogOperation.UPDATE, null, new Document("_id", new Document("k", 1))))
                .isEmpty());
    }

    @Test
    void otherOperationsNeverYieldAnId() {
        assertTrue(extractor.extract(entry(OplogOperation.DELETE, new Document("_id", "abc"), null)).isEmpty());
        assertTrue(extractor.extract(entry(OplogOperation.COMMAND, new Document("_id", "abc"), null)).isEmpty());
    }
}
