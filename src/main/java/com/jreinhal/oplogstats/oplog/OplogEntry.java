package com.jreinhal.oplogstats.oplog;

import org.bson.BsonTimestamp;
import org.bson.Document;

/**
 * One document of the {@code oplog.rs} collection.
 *
 * @param timestamp  {@code ts}, the position in the log
 * @param historyId  {@code h}, absent on servers that no longer write it
 * @param version    {@code v}, oplog schema version
 * @param operation  {@code op}
 * @param namespace  {@code ns}, {@code <database>.<collection>}
 * @param object     {@code o}, the inserted document or the update payload
 * @param queryObject {@code o2}, the update selector
 */
public record OplogEntry(
        BsonTimestamp timestamp,
        Long historyId,
        Integer version,
        OplogOperation operation,
        String namespace,
        Document object,
        Document queryObject) {

    public static final String FIELD_TS = "ts";
    public static final String FIELD_HISTORY = "h";
    public static final String FIELD_VERSION = "v";
    public static final String FIELD_OP = "op";
    public static final String FIELD_NS = "ns";
    public static final String FIELD_OBJECT = "o";
    public static final String FIELD_QUERY = "o2";

    public ResumePosition position() {
        return new ResumePosition(this.timestamp);
    }

    public static OplogEntry fromDocument(Document raw) {
        if (raw == null) {
            throw new IllegalArgumentException("oplog document is null");
        }
        BsonTimestamp ts = asTimestamp(raw.get(FIELD_TS));
        if (ts == null) {
            throw new IllegalArgumentException("oplog document has no usable ts field");
        }
        return new OplogEntry(
                ts,
                asLong(raw.get(FIELD_HISTORY)),
                asInteger(raw.get(FIELD_VERSION)),
                OplogOperation.fromCode(asString(raw.get(FIELD_OP))),
                asString(raw.get(FIELD_NS)),
                asDocument(raw.get(FIELD_OBJECT)),
                asDocument(raw.get(FIELD_QUERY)));
    }

    private static BsonTimestamp asTimestamp(Object value) {
        return value instanceof BsonTimestamp timestamp ? timestamp : null;
    }

    private static String asString(Object value) {
        return value instanceof String text ? text : null;
    }

    private static Long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : null;
    }

    private static Integer asInteger(Object value) {
        return value instanceof Number number ? number.intValue() : null;
    }

    private static Document asDocument(Object value) {
        return value instanceof Document document ? document : null;
    }
}
