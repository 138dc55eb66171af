package com.jreinhal.oplogstats.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import org.bson.Document;

/**
 * One time bucket of observations for a metric key.
 *
 * Written by upstream producers; this service only reads it.
 */
public class RawSeries {
    public static final String FIELD_ID = "_id";
    public static final String FIELD_KEY = "key";
    public static final String FIELD_AT = "at";
    public static final String FIELD_VALUES = "values";
    public static final String FIELD_VALUE = "value";

    // ObjectId or String, exactly as stored
    private Object id;

    private String key;

    // bucket start, stored as an int64
    private long at;

    private List<Datapoint> values = new ArrayList<>();

    public RawSeries() {
    }

    public RawSeries(Object id, String key, long at, List<Datapoint> values) {
        this.id = id;
        this.key = key;
        this.at = at;
        this.values = values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    /**
     * Maps a stored raw series document.
     *
     * @throws IllegalArgumentException if a datapoint carries a non-numeric value
     */
    public static RawSeries fromDocument(Document raw) {
        List<Datapoint> points = new ArrayList<>();
        Object stored = raw.get(FIELD_VALUES);
        if (stored instanceof List<?> list) {
            for (Object item : list) {
                if (!(item instanceof Document point)) {
                    throw new IllegalArgumentException("datapoint of raw series " + raw.get(FIELD_ID)
                            + " is not a document");
                }
                Object value = point.get(FIELD_VALUE);
                if (!(value instanceof Number number)) {
                    throw new IllegalArgumentException("datapoint of raw series " + raw.get(FIELD_ID)
                            + " has no numeric value");
                }
                points.add(new Datapoint(asInstant(point.get(FIELD_AT)), number.doubleValue()));
            }
        }
        return new RawSeries(raw.get(FIELD_ID), asString(raw.get(FIELD_KEY)), asLong(raw.get(FIELD_AT)), points);
    }

    public Object getId() {
        return id;
    }

    public void setId(Object id) {
        this.id = id;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public long getAt() {
        return at;
    }

    public void setAt(long at) {
        this.at = at;
    }

    public List<Datapoint> getValues() {
        return values;
    }

    public void setValues(List<Datapoint> values) {
        this.values = values;
    }

    public double[] sortedValues() {
        if (this.values == null || this.values.isEmpty()) {
            return new double[0];
        }
        return this.values.stream()
                .mapToDouble(Datapoint::getValue)
                .sorted()
                .toArray();
    }

    private static String asString(Object value) {
        return value instanceof String text ? text : null;
    }

    private static long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private static Instant asInstant(Object value) {
        return value instanceof Date date ? date.toInstant() : null;
    }

    @Override
    public String toString() {
        return "RawSeries{id=" + id + ", key=" + key + ", at=" + at
                + ", values=" + (values == null ? 0 : values.size()) + "}";
    }

    public static class Datapoint {
        private Instant at;
        private double value;

        public Datapoint() {
        }

        public Datapoint(Instant at, double value) {
            this.at = at;
            this.value = value;
        }

        public Instant getAt() {
            return at;
        }

        public void setAt(Instant at) {
            this.at = at;
        }

        public double getValue() {
            return value;
        }

        public void setValue(double value) {
            this.value = value;
        }
    }
}
