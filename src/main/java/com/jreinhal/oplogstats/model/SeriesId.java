package com.jreinhal.oplogstats.model;

import java.util.Optional;
import org.bson.types.ObjectId;

/**
 * Identifier of a raw series document, i.e. its {@code _id} value as stored.
 *
 * <p>Only {@link ObjectId} and non-blank {@link String} ids are recognised.</p>
 */
public record SeriesId(Object value) {

    public SeriesId {
        if (!(value instanceof ObjectId) && !(value instanceof String)) {
            throw new IllegalArgumentException("Unsupported series id type: "
                    + (value == null ? "null" : value.getClass().getName()));
        }
    }

    public static Optional<SeriesId> from(Object raw) {
        if (raw instanceof ObjectId objectId) {
            return Optional.of(new SeriesId(objectId));
        }
        if (raw instanceof String text && !text.isBlank()) {
            return Optional.of(new SeriesId(text));
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        if (this.value instanceof ObjectId objectId) {
            return objectId.toHexString();
        }
        return (String) this.value;
    }
}
