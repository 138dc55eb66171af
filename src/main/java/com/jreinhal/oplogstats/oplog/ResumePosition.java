package com.jreinhal.oplogstats.oplog;

import java.util.Objects;
import org.bson.BsonTimestamp;

/**
 * Position of an oplog entry: the {@code ts} timestamp (seconds plus intra-second increment).
 * The only valid resume token.
 */
public record ResumePosition(BsonTimestamp timestamp) implements Comparable<ResumePosition> {

    public ResumePosition {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static ResumePosition of(int seconds, int increment) {
        return new ResumePosition(new BsonTimestamp(seconds, increment));
    }

    @Override
    public int compareTo(ResumePosition other) {
        return this.timestamp.compareTo(other.timestamp);
    }

    @Override
    public String toString() {
        return "Timestamp(" + this.timestamp.getTime() + ", " + this.timestamp.getInc() + ")";
    }
}
