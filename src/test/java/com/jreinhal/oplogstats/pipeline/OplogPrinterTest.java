package com.jreinhal.oplogstats.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.jreinhal.oplogstats.exception.NoResumePointException;
import com.jreinhal.oplogstats.exception.StreamBrokenException;
import com.jreinhal.oplogstats.oplog.OplogEntry;
import com.jreinhal.oplogstats.oplog.OplogFilter;
import com.jreinhal.oplogstats.oplog.OplogOperation;
import com.jreinhal.oplogstats.oplog.ResumePointResolver;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.junit.jupiter.api.Test;

class OplogPrinterTest {

    @Test
    void tailsEveryNamespaceFromTheNewestEntryInclusive() throws Exception {
        InMemoryChangeSource source = new InMemoryChangeSource();
        source.insert("old");
        OplogEntry newest = source.append(OplogOperation.COMMAND, "admin.$cmd", new Document("create", "x"), null);
        OplogPrinter printer = new OplogPrinter(new ResumePointResolver(source), source);

        CompletableFuture<Void> running = CompletableFuture.runAsync(printer::run);
        assertThat(source.awaitSubscription()).isTrue();
        source.append(OplogOperation.DELETE, "other.coll", new Document("_id", 1), null);
        source.closeStreams();

        assertThatThrownBy(() -> running.get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(StreamBrokenException.class);
        OplogFilter filter = source.filters().get(0);
        assertThat(filter.inclusive()).isTrue();
        assertThat(filter.position()).isEqualTo(newest.position());
        assertThat(filter.namespace()).isNull();
        assertThat(filter.operations()).isEmpty();
    }

    @Test
    void emptyLogFailsBeforeSubscribing() {
        InMemoryChangeSource source = new InMemoryChangeSource();
        OplogPrinter printer = new OplogPrinter(new ResumePointResolver(source), source);

        assertThatThrownBy(printer::run).isInstanceOf(NoResumePointException.class);
        assertThat(source.filters()).isEmpty();
    }

    @Test
    void describesEveryOplogField() {
        OplogEntry entry = new OplogEntry(new BsonTimestamp(12, 3), 99L, 2, OplogOperation.UPDATE, "metrics.raw",
                new Document("$set", new Document("value", 7)), new Document("_id", "abc"));

        assertThat(OplogPrinter.describe(entry))
                .isEqualTo("ts=Timestamp(12, 3) h=99 v=2 op=UPDATE ns=metrics.raw"
                        + " o={\"$set\": {\"value\": 7}} o2={\"_id\": \"abc\"}");
    }
}
