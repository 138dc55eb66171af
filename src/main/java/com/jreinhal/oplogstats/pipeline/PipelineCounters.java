package com.jreinhal.oplogstats.pipeline;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-run counters. Each counter has a single writing stage.
 */
public class PipelineCounters {
    private final AtomicLong entriesTailed = new AtomicLong();
    private final AtomicLong identifiersExtracted = new AtomicLong();
    private final AtomicLong entriesDropped = new AtomicLong();
    private final AtomicLong summariesWritten = new AtomicLong();
    private final AtomicLong emptySeriesSkipped = new AtomicLong();
    private final AtomicLong missingSeriesSkipped = new AtomicLong();

    void entryTailed() {
        this.entriesTailed.incrementAndGet();
    }

    void identifierExtracted() {
        this.identifiersExtracted.incrementAndGet();
    }

    void entryDropped() {
        this.entriesDropped.incrementAndGet();
    }

    void summaryWritten() {
        this.summariesWritten.incrementAndGet();
    }

    void emptySeriesSkipped() {
        this.emptySeriesSkipped.incrementAndGet();
    }

    void missingSeriesSkipped() {
        this.missingSeriesSkipped.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(this.entriesTailed.get(), this.identifiersExtracted.get(), this.entriesDropped.get(),
                this.summariesWritten.get(), this.emptySeriesSkipped.get(), this.missingSeriesSkipped.get());
    }

    public record Snapshot(long entriesTailed, long identifiersExtracted, long entriesDropped,
                           long summariesWritten, long emptySeriesSkipped, long missingSeriesSkipped) {
    }
}
