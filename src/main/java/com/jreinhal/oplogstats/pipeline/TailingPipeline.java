package com.jreinhal.oplogstats.pipeline;

import com.jreinhal.oplogstats.exception.PipelineException;
import com.jreinhal.oplogstats.exception.PipelineStage;
import com.jreinhal.oplogstats.exception.SeriesNotFoundException;
import com.jreinhal.oplogstats.exception.StageFailureException;
import com.jreinhal.oplogstats.exception.StreamBrokenException;
import com.jreinhal.oplogstats.model.SeriesId;
import com.jreinhal.oplogstats.model.SevenNumberSummary;
import com.jreinhal.oplogstats.oplog.ChangeStream;
import com.jreinhal.oplogstats.oplog.ChangeStreamSubscriber;
import com.jreinhal.oplogstats.oplog.IdentifierExtractor;
import com.jreinhal.oplogstats.oplog.OplogEntry;
import com.jreinhal.oplogstats.oplog.ResumePointResolver;
import com.jreinhal.oplogstats.oplog.ResumePosition;
import com.jreinhal.oplogstats.service.SummaryRecomputationService;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolve, tail, extract, recompute.
 *
 * <p>Tail, extract and recompute each run on their own thread, joined by unbuffered
 * {@link SynchronousQueue} handoffs: a slow recomputation blocks extraction, which blocks
 * tailing, which leaves further entries in the server-side cursor. Entries move in strict log
 * order and recomputations run one at a time in arrival order, so a stale summary can never
 * overwrite a fresher one for the same series.</p>
 *
 * <p>The first failure of any stage halts all of them. {@link #run()} returns it as a
 * {@link PipelineTermination} instead of terminating the process, so the caller decides whether
 * to exit or to start a new run from {@link PipelineTermination#restartPosition()}.</p>
 */
public class TailingPipeline {
    private static final Logger log = LoggerFactory.getLogger(TailingPipeline.class);
    static final int STAGE_COUNT = 3;

    private final ResumePointResolver resumePointResolver;
    private final ChangeStreamSubscriber subscriber;
    private final IdentifierExtractor extractor;
    private final SummaryRecomputationService recomputationService;
    private final ThreadFactory threadFactory;
    private final boolean skipMissingSeries;
    private final Duration shutdownGrace;

    public TailingPipeline(ResumePointResolver resumePointResolver, ChangeStreamSubscriber subscriber,
                           IdentifierExtractor extractor, SummaryRecomputationService recomputationService,
                           ThreadFactory threadFactory, boolean skipMissingSeries, Duration shutdownGrace) {
        this.resumePointResolver = resumePointResolver;
        this.subscriber = subscriber;
        this.extractor = extractor;
        this.recomputationService = recomputationService;
        this.threadFactory = threadFactory;
        this.skipMissingSeries = skipMissingSeries;
        this.shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(10) : shutdownGrace;
    }

    /**
     * Runs until the first stage failure.
     *
     * @throws InterruptedException if the calling thread is interrupted; the stages are halted first
     */
    public PipelineTermination run() throws InterruptedException {
        PipelineCounters counters = new PipelineCounters();
        ResumePosition resumePosition;
        ChangeStream stream;
        try {
            resumePosition = this.resumePointResolver.resolveResumePosition();
        } catch (PipelineException ex) {
            return new PipelineTermination(ex, null, null, counters.snapshot());
        }
        try {
            stream = this.subscriber.subscribe(resumePosition);
        } catch (PipelineException ex) {
            return new PipelineTermination(ex, resumePosition, null, counters.snapshot());
        }
        return new Run(stream, resumePosition, counters).await();
    }

    @FunctionalInterface
    private interface StageBody {
        void run() throws InterruptedException;
    }

    private record SeriesChange(SeriesId seriesId, ResumePosition position) {
    }

    private final class Run {
        private final ChangeStream stream;
        private final ResumePosition resumedAfter;
        private final PipelineCounters counters;
        private final BlockingQueue<OplogEntry> entries = new SynchronousQueue<>();
        private final BlockingQueue<SeriesChange> changes = new SynchronousQueue<>();
        private final CompletableFuture<PipelineException> firstFailure = new CompletableFuture<>();
        private final AtomicReference<ResumePosition> lastRecomputed = new AtomicReference<>();
        private final ExecutorService executor;

        private Run(ChangeStream stream, ResumePosition resumedAfter, PipelineCounters counters) {
            this.stream = stream;
            this.resumedAfter = resumedAfter;
            this.counters = counters;
            this.executor = Executors.newFixedThreadPool(STAGE_COUNT, TailingPipeline.this.threadFactory);
        }

        PipelineTermination await() throws InterruptedException {
            PipelineException failure;
            try {
                this.executor.execute(this.guarded(PipelineStage.TAIL, this::tail));
                this.executor.execute(this.guarded(PipelineStage.EXTRACT, this::extract));
                this.executor.execute(this.guarded(PipelineStage.RECOMPUTE, this::recompute));
                failure = this.firstFailure.get();
            } catch (ExecutionException ex) {
                throw new IllegalStateException("failure handle completed exceptionally", ex);
            } finally {
                this.halt();
            }
            return new PipelineTermination(failure, this.resumedAfter, this.lastRecomputed.get(),
                    this.counters.snapshot());
        }

        private void tail() throws InterruptedException {
            while (this.stream.hasNext()) {
                OplogEntry entry = this.stream.next();
                this.counters.entryTailed();
                this.entries.put(entry);
            }
            throw new StreamBrokenException("Tailing cursor was closed by the server");
        }

        private void extract() throws InterruptedException {
            while (!this.halted()) {
                OplogEntry entry = this.entries.take();
                if (this.halted()) {
                    return;
                }
                Optional<SeriesId> seriesId = TailingPipeline.this.extractor.extract(entry);
                if (seriesId.isEmpty()) {
                    this.counters.entryDropped();
                    continue;
                }
                this.counters.identifierExtracted();
                this.changes.put(new SeriesChange(seriesId.get(), entry.position()));
            }
        }

        private void recompute() throws InterruptedException {
            while (!this.halted()) {
                SeriesChange change = this.changes.take();
                if (this.halted()) {
                    return;
                }
                log.debug("Recomputing summary for raw series {}", change.seriesId());
                try {
                    Optional<SevenNumberSummary> summary =
                            TailingPipeline.this.recomputationService.recompute(change.seriesId());
                    if (summary.isPresent()) {
                        this.counters.summaryWritten();
                    } else {
                        this.counters.emptySeriesSkipped();
                    }
                } catch (SeriesNotFoundException ex) {
                    if (!TailingPipeline.this.skipMissingSeries) {
                        throw ex;
                    }
                    this.counters.missingSeriesSkipped();
                    log.warn("Skipping raw series {} at {}: it no longer exists", ex.getSeriesId(), change.position());
                }
                this.lastRecomputed.set(change.position());
            }
        }

        private Runnable guarded(PipelineStage stage, StageBody body) {
            return () -> {
                try {
                    body.run();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    if (!this.halted()) {
                        this.fail(new StageFailureException(stage, ex));
                    }
                } catch (PipelineException ex) {
                    this.fail(ex);
                } catch (RuntimeException ex) {
                    this.fail(new StageFailureException(stage, ex));
                }
            };
        }

        private void fail(PipelineException failure) {
            if (this.firstFailure.complete(failure)) {
                log.error("Halting pipeline: {}", failure.describe());
            } else if (log.isDebugEnabled()) {
                log.debug("Ignoring follow-up failure after halt: {}", failure.describe());
            }
        }

        private boolean halted() {
            return this.firstFailure.isDone();
        }

        private void halt() throws InterruptedException {
            this.stream.close();
            this.executor.shutdownNow();
            if (!this.executor.awaitTermination(TailingPipeline.this.shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Pipeline stages did not exit within {}", TailingPipeline.this.shutdownGrace);
            }
        }
    }
}
