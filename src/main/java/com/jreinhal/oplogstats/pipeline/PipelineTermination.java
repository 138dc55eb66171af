package com.jreinhal.oplogstats.pipeline;

import com.jreinhal.oplogstats.exception.PipelineException;
import com.jreinhal.oplogstats.exception.PipelineStage;
import com.jreinhal.oplogstats.oplog.ResumePosition;
import java.util.Optional;

/**
 * Outcome of a pipeline run. A run only ends through its first failure.
 *
 * @param cause             the first failure of any stage
 * @param resumedAfter      position the run subscribed after; {@code null} when resolution failed
 * @param lastRecomputed    position of the last entry whose summary was fully handled, if any
 * @param counters          counters at the time of the halt
 */
public record PipelineTermination(
        PipelineException cause,
        ResumePosition resumedAfter,
        ResumePosition lastRecomputed,
        PipelineCounters.Snapshot counters) {

    public PipelineStage stage() {
        return this.cause.getStage();
    }

    public PipelineException.Kind kind() {
        return this.cause.getKind();
    }

    /**
     * Position a new run may resume after without skipping any change this run left unhandled.
     * Entries after it may be delivered again, which the idempotent upsert absorbs.
     */
    public Optional<ResumePosition> restartPosition() {
        return Optional.ofNullable(this.lastRecomputed != null ? this.lastRecomputed : this.resumedAfter);
    }
}
