package com.jreinhal.oplogstats.exception;

/**
 * Stages of the tailing pipeline, in data-flow order.
 */
public enum PipelineStage {
    RESUME,
    TAIL,
    EXTRACT,
    RECOMPUTE
}
