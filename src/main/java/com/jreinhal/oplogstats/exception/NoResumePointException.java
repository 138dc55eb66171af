package com.jreinhal.oplogstats.exception;

/**
 * The oplog holds no entry, so there is no position to resume tailing from.
 */
public class NoResumePointException extends PipelineException {

    public NoResumePointException(String message) {
        super(Kind.NO_RESUME_POINT, PipelineStage.RESUME, message, null);
    }
}
