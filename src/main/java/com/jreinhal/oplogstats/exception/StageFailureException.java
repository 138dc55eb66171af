package com.jreinhal.oplogstats.exception;

/**
 * A stage failed with an error outside the expected taxonomy, e.g. an undecodable oplog entry.
 */
public class StageFailureException extends PipelineException {

    public StageFailureException(PipelineStage stage, Throwable cause) {
        super(Kind.UNEXPECTED, stage, "Unexpected failure in " + stage + " stage", cause);
    }
}
