package com.jreinhal.oplogstats.exception;

public class SummaryPersistException extends PipelineException {

    public SummaryPersistException(String message, Throwable cause) {
        super(Kind.PERSIST_FAILED, PipelineStage.RECOMPUTE, message, cause);
    }
}
