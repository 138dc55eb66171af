package com.jreinhal.oplogstats.exception;

public class SourceUnavailableException extends PipelineException {

    public SourceUnavailableException(PipelineStage stage, String message, Throwable cause) {
        super(Kind.SOURCE_UNAVAILABLE, stage, message, cause);
    }
}
