package com.jreinhal.oplogstats.exception;

/**
 * The tailing cursor failed or was closed by the server. Not recovered locally.
 */
public class StreamBrokenException extends PipelineException {

    public StreamBrokenException(String message) {
        this(message, null);
    }

    public StreamBrokenException(String message, Throwable cause) {
        super(Kind.STREAM_BROKEN, PipelineStage.TAIL, message, cause);
    }
}
