package com.jreinhal.oplogstats.exception;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Base class for every failure that halts the tailing pipeline.
 *
 * <p>Each failure names the stage it surfaced in and carries a {@link Kind} that maps to a
 * distinct non-zero process exit code when it escapes the application runner.</p>
 */
public abstract class PipelineException extends RuntimeException implements ExitCodeGenerator {

    public enum Kind {
        NO_RESUME_POINT(2),
        SOURCE_UNAVAILABLE(3),
        STREAM_BROKEN(4),
        NOT_FOUND(5),
        PERSIST_FAILED(6),
        UNEXPECTED(1);

        private final int exitCode;

        Kind(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return this.exitCode;
        }
    }

    private final Kind kind;
    private final PipelineStage stage;

    protected PipelineException(Kind kind, PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.stage = stage;
    }

    public Kind getKind() {
        return this.kind;
    }

    public PipelineStage getStage() {
        return this.stage;
    }

    @Override
    public int getExitCode() {
        return this.kind.exitCode();
    }

    /**
     * One-line diagnostic naming the failing stage and the underlying cause.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder()
                .append(this.stage).append(" stage failed (").append(this.kind).append("): ")
                .append(getMessage());
        Throwable cause = getCause();
        if (cause != null) {
            sb.append(" caused by ").append(cause.getClass().getSimpleName());
            if (cause.getMessage() != null) {
                sb.append(": ").append(cause.getMessage());
            }
        }
        return sb.toString();
    }
}
