package com.jreinhal.legaldoc.exception;

public class PipelineStageException extends RuntimeException {
    private final StageFailure failure;

    public PipelineStageException(StageFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public PipelineStageException(StageFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public StageFailure getFailure() {
        return this.failure;
    }
}
