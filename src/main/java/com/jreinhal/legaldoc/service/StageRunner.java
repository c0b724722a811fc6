package com.jreinhal.legaldoc.service;

import com.jreinhal.legaldoc.exception.PipelineStageException;
import com.jreinhal.legaldoc.exception.QueryCancelledException;
import com.jreinhal.legaldoc.exception.StageFailure;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs one pipeline stage on the stage pool and waits for it with the stage's timeout.
 *
 * Every way a stage can go wrong comes back as a {@link PipelineStageException} carrying the
 * stage's failure kind, except interruption of the waiting thread, which cancels the stage and
 * surfaces as {@link QueryCancelledException}.
 */
@Component
public class StageRunner {
    private final ExecutorService stageExecutor;

    public StageRunner(@Qualifier(value = "stageExecutor") ExecutorService stageExecutor) {
        this.stageExecutor = stageExecutor;
    }

    public <T> T run(StageFailure failure, Duration timeout, Callable<T> stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new QueryCancelledException("Query cancelled before " + failure);
        }
        Future<T> future;
        try {
            future = this.stageExecutor.submit(stage);
        }
        catch (RejectedExecutionException e) {
            throw new PipelineStageException(failure, "Stage pool saturated", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            throw new PipelineStageException(failure, "Stage timed out after " + timeout.toMillis() + "ms", e);
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new QueryCancelledException("Query cancelled during " + failure, e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PipelineStageException stageException) {
                throw stageException;
            }
            if (cause instanceof QueryCancelledException cancelled) {
                throw cancelled;
            }
            String message = cause == null ? "Stage failed" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
            throw new PipelineStageException(failure, message, cause);
        }
    }
}
