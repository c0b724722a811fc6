package com.jreinhal.legaldoc.util;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guards a remote model. {@code failureThreshold} consecutive failures open the breaker for
 * {@code openDuration}. The first call after that is a single trial: its success closes the
 * breaker, its failure opens it again. Other calls are refused while the trial runs.
 */
public class SimpleCircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(SimpleCircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private record Snapshot(State state, int failures, long reopenAtMs) {
        static final Snapshot CLOSED = new Snapshot(State.CLOSED, 0, 0L);
    }

    private final String name;
    private final int failureThreshold;
    private final long openMillis;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.CLOSED);

    public SimpleCircuitBreaker(String name, int failureThreshold, Duration openDuration) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openMillis = openDuration == null ? 30_000L : Math.max(0L, openDuration.toMillis());
    }

    public boolean allowRequest() {
        while (true) {
            Snapshot current = this.snapshot.get();
            if (current.state() == State.CLOSED) {
                return true;
            }
            if (current.state() == State.HALF_OPEN || System.currentTimeMillis() < current.reopenAtMs()) {
                return false;
            }
            if (this.snapshot.compareAndSet(current, new Snapshot(State.HALF_OPEN, 0, 0L))) {
                log.info("Circuit '{}' half-open, allowing one trial call", this.name);
                return true;
            }
        }
    }

    public void recordSuccess() {
        Snapshot previous = this.snapshot.getAndSet(Snapshot.CLOSED);
        if (previous.state() != State.CLOSED) {
            log.info("Circuit '{}' closed after a successful trial call", this.name);
        }
    }

    public void recordFailure() {
        Snapshot previous = this.snapshot.getAndUpdate(this::afterFailure);
        if (previous.state() != State.OPEN && this.opensOn(previous)) {
            log.warn("Circuit '{}' open for {}ms after {} consecutive failures", this.name, this.openMillis,
                    previous.failures() + 1);
        }
    }

    private Snapshot afterFailure(Snapshot current) {
        if (current.state() == State.OPEN) {
            return current;
        }
        if (this.opensOn(current)) {
            return new Snapshot(State.OPEN, current.failures() + 1, System.currentTimeMillis() + this.openMillis);
        }
        return new Snapshot(State.CLOSED, current.failures() + 1, 0L);
    }

    private boolean opensOn(Snapshot current) {
        return current.state() == State.HALF_OPEN || current.failures() + 1 >= this.failureThreshold;
    }

    public State getState() {
        return this.snapshot.get().state();
    }

    public String getName() {
        return this.name;
    }
}
