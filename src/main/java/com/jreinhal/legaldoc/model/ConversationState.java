package com.jreinhal.legaldoc.model;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.RunnableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * History of one conversation. Turns are only ever appended; once {@code maxTurns} is
 * reached the oldest turn is evicted.
 *
 * <p>Callers hold {@link #turnLock()} for the whole of a turn so that queries on the same
 * conversation are processed one at a time. Asynchronous turns also pass through
 * {@link #beginOrQueue(RunnableFuture)}, which holds back a turn until the one before it has
 * finished instead of letting it occupy a worker while it waits for the lock.</p>
 */
public final class ConversationState {
    private final String conversationId;
    private final Instant createdAt;
    private final ReentrantLock turnLock = new ReentrantLock(true);
    private final List<ConversationTurn> turns = new ArrayList<>();
    private final Deque<RunnableFuture<?>> pendingTurns = new ArrayDeque<>();
    private boolean turnActive;
    private volatile Instant lastUpdated;

    public ConversationState(String conversationId) {
        this.conversationId = conversationId;
        this.createdAt = Instant.now();
        this.lastUpdated = this.createdAt;
    }

    public String getConversationId() {
        return this.conversationId;
    }

    public Instant getCreatedAt() {
        return this.createdAt;
    }

    public Instant getLastUpdated() {
        return this.lastUpdated;
    }

    public ReentrantLock turnLock() {
        return this.turnLock;
    }

    /**
     * @return true when the conversation was idle and the caller should start {@code turn} now;
     *         false when it was queued behind the active turn
     */
    public synchronized boolean beginOrQueue(RunnableFuture<?> turn) {
        if (this.turnActive) {
            this.pendingTurns.addLast(turn);
            return false;
        }
        this.turnActive = true;
        return true;
    }

    /**
     * Ends the active turn. The returned turn, if any, becomes the active one and must be started
     * by the caller.
     */
    public synchronized RunnableFuture<?> finishTurn() {
        RunnableFuture<?> next = this.pendingTurns.pollFirst();
        this.turnActive = next != null;
        return next;
    }

    public synchronized int pendingTurnCount() {
        return this.pendingTurns.size();
    }

    public synchronized void append(ConversationTurn turn, int maxTurns) {
        this.turns.add(turn);
        while (maxTurns > 0 && this.turns.size() > maxTurns) {
            this.turns.remove(0);
        }
        this.lastUpdated = turn.timestamp();
    }

    public synchronized List<ConversationTurn> turns() {
        return List.copyOf(this.turns);
    }

    public synchronized List<ConversationTurn> recentTurns(int limit) {
        if (limit <= 0 || this.turns.isEmpty()) {
            return List.of();
        }
        int from = Math.max(0, this.turns.size() - limit);
        return List.copyOf(this.turns.subList(from, this.turns.size()));
    }

    public synchronized int size() {
        return this.turns.size();
    }
}
