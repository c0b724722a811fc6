package com.jreinhal.legaldoc.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "legaldoc.conversation")
public class ConversationProperties {
    /**
     * Idle time after which a conversation and its history are dropped.
     */
    private Duration ttl = Duration.ofHours(24);

    private long maxConversations = 10_000;

    /**
     * Turns retained per conversation; older turns are evicted first.
     */
    private int maxTurns = 10;

    /**
     * Most recent turns included in the answer prompt.
     */
    private int historyTurnsInPrompt = 3;

    /**
     * Rewrite short or referential follow-up questions into standalone questions before retrieval.
     */
    private boolean contextualizeFollowUps = true;

    public Duration getTtl() {
        return this.ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public long getMaxConversations() {
        return this.maxConversations;
    }

    public void setMaxConversations(long maxConversations) {
        this.maxConversations = maxConversations;
    }

    public int getMaxTurns() {
        return this.maxTurns;
    }

    public void setMaxTurns(int maxTurns) {
        this.maxTurns = maxTurns;
    }

    public int getHistoryTurnsInPrompt() {
        return this.historyTurnsInPrompt;
    }

    public void setHistoryTurnsInPrompt(int historyTurnsInPrompt) {
        this.historyTurnsInPrompt = historyTurnsInPrompt;
    }

    public boolean isContextualizeFollowUps() {
        return this.contextualizeFollowUps;
    }

    public void setContextualizeFollowUps(boolean contextualizeFollowUps) {
        this.contextualizeFollowUps = contextualizeFollowUps;
    }
}
