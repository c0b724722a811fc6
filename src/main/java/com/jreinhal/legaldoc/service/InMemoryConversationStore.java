package com.jreinhal.legaldoc.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.legaldoc.config.ConversationProperties;
import com.jreinhal.legaldoc.model.ConversationState;
import jakarta.annotation.PostConstruct;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Conversation histories kept in a Caffeine cache. A conversation expires after
 * {@code legaldoc.conversation.ttl} without access, and the least recently used ones are
 * dropped beyond {@code legaldoc.conversation.max-conversations}.
 */
@Component
public class InMemoryConversationStore implements ConversationStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryConversationStore.class);
    private final ConversationProperties properties;
    private Cache<String, ConversationState> conversations;

    public InMemoryConversationStore(ConversationProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        this.conversations = Caffeine.newBuilder()
                .expireAfterAccess(this.properties.getTtl())
                .maximumSize(Math.max(1L, this.properties.getMaxConversations()))
                .build();
        log.info("Conversation store initialized (ttl={}, maxConversations={}, maxTurns={})",
                this.properties.getTtl(), this.properties.getMaxConversations(), this.properties.getMaxTurns());
    }

    @Override
    public ConversationState getOrCreate(String conversationId) {
        return this.conversations.get(conversationId, ConversationState::new);
    }

    @Override
    public Optional<ConversationState> find(String conversationId) {
        return Optional.ofNullable(this.conversations.getIfPresent(conversationId));
    }

    @Override
    public boolean clear(String conversationId) {
        return this.conversations.asMap().remove(conversationId) != null;
    }

    @Override
    public long activeCount() {
        this.conversations.cleanUp();
        return this.conversations.estimatedSize();
    }
}
