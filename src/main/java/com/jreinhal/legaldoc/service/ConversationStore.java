package com.jreinhal.legaldoc.service;

import com.jreinhal.legaldoc.model.ConversationState;
import java.util.Optional;

/**
 * Holds conversation histories by id. The orchestrator depends on this interface only.
 */
public interface ConversationStore {

    /**
     * Return the conversation with this id, creating an empty one when it is unknown.
     */
    ConversationState getOrCreate(String conversationId);

    Optional<ConversationState> find(String conversationId);

    /**
     * @return false when no conversation had this id
     */
    boolean clear(String conversationId);

    long activeCount();
}
