package com.jreinhal.legaldoc.service;

import com.jreinhal.legaldoc.model.ConversationTurn;
import com.jreinhal.legaldoc.util.LogSanitizer;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Rewrites short or referential follow-up questions into standalone questions so that retrieval
 * does not search for "it" or "that section".
 */
@Service
public class QueryContextualizer {
    private static final Logger log = LoggerFactory.getLogger(QueryContextualizer.class);
    private static final int MAX_VAGUE_WORDS = 6;
    private static final int MAX_ANSWER_CHARS = 400;
    private static final Pattern VAGUE_INDICATORS = Pattern.compile(
            "\\b(it|its|this|that|these|those|they|them|the first|the second|the last|the previous"
                    + "|what about|how about|tell me more|explain further|elaborate)\\b");
    private static final String REWRITE_PROMPT = """
            Given this conversation:

            %s

            The user's latest question is: "%s"

            Rewrite this question as a clear, standalone question that can be used to search a document database.
            The rewritten question should:
            1. Be self-contained (no pronouns or vague references)
            2. Include the specific topic from the conversation
            3. Be concise but specific

            Reply with the rewritten question only.""";
    private final ChatClient chatClient;
    @Value(value = "${legaldoc.conversation.rewrite-turns:2}")
    private int rewriteTurns = 2;

    public QueryContextualizer(ChatClient.Builder chatClientBuilder) {
        this.chatClient = chatClientBuilder.build();
    }

    public boolean isVague(String query) {
        if (query == null || query.isBlank()) {
            return false;
        }
        String trimmed = query.trim();
        if (trimmed.split("\\s+").length <= MAX_VAGUE_WORDS) {
            return true;
        }
        return VAGUE_INDICATORS.matcher(trimmed.toLowerCase(Locale.ROOT)).find();
    }

    /**
     * Return a standalone form of {@code query}, or {@code query} itself when there is no history or
     * it does not read as a follow-up. Never throws for model failures.
     */
    public String contextualize(String query, List<ConversationTurn> history) {
        if (history == null || history.isEmpty() || !this.isVague(query)) {
            return query;
        }
        List<ConversationTurn> recent = history.subList(Math.max(0, history.size() - this.rewriteTurns), history.size());
        String previousQuestion = recent.get(recent.size() - 1).query();
        try {
            String rewritten = this.chatClient.prompt()
                    .options(ChatOptions.builder().temperature(0.3).maxTokens(150).build())
                    .user(REWRITE_PROMPT.formatted(formatHistory(recent), query))
                    .call()
                    .content();
            String cleaned = clean(rewritten);
            if (cleaned.isEmpty()) {
                log.warn("Follow-up rewrite returned no text for {}, using previous question", LogSanitizer.querySummary(query));
                return fallback(previousQuestion, query);
            }
            if (log.isDebugEnabled()) {
                log.debug("Follow-up {} rewritten to {}", LogSanitizer.querySummary(query), LogSanitizer.querySummary(cleaned));
            }
            return cleaned;
        }
        catch (RuntimeException e) {
            log.warn("Follow-up rewrite failed for {}: {}", LogSanitizer.querySummary(query), e.getMessage());
            return fallback(previousQuestion, query);
        }
    }

    static String fallback(String previousQuestion, String query) {
        return previousQuestion + " " + query;
    }

    static String clean(String rewritten) {
        if (rewritten == null) {
            return "";
        }
        String cleaned = rewritten.trim();
        while (cleaned.length() > 1 && (cleaned.startsWith("\"") || cleaned.startsWith("'"))
                && (cleaned.endsWith("\"") || cleaned.endsWith("'"))) {
            cleaned = cleaned.substring(1, cleaned.length() - 1).trim();
        }
        return cleaned;
    }

    private static String formatHistory(List<ConversationTurn> turns) {
        return turns.stream()
                .map(t -> "USER: " + t.query() + "\nASSISTANT: " + truncate(t.answer()))
                .collect(Collectors.joining("\n"));
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_ANSWER_CHARS ? text : text.substring(0, MAX_ANSWER_CHARS) + "...";
    }
}
