package com.jreinhal.legaldoc.rag.rerank;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Uses the chat model as a relevance judge. The first number in the reply is taken as the score.
 */
public class LlmRelevanceScorer implements CrossEncoderScorer {
    private static final Logger log = LoggerFactory.getLogger(LlmRelevanceScorer.class);
    private static final Pattern SCORE_PATTERN = Pattern.compile("(1(?:\\.0+)?|0(?:\\.\\d+)?|\\.\\d+)");
    private static final int MAX_PASSAGE_CHARS = 1000;
    private static final String PROMPT = """
            Rate how relevant this legal passage is to the question on a scale of 0.0 to 1.0.

            QUESTION: %s

            PASSAGE:
            %s

            Respond with ONLY a number between 0.0 and 1.0.
            0.0 = irrelevant, 0.5 = related but does not answer, 1.0 = directly answers the question

            Score:""";
    private final ChatClient chatClient;

    public LlmRelevanceScorer(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public double score(String query, String passage) {
        String content = passage == null ? "" : passage;
        if (content.length() > MAX_PASSAGE_CHARS) {
            content = content.substring(0, MAX_PASSAGE_CHARS) + "...";
        }
        String response = this.chatClient.prompt()
                .user(PROMPT.formatted(query, content))
                .call()
                .content();
        return parseScore(response);
    }

    @Override
    public String name() {
        return "llm";
    }

    static double parseScore(String response) {
        if (response == null || response.isBlank()) {
            return 0.5;
        }
        Matcher matcher = SCORE_PATTERN.matcher(response.trim());
        if (matcher.find()) {
            try {
                return Math.max(0.0, Math.min(1.0, Double.parseDouble(matcher.group(1))));
            } catch (NumberFormatException e) {
                if (log.isDebugEnabled()) {
                    log.debug("Relevance score parse failed: {}", response);
                }
            }
        }
        return 0.5;
    }
}
