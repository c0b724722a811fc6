package com.jreinhal.legaldoc.rag.preprocess;

import com.jreinhal.legaldoc.model.EntityType;
import com.jreinhal.legaldoc.model.ExtractedEntity;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Entity recognizer that asks the chat model for legal entities.
 *
 * The model answers one entity per line as {@code TYPE|surface text}. Lines with an unknown type
 * are dropped. Results are merged with the pattern recognizer so statute references that the
 * model misses are still found; if the model call fails the pattern result is used alone.
 */
public class LlmEntityRecognizer implements EntityRecognizer {

    private static final Logger log = LoggerFactory.getLogger(LlmEntityRecognizer.class);

    private static final Pattern ENTITY_LINE_PATTERN = Pattern.compile(
            "^\\s*[-*]?\\s*([A-Z_]+)\\s*\\|\\s*(.+?)\\s*$", Pattern.MULTILINE);

    private static final int MAX_INPUT_CHARS = 2000;

    private static final String EXTRACTION_PROMPT = """
            Extract the legal entities from the question below. Output one entity per line in this exact format:
            TYPE|entity text

            Types:
            - STATUTE: articles, sections, clauses, acts, codes, amendments
            - CASE_CITATION: case names such as "Roe v. Wade"
            - COURT: courts and tribunals
            - LEGAL_CONCEPT: doctrines and concepts such as due process, habeas corpus, judicial review
            - ORGANIZATION, PERSON, LOCATION, DATE

            Output only entity lines. If there are none, output: NONE

            Question:
            %s
            """;

    private final ChatClient chatClient;
    private final EntityRecognizer patternRecognizer;

    public LlmEntityRecognizer(ChatClient chatClient, EntityRecognizer patternRecognizer) {
        this.chatClient = chatClient;
        this.patternRecognizer = patternRecognizer;
    }

    @Override
    public List<ExtractedEntity> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<ExtractedEntity> patternEntities = this.patternRecognizer.extract(text);
        String input = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) + "..." : text;
        String response;
        try {
            long start = System.currentTimeMillis();
            response = this.chatClient.prompt()
                    .user(EXTRACTION_PROMPT.formatted(input))
                    .call()
                    .content();
            if (log.isDebugEnabled()) {
                log.debug("LLM entity extraction responded in {}ms", System.currentTimeMillis() - start);
            }
        } catch (RuntimeException e) {
            log.warn("LLM entity extraction failed, using pattern entities only: {}", e.getMessage());
            return patternEntities;
        }
        List<ExtractedEntity> merged = new ArrayList<>(parseResponse(response));
        Set<String> seen = new HashSet<>();
        merged.forEach(e -> seen.add(e.text().toLowerCase(Locale.ROOT)));
        for (ExtractedEntity entity : patternEntities) {
            if (seen.add(entity.text().toLowerCase(Locale.ROOT))) {
                merged.add(entity);
            }
        }
        return List.copyOf(merged);
    }

    static List<ExtractedEntity> parseResponse(String response) {
        if (response == null || response.isBlank() || response.trim().equalsIgnoreCase("NONE")) {
            return List.of();
        }
        List<ExtractedEntity> entities = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Matcher matcher = ENTITY_LINE_PATTERN.matcher(response);
        while (matcher.find()) {
            EntityType type = parseType(matcher.group(1));
            String value = matcher.group(2).replaceAll("^\"|\"$", "").trim();
            if (type == null || value.length() < 2 || !seen.add(value.toLowerCase(Locale.ROOT))) {
                continue;
            }
            entities.add(new ExtractedEntity(value, type));
        }
        return entities;
    }

    private static EntityType parseType(String raw) {
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if ("ORG".equals(normalized)) {
            return EntityType.ORGANIZATION;
        }
        try {
            return EntityType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
