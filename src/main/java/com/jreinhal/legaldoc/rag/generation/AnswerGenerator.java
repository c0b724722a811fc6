package com.jreinhal.legaldoc.rag.generation;

import com.jreinhal.legaldoc.exception.PipelineStageException;
import com.jreinhal.legaldoc.exception.StageFailure;
import com.jreinhal.legaldoc.model.ContextPassage;
import com.jreinhal.legaldoc.model.DraftAnswer;
import com.jreinhal.legaldoc.model.RerankedCandidate;
import com.jreinhal.legaldoc.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Builds the grounded prompt from the reranked passages and turns the model reply into a
 * {@link DraftAnswer}.
 *
 * <p>The context holds at most {@code maxPassages} passages in rank order, each under a citation
 * index. Passages are added whole until the character budget is reached; the top passage is always
 * included in full. Markers in the reply that point at a passage the model was not given are
 * removed, so a draft can only cite what it was shown.</p>
 */
@Service
public class AnswerGenerator {
    private static final Logger log = LoggerFactory.getLogger(AnswerGenerator.class);

    public static final String INSUFFICIENT_CONTEXT_ANSWER = "I don't have enough context to answer this question.";

    static final String SYSTEM_PROMPT = """
            You are a legal document assistant. You answer questions about statutes, constitutions and other \
            legal documents using only the numbered sources you are given.

            Rules:
            1. Use ONLY the provided sources. Do not use outside knowledge or make assumptions.
            2. After every statement, cite the source it comes from in square brackets, for example [1] or [2][3].
            3. Quote article, section and clause numbers exactly as they appear in the sources.
            4. Refer to earlier turns of the conversation when the question depends on them.
            5. If the sources do not contain the answer, say clearly that the available documents do not cover it.
            6. Be precise and concise, and keep a professional tone.""";

    private final AnswerModel answerModel;
    @Value("${legaldoc.generation.max-passages:5}")
    private int maxPassages = 5;
    @Value("${legaldoc.rerank.top-m:8}")
    private int topM = 8;
    @Value("${legaldoc.generation.max-context-chars:6000}")
    private int maxContextChars = 6000;

    public AnswerGenerator(AnswerModel answerModel) {
        this.answerModel = answerModel;
    }

    @PostConstruct
    public void init() {
        if (this.maxPassages > this.topM) {
            log.warn("legaldoc.generation.max-passages={} exceeds rerank top-m={}; using {}", this.maxPassages, this.topM, this.topM);
            this.maxPassages = this.topM;
        }
        this.maxPassages = Math.max(1, this.maxPassages);
        log.info("Answer generator initialized (maxPassages={}, maxContextChars={})", this.maxPassages, this.maxContextChars);
    }

    public DraftAnswer generate(GenerationRequest request) {
        int attempt = request.previousAttempts() + 1;
        List<ContextPassage> passages = this.selectPassages(request.ranked());
        if (passages.isEmpty()) {
            return new DraftAnswer(INSUFFICIENT_CONTEXT_ANSWER, List.of(), List.of(), attempt, true);
        }
        AnswerPrompt prompt = new AnswerPrompt(SYSTEM_PROMPT, request.history(),
                buildUserPrompt(request.query(), formatContext(passages), request.feedback()));
        String reply;
        try {
            reply = this.answerModel.complete(prompt);
        } catch (PipelineStageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PipelineStageException(StageFailure.GENERATION_FAILURE, "Answer model failed: " + e.getMessage(), e);
        }
        if (reply == null || reply.isBlank()) {
            throw new PipelineStageException(StageFailure.GENERATION_FAILURE, "Answer model returned no text");
        }
        Set<Integer> allowed = passages.stream().map(ContextPassage::citationIndex).collect(Collectors.toSet());
        CitationMarkers.Filtered filtered = CitationMarkers.retainOnly(reply, allowed);
        if (!filtered.droppedIndexes().isEmpty()) {
            log.warn("Removed citations {} not among the {} supplied passages (query {}, attempt {})",
                    filtered.droppedIndexes(), passages.size(), LogSanitizer.querySummary(request.query()), attempt);
        }
        if (filtered.text().isBlank()) {
            throw new PipelineStageException(StageFailure.GENERATION_FAILURE, "Answer contained only citation markers");
        }
        List<Integer> cited = CitationMarkers.indexes(filtered.text());
        if (log.isDebugEnabled()) {
            log.debug("Draft attempt {} for query {}: {} chars, cites {}", attempt,
                    LogSanitizer.querySummary(request.query()), filtered.text().length(), cited);
        }
        return new DraftAnswer(filtered.text(), passages, cited, attempt, false);
    }

    /**
     * Top passages in rank order that fit the context budget. Lower-ranked passages are the ones
     * left out; the first passage is always kept whole.
     */
    public List<ContextPassage> selectPassages(List<RerankedCandidate> ranked) {
        List<ContextPassage> selected = new ArrayList<>();
        int used = 0;
        for (RerankedCandidate candidate : ranked) {
            if (selected.size() >= this.maxPassages) {
                break;
            }
            ContextPassage passage = new ContextPassage(selected.size() + 1, candidate);
            int length = formatPassage(passage).length();
            if (!selected.isEmpty() && used + length > this.maxContextChars) {
                break;
            }
            selected.add(passage);
            used += length;
        }
        return selected;
    }

    static String formatContext(List<ContextPassage> passages) {
        return passages.stream().map(AnswerGenerator::formatPassage).collect(Collectors.joining("\n\n"));
    }

    static String formatPassage(ContextPassage passage) {
        return "[Source " + passage.citationIndex() + " - Page " + passage.pageNumber() + "]:\n" + passage.text();
    }

    static String buildUserPrompt(String query, String context, List<String> feedback) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Context from legal documents:\n\n").append(context).append("\n\n");
        prompt.append("Question: ").append(query).append("\n\n");
        if (!feedback.isEmpty()) {
            prompt.append("Your previous answer made these statements, which the sources do not support:\n");
            for (String span : feedback) {
                prompt.append("- ").append(span).append('\n');
            }
            prompt.append("Rewrite the answer. Either support each of these statements with a citation to a source ")
                    .append("that states it, or leave it out.\n\n");
        }
        prompt.append("Answer using only the sources above, citing them as [n]. If they do not contain the answer, ")
                .append("say that the available documents do not cover it.");
        return prompt.toString();
    }
}
