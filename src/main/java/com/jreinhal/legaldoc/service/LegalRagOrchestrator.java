package com.jreinhal.legaldoc.service;

import com.jreinhal.legaldoc.config.ConversationProperties;
import com.jreinhal.legaldoc.config.PipelineProperties;
import com.jreinhal.legaldoc.exception.InvalidQueryException;
import com.jreinhal.legaldoc.exception.PipelineStageException;
import com.jreinhal.legaldoc.exception.QueryCancelledException;
import com.jreinhal.legaldoc.exception.StageFailure;
import com.jreinhal.legaldoc.index.ChunkIndex;
import com.jreinhal.legaldoc.model.AnswerOutcome;
import com.jreinhal.legaldoc.model.AnswerResult;
import com.jreinhal.legaldoc.model.Citation;
import com.jreinhal.legaldoc.model.ClaimCheck;
import com.jreinhal.legaldoc.model.ContextPassage;
import com.jreinhal.legaldoc.model.ConversationState;
import com.jreinhal.legaldoc.model.ConversationTurn;
import com.jreinhal.legaldoc.model.DraftAnswer;
import com.jreinhal.legaldoc.model.ExpandedQuery;
import com.jreinhal.legaldoc.model.ExtractedEntity;
import com.jreinhal.legaldoc.model.LegalDocument;
import com.jreinhal.legaldoc.model.RerankedCandidate;
import com.jreinhal.legaldoc.model.ValidationVerdict;
import com.jreinhal.legaldoc.rag.crag.CorrectiveValidator;
import com.jreinhal.legaldoc.rag.crag.ValidationDecision;
import com.jreinhal.legaldoc.rag.crag.ValidationSession;
import com.jreinhal.legaldoc.rag.generation.AnswerGenerator;
import com.jreinhal.legaldoc.rag.generation.GenerationRequest;
import com.jreinhal.legaldoc.rag.hybridrag.HybridRetriever;
import com.jreinhal.legaldoc.rag.knowledge.KnowledgeExpander;
import com.jreinhal.legaldoc.rag.preprocess.EntityRecognizer;
import com.jreinhal.legaldoc.rag.rerank.Reranker;
import com.jreinhal.legaldoc.reasoning.ReasoningStep;
import com.jreinhal.legaldoc.reasoning.ReasoningTrace;
import com.jreinhal.legaldoc.reasoning.ReasoningTracer;
import com.jreinhal.legaldoc.util.LogSanitizer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RunnableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs one question through the pipeline:
 *
 * contextualize follow-up, extract entities, expand, retrieve, rerank, then generate and validate
 * in a bounded corrective loop.
 *
 * Each stage runs through {@link StageRunner} with its own timeout, and every stage failure is
 * turned into a degraded result here: extraction falls back to the unexpanded query, retrieval
 * failure answers with the insufficient-information text, rerank failure keeps the fused order,
 * and generation or validation trouble ends in the suppressed answer. Only invalid input and
 * cancellation leave {@link #answer(String, String)} as exceptions.
 *
 * Calls on the same conversation are serialized by the conversation's turn lock, and the turn is
 * added to its history only once the call has reached an outcome without being interrupted.
 * {@link #submit(String, String)} additionally queues a conversation's queries outside the pool.
 */
@Service
public class LegalRagOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(LegalRagOrchestrator.class);
    public static final String NO_RELEVANT_INFORMATION_ANSWER =
            "I cannot find relevant information in the available documents to answer your question.";
    public static final String SUPPRESSED_ANSWER =
            "I could not verify an answer to this question against the indexed documents with sufficient confidence. "
                    + "Please rephrase the question or consult the source documents directly.";
    private static final Pattern CONVERSATION_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");
    private final EntityRecognizer entityRecognizer;
    private final KnowledgeExpander knowledgeExpander;
    private final HybridRetriever hybridRetriever;
    private final Reranker reranker;
    private final AnswerGenerator answerGenerator;
    private final CorrectiveValidator correctiveValidator;
    private final QueryContextualizer queryContextualizer;
    private final ConversationStore conversationStore;
    private final ChunkIndex chunkIndex;
    private final StageRunner stageRunner;
    private final ReasoningTracer reasoningTracer;
    private final PipelineProperties pipelineProperties;
    private final ConversationProperties conversationProperties;
    private final ExecutorService pipelineExecutor;
    private final AtomicInteger queryCount = new AtomicInteger(0);
    private final AtomicLong totalLatencyMs = new AtomicLong(0L);
    @Value(value = "${legaldoc.generation.citation-excerpt-chars:300}")
    private int citationExcerptChars = 300;

    public LegalRagOrchestrator(EntityRecognizer entityRecognizer, KnowledgeExpander knowledgeExpander,
                                HybridRetriever hybridRetriever, Reranker reranker, AnswerGenerator answerGenerator,
                                CorrectiveValidator correctiveValidator, QueryContextualizer queryContextualizer,
                                ConversationStore conversationStore, ChunkIndex chunkIndex, StageRunner stageRunner,
                                ReasoningTracer reasoningTracer, PipelineProperties pipelineProperties,
                                ConversationProperties conversationProperties,
                                @Qualifier(value = "pipelineExecutor") ExecutorService pipelineExecutor) {
        this.entityRecognizer = entityRecognizer;
        this.knowledgeExpander = knowledgeExpander;
        this.hybridRetriever = hybridRetriever;
        this.reranker = reranker;
        this.answerGenerator = answerGenerator;
        this.correctiveValidator = correctiveValidator;
        this.queryContextualizer = queryContextualizer;
        this.conversationStore = conversationStore;
        this.chunkIndex = chunkIndex;
        this.stageRunner = stageRunner;
        this.reasoningTracer = reasoningTracer;
        this.pipelineProperties = pipelineProperties;
        this.conversationProperties = conversationProperties;
        this.pipelineExecutor = pipelineExecutor;
    }

    public int getQueryCount() {
        return this.queryCount.get();
    }

    public long getAverageLatencyMs() {
        int count = this.queryCount.get();
        return count == 0 ? 0L : this.totalLatencyMs.get() / count;
    }

    /**
     * Answer a question, optionally as the next turn of a conversation.
     *
     * @param conversationId null to start a new conversation
     * @throws InvalidQueryException   when the query or conversation id is not acceptable
     * @throws QueryCancelledException when the calling thread is interrupted; history is left unchanged
     */
    public AnswerResult answer(String query, String conversationId) {
        this.validate(query, conversationId);
        String resolvedId = conversationId == null ? UUID.randomUUID().toString() : conversationId;
        ConversationState conversation = this.conversationStore.getOrCreate(resolvedId);
        ReentrantLock turnLock = conversation.turnLock();
        try {
            turnLock.lockInterruptibly();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryCancelledException("Query cancelled while waiting for conversation " + resolvedId, e);
        }
        try {
            long startTime = System.currentTimeMillis();
            String trimmed = query.trim();
            ReasoningTrace trace = this.reasoningTracer.startTrace(trimmed, resolvedId);
            AnswerResult result;
            try {
                result = this.runPipeline(trimmed, conversation, trace);
            }
            catch (QueryCancelledException e) {
                this.reasoningTracer.addStep(trace, ReasoningStep.StepType.ERROR, "Cancelled", e.getMessage(),
                        System.currentTimeMillis() - startTime);
                this.reasoningTracer.endTrace(trace);
                log.info("Query {} cancelled; conversation {} unchanged", LogSanitizer.querySummary(trimmed), resolvedId);
                throw e;
            }
            if (Thread.currentThread().isInterrupted()) {
                this.reasoningTracer.endTrace(trace);
                throw new QueryCancelledException("Query cancelled before its turn was recorded");
            }
            conversation.append(new ConversationTurn(trimmed, result.answerText(), result.citations(), Instant.now()),
                    this.conversationProperties.getMaxTurns());
            long elapsed = System.currentTimeMillis() - startTime;
            trace.addMetric("outcome", result.outcome().name());
            trace.addMetric("generatorCalls", result.generatorCalls());
            trace.addMetric("citations", result.citations().size());
            this.reasoningTracer.addStep(trace, ReasoningStep.StepType.RESPONSE, "Response",
                    result.outcome().name(), 0L, Map.of("grounded", result.grounded()));
            this.reasoningTracer.endTrace(trace);
            this.queryCount.incrementAndGet();
            this.totalLatencyMs.addAndGet(elapsed);
            log.info("Answered {} in {}ms: outcome={}, generatorCalls={}, citations={}", LogSanitizer.querySummary(trimmed),
                    elapsed, result.outcome(), result.generatorCalls(), result.citations().size());
            return result;
        }
        finally {
            turnLock.unlock();
        }
    }

    /**
     * Run {@link #answer(String, String)} on the pipeline pool. Cancelling the returned future with
     * interruption cancels the query.
     *
     * A query on a conversation that already has one in progress is held back and handed to the
     * pool when the earlier one finishes, so pool threads are never parked on a busy conversation.
     *
     * @throws RejectedExecutionException when the pool cannot take the query now
     */
    public Future<AnswerResult> submit(String query, String conversationId) {
        this.validate(query, conversationId);
        String resolvedId = conversationId == null ? UUID.randomUUID().toString() : conversationId;
        ConversationState conversation = this.conversationStore.getOrCreate(resolvedId);
        ConversationTurnTask turn = new ConversationTurnTask(conversation, () -> this.answer(query, resolvedId));
        if (!conversation.beginOrQueue(turn)) {
            log.debug("Conversation {} busy, {} queries waiting", resolvedId, conversation.pendingTurnCount());
            return turn;
        }
        try {
            this.pipelineExecutor.execute(turn);
        }
        catch (RejectedExecutionException e) {
            this.startNextTurn(conversation);
            throw e;
        }
        return turn;
    }

    private void startNextTurn(ConversationState conversation) {
        RunnableFuture<?> next;
        while ((next = conversation.finishTurn()) != null) {
            if (next.isDone()) {
                continue;
            }
            try {
                this.pipelineExecutor.execute(next);
                return;
            }
            catch (RejectedExecutionException e) {
                log.warn("Queued query for conversation {} rejected: {}", conversation.getConversationId(), e.getMessage());
                if (next instanceof ConversationTurnTask task) {
                    task.reject(e);
                }
                else {
                    next.cancel(false);
                }
            }
        }
    }

    private void validate(String query, String conversationId) {
        if (query == null || query.isBlank()) {
            throw new InvalidQueryException("Query must not be blank");
        }
        if (query.length() > this.pipelineProperties.getMaxQueryLength()) {
            throw new InvalidQueryException("Query exceeds " + this.pipelineProperties.getMaxQueryLength() + " characters");
        }
        if (conversationId != null && !CONVERSATION_ID.matcher(conversationId).matches()) {
            throw new InvalidQueryException("conversationId must match " + CONVERSATION_ID.pattern());
        }
    }

    private AnswerResult runPipeline(String query, ConversationState conversation, ReasoningTrace trace) {
        PipelineProperties.Timeouts timeouts = this.pipelineProperties.getTimeouts();
        List<ConversationTurn> history = conversation.recentTurns(this.conversationProperties.getHistoryTurnsInPrompt());
        String conversationId = conversation.getConversationId();
        String searchQuery = this.contextualize(query, history, trace);

        long stepStart = System.currentTimeMillis();
        List<ExtractedEntity> entities;
        try {
            entities = this.stageRunner.run(StageFailure.EXTRACTION_FAILURE, timeouts.getExtraction(),
                    () -> this.entityRecognizer.extract(searchQuery));
            this.reasoningTracer.addStep(trace, ReasoningStep.StepType.ENTITY_EXTRACTION, "Entity Extraction",
                    entities.size() + " entities", System.currentTimeMillis() - stepStart,
                    Map.of("entities", entities.stream().map(e -> e.type() + ":" + e.text()).toList()));
        }
        catch (PipelineStageException e) {
            this.recordFailure(trace, e, query, stepStart);
            entities = List.of();
        }

        stepStart = System.currentTimeMillis();
        ExpandedQuery expanded = entities.isEmpty()
                ? ExpandedQuery.unexpanded(searchQuery)
                : this.knowledgeExpander.expand(searchQuery, entities);
        this.reasoningTracer.addStep(trace, ReasoningStep.StepType.QUERY_EXPANSION, "Knowledge Expansion",
                expanded.isExpanded() ? expanded.expansionSummary() : "not expanded",
                System.currentTimeMillis() - stepStart, Map.of("expansionTerms", expanded.expansions().size()));

        stepStart = System.currentTimeMillis();
        HybridRetriever.HybridRetrievalResult retrieval;
        try {
            retrieval = this.stageRunner.run(StageFailure.RETRIEVAL_EMPTY, timeouts.getRetrieval(),
                    () -> this.hybridRetriever.retrieve(expanded));
        }
        catch (PipelineStageException e) {
            this.recordFailure(trace, e, query, stepStart);
            return this.noRelevantInformation(conversationId, trace);
        }
        this.reasoningTracer.addStep(trace, ReasoningStep.StepType.HYBRID_RETRIEVAL, "Hybrid Retrieval",
                retrieval.candidates().size() + " candidates", System.currentTimeMillis() - stepStart,
                retrieval.metadata());
        if (retrieval.isEmpty()) {
            log.info("No candidates for {}; answering with insufficient information", LogSanitizer.querySummary(query));
            return this.noRelevantInformation(conversationId, trace);
        }

        stepStart = System.currentTimeMillis();
        List<RerankedCandidate> ranked;
        try {
            ranked = this.stageRunner.run(StageFailure.RERANK_FAILURE, timeouts.getRerank(),
                    () -> this.reranker.rerank(searchQuery, retrieval.candidates()));
        }
        catch (PipelineStageException e) {
            this.recordFailure(trace, e, query, stepStart);
            ranked = this.reranker.fallback(retrieval.candidates());
        }
        boolean fallback = !ranked.isEmpty() && ranked.get(0).fallback();
        this.reasoningTracer.addStep(trace, ReasoningStep.StepType.RERANKING, "Reranking",
                ranked.size() + " passages" + (fallback ? " (fused order)" : ""),
                System.currentTimeMillis() - stepStart, Map.of("fallback", fallback));
        if (ranked.isEmpty()) {
            return this.noRelevantInformation(conversationId, trace);
        }

        return this.generateAndValidate(query, history, ranked, conversationId, trace);
    }

    private String contextualize(String query, List<ConversationTurn> history, ReasoningTrace trace) {
        if (!this.conversationProperties.isContextualizeFollowUps() || history.isEmpty()) {
            return query;
        }
        long stepStart = System.currentTimeMillis();
        String rewritten;
        try {
            rewritten = this.stageRunner.run(StageFailure.EXTRACTION_FAILURE,
                    this.pipelineProperties.getTimeouts().getContextualization(),
                    () -> this.queryContextualizer.contextualize(query, history));
        }
        catch (PipelineStageException e) {
            this.recordFailure(trace, e, query, stepStart);
            rewritten = QueryContextualizer.fallback(history.get(history.size() - 1).query(), query);
        }
        if (rewritten == null || rewritten.isBlank()) {
            return query;
        }
        if (!rewritten.equals(query)) {
            this.reasoningTracer.addStep(trace, ReasoningStep.StepType.CONTEXTUALIZATION, "Follow-up Rewrite",
                    LogSanitizer.querySummary(rewritten), System.currentTimeMillis() - stepStart);
        }
        return rewritten;
    }

    private AnswerResult generateAndValidate(String query, List<ConversationTurn> history, List<RerankedCandidate> ranked,
                                             String conversationId, ReasoningTrace trace) {
        PipelineProperties.Timeouts timeouts = this.pipelineProperties.getTimeouts();
        ValidationSession session = this.correctiveValidator.newSession();
        GenerationRequest request = GenerationRequest.first(query, history, ranked);
        int calls = 0;
        while (calls < session.maxGeneratorCalls()) {
            ++calls;
            long stepStart = System.currentTimeMillis();
            GenerationRequest current = request;
            DraftAnswer draft;
            try {
                draft = this.stageRunner.run(StageFailure.GENERATION_FAILURE, timeouts.getGeneration(),
                        () -> this.answerGenerator.generate(current));
                session.recordGenerationSuccess();
            }
            catch (PipelineStageException e) {
                this.recordFailure(trace, e, query, stepStart);
                if (session.allowRetryAfterGenerationFailure(calls)) {
                    request = current.retry(current.feedback(), calls);
                    continue;
                }
                return this.suppressed(conversationId, calls, trace);
            }
            this.reasoningTracer.addStep(trace, ReasoningStep.StepType.GENERATION, "Generation #" + draft.attempt(),
                    "cites " + draft.citedIndexes(), System.currentTimeMillis() - stepStart,
                    Map.of("passages", draft.passages().size(), "feedbackSpans", current.feedback().size()));

            stepStart = System.currentTimeMillis();
            ValidationVerdict verdict;
            try {
                verdict = this.stageRunner.run(StageFailure.VALIDATION_FAILURE, timeouts.getValidation(),
                        () -> this.correctiveValidator.check(draft));
            }
            catch (PipelineStageException e) {
                this.recordFailure(trace, e, query, stepStart);
                verdict = ValidationVerdict.failed(e.getMessage());
            }
            ValidationDecision decision = this.correctiveValidator.decide(draft, verdict, session);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("support", verdict.support().name());
            data.put("claims", verdict.claims().size());
            data.put("flagged", verdict.flaggedSpans().size());
            data.put("confidence", Math.round(verdict.confidence() * 1000.0) / 1000.0);
            this.reasoningTracer.addStep(trace, ReasoningStep.StepType.VALIDATION, "Validation #" + draft.attempt(),
                    decision.state() + " -> " + decision.outcome() + " (" + decision.reason() + ")",
                    System.currentTimeMillis() - stepStart, data);
            switch (decision.outcome()) {
                case ACCEPTED:
                    return this.accepted(draft, verdict, conversationId, calls, trace);
                case SUPPRESSED:
                    log.warn("Suppressed answer for {} after {} generator calls: {}", LogSanitizer.querySummary(query),
                            calls, decision.reason());
                    return this.suppressed(conversationId, calls, trace);
                default:
                    request = current.retry(decision.feedback(), calls);
            }
        }
        return this.suppressed(conversationId, calls, trace);
    }

    private AnswerResult accepted(DraftAnswer draft, ValidationVerdict verdict, String conversationId, int calls,
                                  ReasoningTrace trace) {
        List<ContextPassage> sources = draft.citedPassages();
        if (sources.isEmpty()) {
            TreeSet<Integer> supporting = new TreeSet<>();
            for (ClaimCheck claim : verdict.claims()) {
                if (claim.level().isSupported() && claim.bestPassageIndex() > 0) {
                    supporting.add(claim.bestPassageIndex());
                }
            }
            sources = supporting.stream().map(draft::passage).flatMap(Optional::stream).toList();
        }
        Map<String, LegalDocument> documents = this.chunkIndex.snapshot().documents();
        List<Citation> citations = new ArrayList<>(sources.size());
        for (ContextPassage passage : sources) {
            citations.add(this.toCitation(passage, documents));
        }
        return new AnswerResult(draft.text(), citations, conversationId, true, AnswerOutcome.ACCEPTED, calls,
                trace.getTraceId());
    }

    private Citation toCitation(ContextPassage passage, Map<String, LegalDocument> documents) {
        RerankedCandidate candidate = passage.candidate();
        String documentId = candidate.chunk().documentId();
        LegalDocument document = documents.get(documentId);
        String text = passage.text();
        String excerpt = text.length() <= this.citationExcerptChars ? text : text.substring(0, this.citationExcerptChars) + "...";
        double score = Math.round(candidate.relevanceScore() * 1000.0) / 1000.0;
        return new Citation(candidate.chunkId().toString(), documentId, document == null ? documentId : document.filename(),
                passage.pageNumber(), excerpt, score);
    }

    private AnswerResult noRelevantInformation(String conversationId, ReasoningTrace trace) {
        return new AnswerResult(NO_RELEVANT_INFORMATION_ANSWER, List.of(), conversationId, false,
                AnswerOutcome.INSUFFICIENT_CONTEXT, 0, trace.getTraceId());
    }

    private AnswerResult suppressed(String conversationId, int calls, ReasoningTrace trace) {
        return new AnswerResult(SUPPRESSED_ANSWER, List.of(), conversationId, false, AnswerOutcome.SUPPRESSED, calls,
                trace.getTraceId());
    }

    private void recordFailure(ReasoningTrace trace, PipelineStageException e, String query, long stepStart) {
        log.warn("{} for {}: {}", e.getFailure(), LogSanitizer.querySummary(query), e.getMessage());
        this.reasoningTracer.addStep(trace, ReasoningStep.StepType.ERROR, e.getFailure().name(), e.getMessage(),
                System.currentTimeMillis() - stepStart);
    }

    private final class ConversationTurnTask extends FutureTask<AnswerResult> {
        private final ConversationState conversation;

        ConversationTurnTask(ConversationState conversation, Callable<AnswerResult> callable) {
            super(callable);
            this.conversation = conversation;
        }

        @Override
        public void run() {
            try {
                super.run();
            }
            finally {
                LegalRagOrchestrator.this.startNextTurn(this.conversation);
            }
        }

        void reject(RejectedExecutionException e) {
            this.setException(e);
        }
    }
}
