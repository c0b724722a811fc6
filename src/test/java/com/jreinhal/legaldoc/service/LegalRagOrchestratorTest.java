package com.jreinhal.legaldoc.service;

import static com.jreinhal.legaldoc.LegalDocFixtures.candidate;
import static com.jreinhal.legaldoc.LegalDocFixtures.chunk;
import static com.jreinhal.legaldoc.LegalDocFixtures.document;
import static com.jreinhal.legaldoc.LegalDocFixtures.reranked;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.legaldoc.config.ConversationProperties;
import com.jreinhal.legaldoc.config.PipelineProperties;
import com.jreinhal.legaldoc.exception.InvalidQueryException;
import com.jreinhal.legaldoc.exception.PipelineStageException;
import com.jreinhal.legaldoc.exception.StageFailure;
import com.jreinhal.legaldoc.index.ChunkIndex;
import com.jreinhal.legaldoc.model.AnswerOutcome;
import com.jreinhal.legaldoc.model.AnswerResult;
import com.jreinhal.legaldoc.model.Chunk;
import com.jreinhal.legaldoc.model.ContextPassage;
import com.jreinhal.legaldoc.model.ConversationState;
import com.jreinhal.legaldoc.model.ConversationTurn;
import com.jreinhal.legaldoc.model.DraftAnswer;
import com.jreinhal.legaldoc.model.ExpandedQuery;
import com.jreinhal.legaldoc.model.RerankedCandidate;
import com.jreinhal.legaldoc.model.RetrievalCandidate;
import com.jreinhal.legaldoc.rag.crag.ClaimSupportChecker;
import com.jreinhal.legaldoc.rag.crag.CorrectiveValidator;
import com.jreinhal.legaldoc.rag.generation.AnswerGenerator;
import com.jreinhal.legaldoc.rag.generation.CitationMarkers;
import com.jreinhal.legaldoc.rag.generation.GenerationRequest;
import com.jreinhal.legaldoc.rag.hybridrag.HybridRetriever;
import com.jreinhal.legaldoc.rag.hybridrag.HybridRetriever.HybridRetrievalResult;
import com.jreinhal.legaldoc.rag.knowledge.KnowledgeExpander;
import com.jreinhal.legaldoc.rag.preprocess.EntityRecognizer;
import com.jreinhal.legaldoc.rag.rerank.Reranker;
import com.jreinhal.legaldoc.reasoning.ReasoningStep;
import com.jreinhal.legaldoc.reasoning.ReasoningTracer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class LegalRagOrchestratorTest {
    private static final String ARTICLE_21 = "Article 21: No person shall be deprived of his life or personal liberty "
            + "except according to procedure established by law.";
    private static final String ARTICLE_14 = "Article 14: The State shall not deny to any person equality before the law "
            + "or the equal protection of the laws.";
    private static final String SUPPORTED = "Article 21 says no person shall be deprived of life or personal liberty [1].";
    private static final String UNSUPPORTED = "Article 21 also guarantees free legal aid to every accused [1].";
    private static final String QUERY = "What does Article 21 protect?";

    private EntityRecognizer entityRecognizer;
    private KnowledgeExpander knowledgeExpander;
    private HybridRetriever hybridRetriever;
    private Reranker reranker;
    private AnswerGenerator answerGenerator;
    private ClaimSupportChecker claimSupportChecker;
    private QueryContextualizer queryContextualizer;
    private InMemoryConversationStore conversationStore;
    private ChunkIndex chunkIndex;
    private ReasoningTracer reasoningTracer;
    private PipelineProperties pipelineProperties;
    private ConversationProperties conversationProperties;
    private ExecutorService stageExecutor;
    private ExecutorService pipelineExecutor;
    private LegalRagOrchestrator orchestrator;

    private final Chunk article21 = chunk("coi", 0, 12, ARTICLE_21);
    private final Chunk article14 = chunk("coi", 1, 5, ARTICLE_14);
    private List<RetrievalCandidate> candidates;
    private List<RerankedCandidate> ranked;

    @BeforeEach
    void setUp() {
        this.entityRecognizer = mock(EntityRecognizer.class);
        this.knowledgeExpander = mock(KnowledgeExpander.class);
        this.hybridRetriever = mock(HybridRetriever.class);
        this.reranker = mock(Reranker.class);
        this.answerGenerator = mock(AnswerGenerator.class);
        this.queryContextualizer = mock(QueryContextualizer.class);
        this.claimSupportChecker = spy(new ClaimSupportChecker(null));
        this.claimSupportChecker.init();
        this.pipelineProperties = new PipelineProperties();
        this.conversationProperties = new ConversationProperties();
        this.conversationStore = new InMemoryConversationStore(this.conversationProperties);
        this.conversationStore.init();
        this.chunkIndex = new ChunkIndex();
        this.chunkIndex.put(document("coi", "constitution.pdf", this.article21, this.article14));
        this.reasoningTracer = new ReasoningTracer();
        this.reasoningTracer.init();
        this.stageExecutor = Executors.newFixedThreadPool(4);
        this.pipelineExecutor = Executors.newFixedThreadPool(2);
        this.orchestrator = new LegalRagOrchestrator(this.entityRecognizer, this.knowledgeExpander, this.hybridRetriever,
                this.reranker, this.answerGenerator, new CorrectiveValidator(this.claimSupportChecker, this.pipelineProperties),
                this.queryContextualizer, this.conversationStore, this.chunkIndex, new StageRunner(this.stageExecutor),
                this.reasoningTracer, this.pipelineProperties, this.conversationProperties, this.pipelineExecutor);

        this.candidates = List.of(candidate(this.article21, 0.8, 1), candidate(this.article14, 0.5, 2));
        this.ranked = List.of(reranked(this.article21, 0.91234, 1), reranked(this.article14, 0.6, 2));
        when(this.hybridRetriever.retrieve(any())).thenReturn(new HybridRetrievalResult(this.candidates, Map.of()));
        when(this.reranker.rerank(anyString(), anyList())).thenReturn(this.ranked);
    }

    @AfterEach
    void tearDown() {
        this.pipelineExecutor.shutdownNow();
        this.stageExecutor.shutdownNow();
    }

    private DraftAnswer draft(String text, int attempt) {
        List<ContextPassage> passages = List.of(new ContextPassage(1, this.ranked.get(0)), new ContextPassage(2, this.ranked.get(1)));
        return new DraftAnswer(text, passages, CitationMarkers.indexes(text), attempt, false);
    }

    private int historySize(String conversationId) {
        return this.conversationStore.find(conversationId).map(ConversationState::size).orElse(0);
    }

    @Test
    @DisplayName("Empty corpus answers with the insufficient-information text and no generation")
    void emptyCorpus() {
        when(this.hybridRetriever.retrieve(any())).thenReturn(new HybridRetrievalResult(List.of(), Map.of("mode", "empty-index")));

        AnswerResult result = this.orchestrator.answer("What is due process?", "conv-a");

        assertThat(result.grounded()).isFalse();
        assertThat(result.citations()).isEmpty();
        assertThat(result.outcome()).isEqualTo(AnswerOutcome.INSUFFICIENT_CONTEXT);
        assertThat(result.answerText()).isEqualTo(LegalRagOrchestrator.NO_RELEVANT_INFORMATION_ANSWER);
        assertThat(result.generatorCalls()).isZero();
        verify(this.reranker, never()).rerank(anyString(), anyList());
        verify(this.answerGenerator, never()).generate(any());
        assertThat(historySize("conv-a")).isEqualTo(1);
    }

    @Test
    @DisplayName("Supported draft is returned with citations resolved against the index")
    void acceptedFirstTime() {
        when(this.answerGenerator.generate(any())).thenReturn(draft(SUPPORTED, 1));

        AnswerResult result = this.orchestrator.answer(QUERY, "conv-a");

        assertThat(result.outcome()).isEqualTo(AnswerOutcome.ACCEPTED);
        assertThat(result.grounded()).isTrue();
        assertThat(result.generatorCalls()).isEqualTo(1);
        assertThat(result.answerText()).isEqualTo(SUPPORTED);
        assertThat(result.citations()).singleElement().satisfies(c -> {
            assertThat(c.chunkId()).isEqualTo("coi#0");
            assertThat(c.filename()).isEqualTo("constitution.pdf");
            assertThat(c.pageNumber()).isEqualTo(12);
            assertThat(c.relevanceScore()).isEqualTo(0.912);
            assertThat(c.excerpt()).isEqualTo(ARTICLE_21);
        });
        assertThat(this.reasoningTracer.getTrace(result.traceId())).hasValueSatisfying(trace ->
                assertThat(trace.getSteps()).extracting(ReasoningStep::type)
                        .contains(ReasoningStep.StepType.HYBRID_RETRIEVAL, ReasoningStep.StepType.GENERATION,
                                ReasoningStep.StepType.VALIDATION, ReasoningStep.StepType.RESPONSE));
        assertThat(this.orchestrator.getQueryCount()).isEqualTo(1);
    }

    @Nested
    @DisplayName("Corrective loop")
    class CorrectiveLoopTest {
        @Test
        @DisplayName("An unsupported claim is regenerated with feedback, then the supported draft is accepted")
        void regenerateThenAccept() {
            when(answerGenerator.generate(any())).thenReturn(draft(UNSUPPORTED, 1), draft(SUPPORTED, 2));

            AnswerResult result = orchestrator.answer(QUERY, "conv-c");

            assertThat(result.outcome()).isEqualTo(AnswerOutcome.ACCEPTED);
            assertThat(result.generatorCalls()).isEqualTo(2);
            ArgumentCaptor<GenerationRequest> requests = ArgumentCaptor.forClass(GenerationRequest.class);
            verify(answerGenerator, times(2)).generate(requests.capture());
            GenerationRequest retry = requests.getAllValues().get(1);
            assertThat(retry.previousAttempts()).isEqualTo(1);
            assertThat(retry.feedback()).containsExactly("Article 21 also guarantees free legal aid to every accused.");
        }

        @Test
        @DisplayName("A claim still unsupported after two regenerations suppresses the answer")
        void suppressedAfterBudget() {
            String partial = SUPPORTED + " " + UNSUPPORTED;
            when(answerGenerator.generate(any())).thenReturn(draft(partial, 1), draft(partial, 2), draft(partial, 3));

            AnswerResult result = orchestrator.answer(QUERY, "conv-d");

            assertThat(result.outcome()).isEqualTo(AnswerOutcome.SUPPRESSED);
            assertThat(result.answerText()).isEqualTo(LegalRagOrchestrator.SUPPRESSED_ANSWER);
            assertThat(result.grounded()).isFalse();
            assertThat(result.citations()).isEmpty();
            assertThat(result.generatorCalls()).isEqualTo(3);
            verify(answerGenerator, times(3)).generate(any());
        }

        @Test
        @DisplayName("Generator calls never exceed retry budget + 1")
        void boundedByBudget() {
            pipelineProperties.setRetryBudget(1);
            when(answerGenerator.generate(any())).thenReturn(draft(SUPPORTED + " " + UNSUPPORTED, 1),
                    draft(SUPPORTED + " " + UNSUPPORTED, 2), draft(SUPPORTED, 3));

            AnswerResult result = orchestrator.answer(QUERY, "conv-d");

            assertThat(result.outcome()).isEqualTo(AnswerOutcome.SUPPRESSED);
            verify(answerGenerator, times(2)).generate(any());
        }

        @Test
        @DisplayName("A checker failure is treated as unsupported, never as supported")
        void validationFailure() {
            when(answerGenerator.generate(any())).thenReturn(draft(SUPPORTED, 1), draft(SUPPORTED, 2));
            doThrow(new IllegalStateException("checker crashed"))
                    .doCallRealMethod()
                    .when(claimSupportChecker).check(any());

            AnswerResult result = orchestrator.answer(QUERY, "conv-v");

            assertThat(result.outcome()).isEqualTo(AnswerOutcome.ACCEPTED);
            assertThat(result.generatorCalls()).isEqualTo(2);
            ArgumentCaptor<GenerationRequest> requests = ArgumentCaptor.forClass(GenerationRequest.class);
            verify(answerGenerator, times(2)).generate(requests.capture());
            assertThat(requests.getAllValues().get(1).feedback()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Degraded stages")
    class DegradedTest {
        @Test
        @DisplayName("Generation failure is retried once with the same context")
        void generationRetry() {
            when(answerGenerator.generate(any()))
                    .thenThrow(new PipelineStageException(StageFailure.GENERATION_FAILURE, "model timeout"))
                    .thenReturn(draft(SUPPORTED, 2));

            AnswerResult result = orchestrator.answer(QUERY, "conv-g");

            assertThat(result.outcome()).isEqualTo(AnswerOutcome.ACCEPTED);
            assertThat(result.generatorCalls()).isEqualTo(2);
        }

        @Test
        @DisplayName("Two generation failures in a row suppress the answer")
        void generationFailsTwice() {
            when(answerGenerator.generate(any()))
                    .thenThrow(new PipelineStageException(StageFailure.GENERATION_FAILURE, "model timeout"));

            AnswerResult result = orchestrator.answer(QUERY, "conv-g");

            assertThat(result.outcome()).isEqualTo(AnswerOutcome.SUPPRESSED);
            assertThat(result.generatorCalls()).isEqualTo(2);
            assertThat(historySize("conv-g")).isEqualTo(1);
        }

        @Test
        @DisplayName("Rerank failure keeps the fused order")
        void rerankFallback() {
            when(reranker.rerank(anyString(), anyList())).thenThrow(new IllegalStateException("scorer down"));
            when(reranker.fallback(candidates)).thenReturn(ranked);
            when(answerGenerator.generate(any())).thenReturn(draft(SUPPORTED, 1));

            AnswerResult result = orchestrator.answer(QUERY, "conv-r");

            assertThat(result.outcome()).isEqualTo(AnswerOutcome.ACCEPTED);
            verify(reranker).fallback(candidates);
        }

        @Test
        @DisplayName("Extraction failure continues with the unexpanded query")
        void extractionFailure() {
            when(entityRecognizer.extract(anyString())).thenThrow(new IllegalStateException("ner offline"));
            when(answerGenerator.generate(any())).thenReturn(draft(SUPPORTED, 1));

            AnswerResult result = orchestrator.answer(QUERY, "conv-e");

            assertThat(result.outcome()).isEqualTo(AnswerOutcome.ACCEPTED);
            verify(hybridRetriever).retrieve(argThat(q -> !q.isExpanded() && q.originalQuery().equals(QUERY)));
            verify(knowledgeExpander, never()).expand(anyString(), anyList());
        }

        @Test
        @DisplayName("A stage that exceeds its timeout is handled as that stage's failure")
        void extractionTimeout() {
            pipelineProperties.getTimeouts().setExtraction(Duration.ofMillis(50));
            when(entityRecognizer.extract(anyString())).thenAnswer(invocation -> {
                Thread.sleep(2000);
                return List.of();
            });
            when(answerGenerator.generate(any())).thenReturn(draft(SUPPORTED, 1));

            long start = System.currentTimeMillis();
            AnswerResult result = orchestrator.answer(QUERY, "conv-t");

            assertThat(result.outcome()).isEqualTo(AnswerOutcome.ACCEPTED);
            assertThat(System.currentTimeMillis() - start).isLessThan(1500);
        }

        @Test
        @DisplayName("Retrieval failure answers with the insufficient-information text")
        void retrievalFailure() {
            when(hybridRetriever.retrieve(any())).thenThrow(new IllegalStateException("index corrupted"));

            AnswerResult result = orchestrator.answer(QUERY, "conv-x");

            assertThat(result.outcome()).isEqualTo(AnswerOutcome.INSUFFICIENT_CONTEXT);
            verify(answerGenerator, never()).generate(any());
        }
    }

    @Nested
    @DisplayName("Conversations")
    class ConversationTest {
        @Test
        @DisplayName("Follow-ups are rewritten for retrieval while the generator sees the original question")
        void contextualizesFollowUps() {
            when(answerGenerator.generate(any())).thenReturn(draft(SUPPORTED, 1));
            orchestrator.answer(QUERY, "conv-f");
            when(queryContextualizer.contextualize(eq("What about exceptions?"), anyList()))
                    .thenReturn("What exceptions apply to Article 21?");

            orchestrator.answer("What about exceptions?", "conv-f");

            ArgumentCaptor<ExpandedQuery> retrieved = ArgumentCaptor.forClass(ExpandedQuery.class);
            verify(hybridRetriever, times(2)).retrieve(retrieved.capture());
            assertThat(retrieved.getAllValues().get(1).originalQuery()).isEqualTo("What exceptions apply to Article 21?");
            ArgumentCaptor<GenerationRequest> requests = ArgumentCaptor.forClass(GenerationRequest.class);
            verify(answerGenerator, times(2)).generate(requests.capture());
            GenerationRequest second = requests.getAllValues().get(1);
            assertThat(second.query()).isEqualTo("What about exceptions?");
            assertThat(second.history()).extracting(ConversationTurn::query).containsExactly(QUERY);
        }

        @Test
        @DisplayName("Concurrent queries on one conversation are recorded one turn at a time")
        void serializesTurns() throws Exception {
            when(answerGenerator.generate(any())).thenReturn(draft(SUPPORTED, 1));

            Future<AnswerResult> first = orchestrator.submit("First question about Article 21?", "conv-s");
            Future<AnswerResult> second = orchestrator.submit("Second question about Article 21?", "conv-s");
            first.get(10, TimeUnit.SECONDS);
            second.get(10, TimeUnit.SECONDS);

            ConversationState state = conversationStore.find("conv-s").orElseThrow();
            assertThat(state.turns()).extracting(ConversationTurn::query)
                    .containsExactlyInAnyOrder("First question about Article 21?", "Second question about Article 21?");
        }

        @Test
        @DisplayName("A busy conversation queues its queries without holding pool threads from other conversations")
        void busyConversationLeavesPoolForOthers() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(answerGenerator.generate(any())).thenAnswer(invocation -> {
                GenerationRequest request = invocation.getArgument(0);
                if (request.query().startsWith("Busy")) {
                    entered.countDown();
                    release.await();
                }
                return draft(SUPPORTED, 1);
            });

            List<Future<AnswerResult>> busy = new ArrayList<>();
            busy.add(orchestrator.submit("Busy question one about Article 21?", "conv-busy"));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            busy.add(orchestrator.submit("Busy question two about Article 21?", "conv-busy"));
            busy.add(orchestrator.submit("Busy question three about Article 21?", "conv-busy"));

            AnswerResult other = orchestrator.submit(QUERY, "conv-other").get(5, TimeUnit.SECONDS);

            assertThat(other.outcome()).isEqualTo(AnswerOutcome.ACCEPTED);
            ConversationState state = conversationStore.find("conv-busy").orElseThrow();
            assertThat(state.pendingTurnCount()).isEqualTo(2);
            release.countDown();
            for (Future<AnswerResult> turn : busy) {
                turn.get(10, TimeUnit.SECONDS);
            }
            assertThat(state.turns()).extracting(ConversationTurn::query).containsExactly(
                    "Busy question one about Article 21?", "Busy question two about Article 21?",
                    "Busy question three about Article 21?");
        }

        @Test
        void newConversationGetsAnId() {
            when(answerGenerator.generate(any())).thenReturn(draft(SUPPORTED, 1));

            AnswerResult result = orchestrator.answer(QUERY, null);

            assertThat(result.conversationId()).isNotBlank();
            assertThat(historySize(result.conversationId())).isEqualTo(1);
        }

        @Test
        @DisplayName("A cancelled query leaves the conversation history unchanged")
        void cancellationLeavesHistoryUnchanged() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(answerGenerator.generate(any()))
                    .thenAnswer(invocation -> {
                        entered.countDown();
                        release.await();
                        return draft(SUPPORTED, 1);
                    })
                    .thenReturn(draft(SUPPORTED, 1));

            Future<AnswerResult> inFlight = orchestrator.submit(QUERY, "conv-k");
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            inFlight.cancel(true);

            assertThatThrownBy(() -> inFlight.get()).isInstanceOf(CancellationException.class);
            AnswerResult next = orchestrator.answer("Does Article 21 cover liberty?", "conv-k");
            assertThat(next.outcome()).isEqualTo(AnswerOutcome.ACCEPTED);
            assertThat(conversationStore.find("conv-k").orElseThrow().turns())
                    .extracting(ConversationTurn::query)
                    .containsExactly("Does Article 21 cover liberty?");
        }
    }

    @Nested
    @DisplayName("Input validation")
    class ValidationTest {
        @Test
        void blankQuery() {
            assertThatThrownBy(() -> orchestrator.answer("  ", null)).isInstanceOf(InvalidQueryException.class);
        }

        @Test
        void overlongQuery() {
            pipelineProperties.setMaxQueryLength(10);

            assertThatThrownBy(() -> orchestrator.answer("This question is far too long", null))
                    .isInstanceOf(InvalidQueryException.class);
        }

        @Test
        void malformedConversationId() {
            assertThatThrownBy(() -> orchestrator.submit(QUERY, "../etc/passwd"))
                    .isInstanceOf(InvalidQueryException.class);
            verify(hybridRetriever, never()).retrieve(any());
        }
    }
}
