package com.jreinhal.legaldoc.controller;

import com.jreinhal.legaldoc.dto.AskRequest;
import com.jreinhal.legaldoc.dto.AskResponse;
import com.jreinhal.legaldoc.dto.IndexDocumentRequest;
import com.jreinhal.legaldoc.dto.IndexResponse;
import com.jreinhal.legaldoc.exception.QueryCancelledException;
import com.jreinhal.legaldoc.model.AnswerResult;
import com.jreinhal.legaldoc.model.LegalDocument;
import com.jreinhal.legaldoc.reasoning.ReasoningTracer;
import com.jreinhal.legaldoc.service.ConversationStore;
import com.jreinhal.legaldoc.service.DocumentIndexingService;
import com.jreinhal.legaldoc.service.LegalRagOrchestrator;
import com.jreinhal.legaldoc.util.LogSanitizer;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value = {"/api"})
public class LegalRagController {
    private static final Logger log = LoggerFactory.getLogger(LegalRagController.class);
    private final LegalRagOrchestrator orchestrator;
    private final DocumentIndexingService indexingService;
    private final ConversationStore conversationStore;
    private final ReasoningTracer reasoningTracer;

    public LegalRagController(LegalRagOrchestrator orchestrator, DocumentIndexingService indexingService,
                              ConversationStore conversationStore, ReasoningTracer reasoningTracer) {
        this.orchestrator = orchestrator;
        this.indexingService = indexingService;
        this.conversationStore = conversationStore;
        this.reasoningTracer = reasoningTracer;
    }

    @PostMapping(value = {"/ask"})
    public AskResponse ask(@RequestBody AskRequest request) {
        Future<AnswerResult> future = this.orchestrator.submit(request.query(), request.conversationId());
        try {
            return AskResponse.from(future.get());
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new QueryCancelledException("Request interrupted", e);
        }
        catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Query failed", e.getCause());
        }
    }

    @PostMapping(value = {"/documents"})
    public ResponseEntity<IndexResponse> indexDocument(@RequestBody IndexDocumentRequest request) {
        List<DocumentIndexingService.ChunkInput> chunks = request.chunks() == null ? List.of() : request.chunks().stream()
                .map(c -> new DocumentIndexingService.ChunkInput(c.pageNumber(), c.text()))
                .toList();
        LegalDocument document = this.indexingService.indexDocument(request.documentId(), request.filename(), chunks);
        log.info("Indexed {} as {} ({} chunks)", LogSanitizer.sanitize(document.filename()), document.id(),
                document.chunkCount());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new IndexResponse(document.id(), document.filename(), document.chunkCount(), document.indexedAt()));
    }

    @GetMapping(value = {"/documents"})
    public List<DocumentIndexingService.DocumentSummary> listDocuments() {
        return this.indexingService.listDocuments();
    }

    @DeleteMapping(value = {"/documents/{id}"})
    public ResponseEntity<Void> removeDocument(@PathVariable String id) {
        return this.indexingService.removeDocument(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @DeleteMapping(value = {"/conversations/{id}"})
    public ResponseEntity<Void> clearConversation(@PathVariable String id) {
        return this.conversationStore.clear(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping(value = {"/conversations/stats"})
    public Map<String, Object> conversationStats() {
        return Map.of("activeConversations", this.conversationStore.activeCount(),
                "queriesAnswered", this.orchestrator.getQueryCount(),
                "averageLatencyMs", this.orchestrator.getAverageLatencyMs());
    }

    @GetMapping(value = {"/traces/{traceId}"})
    public ResponseEntity<Map<String, Object>> getTrace(@PathVariable String traceId) {
        return this.reasoningTracer.getTrace(traceId)
                .map(trace -> ResponseEntity.ok(trace.toMap()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
