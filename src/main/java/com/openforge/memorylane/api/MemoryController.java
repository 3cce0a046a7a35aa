package com.openforge.memorylane.api;

import com.openforge.memorylane.embedding.EmbeddingService;
import com.openforge.memorylane.embedding.EmbeddingStatus;
import com.openforge.memorylane.memory.CancellationSignal;
import com.openforge.memorylane.memory.ExtractionReport;
import com.openforge.memorylane.memory.Memory;
import com.openforge.memorylane.memory.MemoryExtractionService;
import com.openforge.memorylane.memory.MemoryStore;
import com.openforge.memorylane.memory.ProgressListener;
import com.openforge.memorylane.retrieval.DualRetrievalService;
import com.openforge.memorylane.retrieval.QueryEntityExtractor;
import com.openforge.memorylane.retrieval.RecallFeedbackService;
import com.openforge.memorylane.retrieval.RetrievalProperties;
import com.openforge.memorylane.retrieval.RetrievalQuery;
import com.openforge.memorylane.retrieval.RetrievalResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Thin REST adapter over extraction, retrieval and the memory store.
 *
 * ┌──────────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                              Description                       │
 * ├──────────────────────────────────────────────────────────────────────────┤
 * │  POST   /api/sessions/{id}/extract     extract memories from a session   │
 * │  POST   /api/memories/retrieve         hybrid entity + semantic search   │
 * │  GET    /api/memories?session=xxx      list memories (optionally by sid) │
 * │  GET    /api/memories/{id}             one memory                        │
 * │  DELETE /api/memories/{id}             delete one memory                 │
 * │  POST   /api/memories/{id}/feedback    helpful / unhelpful vote          │
 * │  GET    /api/embedding/status          embedding mode and reachability   │
 * └──────────────────────────────────────────────────────────────────────────┘
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MemoryController {

    private final MemoryExtractionService extractionService;
    private final DualRetrievalService    retrievalService;
    private final QueryEntityExtractor    entityExtractor;
    private final MemoryStore             memoryStore;
    private final EmbeddingService        embeddingService;
    private final RecallFeedbackService   feedbackService;
    private final RetrievalProperties     retrievalProperties;

    // ── Extraction ───────────────────────────────────────────────────────────

    @PostMapping("/sessions/{sessionId}/extract")
    public ResponseEntity<ExtractionReport> extract(@PathVariable String sessionId,
                                                    @RequestBody(required = false) ExtractRequest request) {
        String apiKey = request == null ? null : request.apiKey();
        return ResponseEntity.ok(extractionService.extract(
                sessionId, apiKey, CancellationSignal.none(), ProgressListener.NONE));
    }

    // ── Retrieval ────────────────────────────────────────────────────────────

    @PostMapping("/memories/retrieve")
    public ResponseEntity<List<RetrievalResult>> retrieve(@Valid @RequestBody RetrieveRequest request) {
        Set<String> filters = new LinkedHashSet<>();
        if (request.entityFilters() != null) filters.addAll(request.entityFilters());
        if (request.autoEntities()) filters.addAll(entityExtractor.extract(request.text()));

        RetrievalQuery query = new RetrievalQuery(
                request.text(),
                new ArrayList<>(filters),
                request.threshold() != null ? request.threshold() : retrievalProperties.defaultThreshold(),
                request.topK()      != null ? request.topK()      : retrievalProperties.defaultTopK());

        return ResponseEntity.ok(retrievalService.retrieve(query));
    }

    @PostMapping("/memories/{id}/feedback")
    public ResponseEntity<Memory> feedback(@PathVariable String id,
                                           @Valid @RequestBody FeedbackRequest request) {
        return ResponseEntity.ok(feedbackService.submitFeedback(id, request.sessionId(), request.feedback()));
    }

    // ── Browse / delete ──────────────────────────────────────────────────────

    @GetMapping("/memories")
    public ResponseEntity<List<Memory>> list(@RequestParam(required = false) String session) {
        return ResponseEntity.ok(session == null || session.isBlank()
                ? memoryStore.findAll()
                : memoryStore.findBySession(session));
    }

    @GetMapping("/memories/{id}")
    public ResponseEntity<Memory> get(@PathVariable String id) {
        return memoryStore.findById(id)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new MemoryStore.MemoryNotFoundException(id));
    }

    @DeleteMapping("/memories/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        if (!memoryStore.delete(id)) {
            throw new MemoryStore.MemoryNotFoundException(id);
        }
        return ResponseEntity.noContent().build();
    }

    // ── Embedding ────────────────────────────────────────────────────────────

    @GetMapping("/embedding/status")
    public ResponseEntity<EmbeddingStatus> embeddingStatus() {
        return ResponseEntity.ok(embeddingService.embeddingStatus());
    }
}
