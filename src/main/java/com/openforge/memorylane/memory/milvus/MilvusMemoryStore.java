package com.openforge.memorylane.memory.milvus;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.openforge.memorylane.embedding.EmbeddingMode;
import com.openforge.memorylane.embedding.FixedVector;
import com.openforge.memorylane.extraction.MemoryType;
import com.openforge.memorylane.memory.Feedback;
import com.openforge.memorylane.memory.Memory;
import com.openforge.memorylane.memory.MemoryMatcher;
import com.openforge.memorylane.memory.MemoryStore;
import com.openforge.memorylane.memory.VectorEntry;
import io.milvus.orm.iterator.QueryIterator;
import io.milvus.response.QueryResultsWrapper;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.ConsistencyLevel;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.QueryIteratorReq;
import io.milvus.v2.service.vector.request.QueryReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.response.DeleteResp;
import io.milvus.v2.service.vector.response.QueryResp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link MemoryStore} on a Milvus collection.
 *
 * Rows are keyed by the memory UUID and written with upsert, so save and update
 * share one path. Entity/text matching needs case-insensitive substring tests that
 * Milvus filter expressions cannot express, so it runs in Java over a full scan;
 * the same scan feeds {@link #vectors()} for exact cosine ranking.
 *
 * Multi-row reads go through a query iterator in pages of {@code queryBatchSize}
 * rows, so they are not bounded by the server's query result window.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "memorylane.store.type", havingValue = "milvus")
public class MilvusMemoryStore implements MemoryStore {

    static final String F_ID               = "id";
    static final String F_SESSION_ID       = "session_id";
    static final String F_TYPE             = "memory_type";
    static final String F_CATEGORY         = "category";
    static final String F_TITLE            = "title";
    static final String F_CONTENT          = "content";
    static final String F_SOURCE_CHUNK_REF = "source_chunk_ref";
    static final String F_ENTITIES         = "related_entities";
    static final String F_RAW_CONFIDENCE   = "raw_confidence";
    static final String F_REASONING        = "reasoning";
    static final String F_EVIDENCE         = "evidence";
    static final String F_CONFIDENCE_SCORE = "confidence_score";
    static final String F_EMBEDDING_MODE   = "embedding_mode";
    static final String F_CREATED_MS       = "create_time_ms";
    static final String F_TIMES_OBSERVED   = "times_observed";
    static final String F_LAST_OBSERVED_MS = "last_observed_ms";
    static final String F_POSITIVE_FEEDBACK = "positive_feedback";
    static final String F_NEGATIVE_FEEDBACK = "negative_feedback";
    static final String F_EMBEDDING        = "embedding";

    private static final List<String> ALL_FIELDS = List.of(
            F_ID, F_SESSION_ID, F_TYPE, F_CATEGORY, F_TITLE, F_CONTENT, F_SOURCE_CHUNK_REF,
            F_ENTITIES, F_RAW_CONFIDENCE, F_REASONING, F_EVIDENCE, F_CONFIDENCE_SCORE,
            F_EMBEDDING_MODE, F_CREATED_MS, F_TIMES_OBSERVED, F_LAST_OBSERVED_MS,
            F_POSITIVE_FEEDBACK, F_NEGATIVE_FEEDBACK, F_EMBEDDING);

    private static final String MATCH_ALL = F_ID + " != \"\"";

    private static final Comparator<Memory> OLDEST_FIRST =
            Comparator.comparing(Memory::createdAt).thenComparing(Memory::id);

    private final MilvusClientV2   milvusClient;
    private final MilvusProperties props;
    private final Gson             gson      = new Gson();
    private final ReentrantLock    writeLock = new ReentrantLock();

    public MilvusMemoryStore(MilvusClientV2 milvusClient, MilvusProperties props) {
        this.milvusClient = milvusClient;
        this.props        = props;
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    @Override
    public Memory save(Memory memory) {
        if (memory.embedding().dimension() != props.vectorDimensions()) {
            throw new IllegalArgumentException("Memory %s has dimension %d, collection expects %d"
                    .formatted(memory.id(), memory.embedding().dimension(), props.vectorDimensions()));
        }
        writeLock.lock();
        try {
            milvusClient.upsert(UpsertReq.builder()
                    .collectionName(props.collectionName())
                    .data(List.of(toRow(memory)))
                    .build());
        } finally {
            writeLock.unlock();
        }
        log.debug("[Milvus] Upserted memory {} ({})", memory.id(), memory.type().wireName());
        return memory;
    }

    @Override
    public Memory update(Memory memory) {
        if (findById(memory.id()).isEmpty()) {
            throw new MemoryNotFoundException(memory.id());
        }
        return save(memory);
    }

    @Override
    public Memory recordFeedback(String id, Feedback feedback) {
        writeLock.lock();
        try {
            Memory current = findById(id).orElseThrow(() -> new MemoryNotFoundException(id));
            Memory updated = save(current.withFeedback(feedback));
            log.info("[Milvus] Recorded {} feedback on memory {}", feedback.wireName(), id);
            return updated;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        if (id == null || id.isBlank()) return false;
        writeLock.lock();
        try {
            DeleteResp resp = milvusClient.delete(DeleteReq.builder()
                    .collectionName(props.collectionName())
                    .filter(eq(F_ID, id))
                    .build());
            boolean deleted = resp != null && resp.getDeleteCnt() > 0;
            log.info("[Milvus] Deleted memory id={} ({})", id, deleted ? "found" : "absent");
            return deleted;
        } finally {
            writeLock.unlock();
        }
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    @Override
    public Optional<Memory> findById(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        QueryResp resp = milvusClient.query(QueryReq.builder()
                .collectionName(props.collectionName())
                .filter(eq(F_ID, id))
                .outputFields(ALL_FIELDS)
                .limit(1)
                .consistencyLevel(ConsistencyLevel.STRONG)
                .build());
        if (resp == null || resp.getQueryResults() == null) return Optional.empty();
        return resp.getQueryResults().stream()
                .map(r -> toMemory(r.getEntity()))
                .filter(Objects::nonNull)
                .findFirst();
    }

    @Override
    public List<Memory> findAll() {
        return query(MATCH_ALL).stream().sorted(OLDEST_FIRST).toList();
    }

    @Override
    public List<Memory> findBySession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) return List.of();
        return query(eq(F_SESSION_ID, sessionId)).stream().sorted(OLDEST_FIRST).toList();
    }

    @Override
    public long count() {
        QueryResp resp = milvusClient.query(QueryReq.builder()
                .collectionName(props.collectionName())
                .filter(MATCH_ALL)
                .outputFields(List.of("count(*)"))
                .consistencyLevel(ConsistencyLevel.STRONG)
                .build());
        if (resp == null || resp.getQueryResults().isEmpty()) return 0L;

        Object count = resp.getQueryResults().get(0).getEntity().get("count(*)");
        return count instanceof Number n ? n.longValue() : 0L;
    }

    @Override
    public List<Memory> findByEntityOrText(Collection<String> entityFilters, String text) {
        MemoryMatcher matcher = MemoryMatcher.of(entityFilters, text);
        if (matcher.isEmpty()) return List.of();
        return findAll().stream().filter(matcher::matches).toList();
    }

    @Override
    public List<VectorEntry> vectors() {
        return query(MATCH_ALL).stream().map(VectorEntry::of).toList();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<Memory> query(String filter) {
        QueryIterator iterator = milvusClient.queryIterator(QueryIteratorReq.builder()
                .collectionName(props.collectionName())
                .expr(filter)
                .outputFields(ALL_FIELDS)
                .batchSize(props.queryBatchSize())
                .consistencyLevel(ConsistencyLevel.STRONG)
                .build());

        List<Memory> list = new ArrayList<>();
        try {
            while (true) {
                List<QueryResultsWrapper.RowRecord> page = iterator.next();
                if (page == null || page.isEmpty()) break;
                for (QueryResultsWrapper.RowRecord row : page) {
                    Memory memory = toMemory(row.getFieldValues());
                    if (memory != null) list.add(memory);
                }
            }
        } finally {
            iterator.close();
        }
        return list;
    }

    private JsonObject toRow(Memory m) {
        JsonObject row = new JsonObject();
        row.addProperty(F_ID,               m.id());
        row.addProperty(F_SESSION_ID,       truncate(m.sessionId(), 256));
        row.addProperty(F_TYPE,             m.type().wireName());
        row.addProperty(F_CATEGORY,         truncate(m.category(), 256));
        row.addProperty(F_TITLE,            truncate(m.title(), 1024));
        row.addProperty(F_CONTENT,          truncate(m.content(), 8192));
        row.addProperty(F_SOURCE_CHUNK_REF, truncate(m.sourceChunkRef(), 300));
        row.addProperty(F_ENTITIES,         truncate(gson.toJson(m.relatedEntities()), 4096));
        row.addProperty(F_RAW_CONFIDENCE,   m.rawConfidence());
        row.addProperty(F_REASONING,        truncate(m.reasoning(), 4096));
        row.addProperty(F_EVIDENCE,         truncate(gson.toJson(m.evidence()), 16384));
        row.addProperty(F_CONFIDENCE_SCORE, (float) m.confidenceScore());
        row.addProperty(F_EMBEDDING_MODE,   m.embedding().mode().wireName());
        row.addProperty(F_CREATED_MS,       m.createdAt().toEpochMilli());
        row.addProperty(F_TIMES_OBSERVED,   m.timesObserved());
        row.addProperty(F_LAST_OBSERVED_MS, m.lastObservedAt().toEpochMilli());
        row.addProperty(F_POSITIVE_FEEDBACK, m.positiveFeedback());
        row.addProperty(F_NEGATIVE_FEEDBACK, m.negativeFeedback());

        JsonArray embeddingArray = new JsonArray();
        for (float f : m.embedding().values()) embeddingArray.add(f);
        row.add(F_EMBEDDING, embeddingArray);
        return row;
    }

    private Memory toMemory(Map<String, Object> e) {
        String id = str(e, F_ID);
        Optional<MemoryType> type = MemoryType.fromWireName(str(e, F_TYPE));
        if (type.isEmpty()) {
            log.warn("[Milvus] Skipping row {} with unknown memory_type '{}'", id, str(e, F_TYPE));
            return null;
        }
        try {
            return Memory.builder()
                    .id(id)
                    .sessionId(str(e, F_SESSION_ID))
                    .type(type.get())
                    .category(str(e, F_CATEGORY))
                    .title(str(e, F_TITLE))
                    .content(str(e, F_CONTENT))
                    .sourceChunkRef(str(e, F_SOURCE_CHUNK_REF))
                    .relatedEntities(new LinkedHashSet<>(strings(str(e, F_ENTITIES))))
                    .rawConfidence((int) num(e, F_RAW_CONFIDENCE))
                    .reasoning(str(e, F_REASONING))
                    .evidence(strings(str(e, F_EVIDENCE)))
                    .confidenceScore(Math.max(0.0, Math.min(1.0, num(e, F_CONFIDENCE_SCORE))))
                    .embedding(new FixedVector(vector(e.get(F_EMBEDDING)), mode(str(e, F_EMBEDDING_MODE))))
                    .createdAt(Instant.ofEpochMilli((long) num(e, F_CREATED_MS)))
                    .timesObserved((int) num(e, F_TIMES_OBSERVED))
                    .lastObservedAt(Instant.ofEpochMilli((long) num(e, F_LAST_OBSERVED_MS)))
                    .positiveFeedback((int) num(e, F_POSITIVE_FEEDBACK))
                    .negativeFeedback((int) num(e, F_NEGATIVE_FEEDBACK))
                    .build();
        } catch (IllegalArgumentException | JsonParseException ex) {
            log.warn("[Milvus] Skipping unreadable row {}: {}", id, ex.getMessage());
            return null;
        }
    }

    private List<String> strings(String json) {
        if (json == null || json.isBlank()) return List.of();
        String[] values = gson.fromJson(json, String[].class);
        return values == null ? List.of() : Arrays.asList(values);
    }

    private static float[] vector(Object raw) {
        if (!(raw instanceof List<?> list)) {
            throw new IllegalArgumentException("embedding field missing");
        }
        float[] values = new float[list.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = ((Number) list.get(i)).floatValue();
        }
        return values;
    }

    private static EmbeddingMode mode(String raw) {
        return EmbeddingMode.MOCK.wireName().equals(raw) ? EmbeddingMode.MOCK : EmbeddingMode.REAL;
    }

    private static String eq(String field, String value) {
        return "%s == \"%s\"".formatted(field, value.replace("\\", "\\\\").replace("\"", "\\\""));
    }

    private static String str(Map<String, Object> e, String key) {
        Object value = e.get(key);
        return value == null ? "" : value.toString();
    }

    private static double num(Map<String, Object> e, String key) {
        Object value = e.get(key);
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) return "";
        return text.length() <= maxLen ? text : text.substring(0, maxLen);
    }
}
