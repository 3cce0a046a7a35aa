package com.openforge.memorylane.memory.milvus;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.reflect.TypeToken;
import com.openforge.memorylane.memory.Feedback;
import com.openforge.memorylane.memory.Memory;
import com.openforge.memorylane.memory.MemoryStore.MemoryNotFoundException;
import com.openforge.memorylane.memory.VectorEntry;
import io.milvus.orm.iterator.QueryIterator;
import io.milvus.response.QueryResultsWrapper.RowRecord;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.QueryIteratorReq;
import io.milvus.v2.service.vector.request.QueryReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.response.DeleteResp;
import io.milvus.v2.service.vector.response.QueryResp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.openforge.memorylane.fixture.MemoryFixture.NOW;
import static com.openforge.memorylane.fixture.MemoryFixture.memory;
import static com.openforge.memorylane.fixture.MemoryFixture.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MilvusMemoryStoreTest {

    private static final MilvusProperties PROPS =
            new MilvusProperties("localhost", 19530, "memorylane_memories", 2, 2);

    @Mock
    private MilvusClientV2 milvusClient;

    private MilvusMemoryStore store;

    @BeforeEach
    void setUp() {
        store = new MilvusMemoryStore(milvusClient, PROPS);
    }

    @Test
    @DisplayName("a saved row reads back as the same memory")
    void save_thenFindById() {
        Memory original = memory("m1", "Adopt Kafka", Set.of("kafka", "billing"), vector(0.6f, 0.8f), NOW);

        store.save(original);

        ArgumentCaptor<UpsertReq> upsert = ArgumentCaptor.forClass(UpsertReq.class);
        verify(milvusClient).upsert(upsert.capture());
        JsonObject row = upsert.getValue().getData().get(0);
        assertThat(row.get("memory_type").getAsString()).isEqualTo("decision");

        QueryResp resp = queryReturning(asEntity(row));
        when(milvusClient.query(any(QueryReq.class))).thenReturn(resp);

        Memory loaded = store.findById("m1").orElseThrow();
        assertThat(loaded.id()).isEqualTo("m1");
        assertThat(loaded.relatedEntities()).containsExactlyInAnyOrderElementsOf(original.relatedEntities());
        assertThat(loaded.embedding()).isEqualTo(original.embedding());
        assertThat(loaded.createdAt()).isEqualTo(NOW);
        assertThat(loaded.timesObserved()).isEqualTo(1);
    }

    @Test
    @DisplayName("wrong vector dimension is rejected before writing")
    void save_dimensionMismatch() {
        Memory m = memory("m1", "Adopt Kafka", Set.of(), vector(1f, 0f, 0f), NOW);

        assertThatThrownBy(() -> store.save(m)).isInstanceOf(IllegalArgumentException.class);
        verify(milvusClient, never()).upsert(any());
    }

    @Test
    @DisplayName("delete reports whether a row was removed")
    void delete_reportsCount() {
        DeleteResp found = mock(DeleteResp.class);
        when(found.getDeleteCnt()).thenReturn(1L);
        when(milvusClient.delete(any(DeleteReq.class))).thenReturn(found);

        assertThat(store.delete("m1")).isTrue();

        ArgumentCaptor<DeleteReq> req = ArgumentCaptor.forClass(DeleteReq.class);
        verify(milvusClient).delete(req.capture());
        assertThat(req.getValue().getFilter()).isEqualTo("id == \"m1\"");
    }

    @Test
    @DisplayName("update of an unknown id fails")
    void update_unknown() {
        QueryResp empty = mock(QueryResp.class);
        when(empty.getQueryResults()).thenReturn(List.of());
        when(milvusClient.query(any(QueryReq.class))).thenReturn(empty);

        assertThatThrownBy(() -> store.update(memory("ghost", "T", Set.of(), vector(1f, 0f), NOW)))
                .isInstanceOf(MemoryNotFoundException.class);
    }

    @Test
    @DisplayName("feedback re-writes the row with the bumped counter")
    void recordFeedback_upsertsCounter() {
        store.save(memory("m1", "Adopt Kafka", Set.of("kafka"), vector(0.6f, 0.8f), NOW));
        ArgumentCaptor<UpsertReq> first = ArgumentCaptor.forClass(UpsertReq.class);
        verify(milvusClient).upsert(first.capture());
        QueryResp resp = queryReturning(asEntity(first.getValue().getData().get(0)));
        when(milvusClient.query(any(QueryReq.class))).thenReturn(resp);

        Memory updated = store.recordFeedback("m1", Feedback.POSITIVE);

        assertThat(updated.positiveFeedback()).isEqualTo(1);
        ArgumentCaptor<UpsertReq> upserts = ArgumentCaptor.forClass(UpsertReq.class);
        verify(milvusClient, times(2)).upsert(upserts.capture());
        JsonObject row = upserts.getAllValues().get(1).getData().get(0);
        assertThat(row.get("positive_feedback").getAsInt()).isEqualTo(1);
        assertThat(row.get("negative_feedback").getAsInt()).isZero();
    }

    @Test
    @DisplayName("full scans walk every page of the iterator")
    void vectors_readsAllPages() {
        store.save(memory("m1", "Adopt Kafka", Set.of("kafka"), vector(1f, 0f), NOW));
        store.save(memory("m2", "Use Postgres", Set.of("postgres"), vector(0f, 1f), NOW));
        store.save(memory("m3", "Pin Gradle", Set.of("gradle"), vector(0.6f, 0.8f), NOW));
        ArgumentCaptor<UpsertReq> upserts = ArgumentCaptor.forClass(UpsertReq.class);
        verify(milvusClient, times(3)).upsert(upserts.capture());
        List<RowRecord> rows = upserts.getAllValues().stream()
                .map(req -> toRecord(req.getData().get(0)))
                .toList();

        QueryIterator iterator = mock(QueryIterator.class);
        when(iterator.next())
                .thenReturn(List.of(rows.get(0), rows.get(1)))
                .thenReturn(List.of(rows.get(2)))
                .thenReturn(List.of());
        ArgumentCaptor<QueryIteratorReq> req = ArgumentCaptor.forClass(QueryIteratorReq.class);
        when(milvusClient.queryIterator(req.capture())).thenReturn(iterator);

        List<VectorEntry> vectors = store.vectors();

        assertThat(vectors).extracting(VectorEntry::memoryId).containsExactly("m1", "m2", "m3");
        assertThat(req.getValue().getBatchSize()).isEqualTo(2L);
        verify(iterator).close();
    }

    private static RowRecord toRecord(JsonObject row) {
        RowRecord record = new RowRecord();
        asEntity(row).forEach(record::put);
        return record;
    }

    private static Map<String, Object> asEntity(JsonObject row) {
        return new Gson().fromJson(row, new TypeToken<Map<String, Object>>() { }.getType());
    }

    private static QueryResp queryReturning(Map<String, Object> entity) {
        QueryResp.QueryResult result = mock(QueryResp.QueryResult.class);
        when(result.getEntity()).thenReturn(entity);
        QueryResp resp = mock(QueryResp.class);
        when(resp.getQueryResults()).thenReturn(List.of(result));
        return resp;
    }
}
