package com.openforge.memorylane.memory.milvus;

import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import io.milvus.v2.service.collection.request.LoadCollectionReq;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

/**
 * Milvus infrastructure, active only when memorylane.store.type=milvus.
 *
 * On startup:
 *   1. Creates a MilvusClientV2 connected to the configured host:port
 *   2. Creates the memory collection (schema + HNSW index) if missing
 *   3. Loads it so queries can run immediately
 *
 * Collection schema  (memorylane_memories):
 * ┌──────────────────┬─────────────────┬─────────────────────────────────────┐
 * │ Field            │ Type            │ Notes                               │
 * ├──────────────────┼─────────────────┼─────────────────────────────────────┤
 * │ id               │ VARCHAR(64) PK  │ client-generated UUID               │
 * │ session_id       │ VARCHAR(256)    │ session the memory came from        │
 * │ memory_type      │ VARCHAR(32)     │ wire name, e.g. "pattern_seed"      │
 * │ category         │ VARCHAR(256)    │                                     │
 * │ title            │ VARCHAR(1024)   │                                     │
 * │ content          │ VARCHAR(8192)   │                                     │
 * │ source_chunk_ref │ VARCHAR(300)    │ "<session>#<index>"                 │
 * │ related_entities │ VARCHAR(4096)   │ JSON array                          │
 * │ raw_confidence   │ INT32           │ 0 – 100                             │
 * │ reasoning        │ VARCHAR(4096)   │                                     │
 * │ evidence         │ VARCHAR(16384)  │ JSON array                          │
 * │ confidence_score │ FLOAT           │ 0.0 – 1.0                           │
 * │ embedding_mode   │ VARCHAR(8)      │ real / mock                         │
 * │ create_time_ms   │ INT64           │ epoch millis                        │
 * │ times_observed   │ INT32           │ ≥ 1                                 │
 * │ last_observed_ms │ INT64           │ epoch millis                        │
 * │ positive_feedback│ INT32           │ helpful votes                       │
 * │ negative_feedback│ INT32           │ unhelpful votes                     │
 * │ embedding        │ FLOAT_VECTOR    │ dim = vectorDimensions (1024)       │
 * └──────────────────┴─────────────────┴─────────────────────────────────────┘
 *
 * Index: HNSW on embedding, metric = COSINE.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "memorylane.store.type", havingValue = "milvus")
public class MilvusConfig {

    @Bean(destroyMethod = "close")
    public MilvusClientV2 milvusClient(MilvusProperties props) {
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        MilvusClientV2 client;
        try {
            client = new MilvusClientV2(
                    ConnectConfig.builder()
                            .uri("http://%s:%d".formatted(props.host(), props.port()))
                            .connectTimeoutMs(15_000)
                            .build()
            );
        } catch (RuntimeException e) {
            throw new IllegalStateException(
                    "Cannot connect to Milvus at %s:%d (memorylane.store.type=milvus): %s"
                            .formatted(props.host(), props.port(), e.getMessage()), e);
        }
        log.info("[Milvus] Connected successfully.");
        ensureCollectionExists(client, props);
        return client;
    }

    // ── Collection bootstrap ─────────────────────────────────────────────────

    private void ensureCollectionExists(MilvusClientV2 client, MilvusProperties props) {
        String name = props.collectionName();

        boolean exists = client.hasCollection(
                HasCollectionReq.builder().collectionName(name).build());

        if (exists) {
            log.info("[Milvus] Collection '{}' already exists, loading.", name);
            client.loadCollection(LoadCollectionReq.builder().collectionName(name).build());
            return;
        }

        log.info("[Milvus] Creating collection '{}' (dim={})...", name, props.vectorDimensions());

        CreateCollectionReq.CollectionSchema schema =
                CreateCollectionReq.CollectionSchema.builder().build();

        schema.addField(AddFieldReq.builder()
                .fieldName(MilvusMemoryStore.F_ID)
                .dataType(DataType.VarChar)
                .maxLength(64)
                .isPrimaryKey(true)
                .autoID(false)
                .build());

        varchar(schema, MilvusMemoryStore.F_SESSION_ID,       256);
        varchar(schema, MilvusMemoryStore.F_TYPE,             32);
        varchar(schema, MilvusMemoryStore.F_CATEGORY,         256);
        varchar(schema, MilvusMemoryStore.F_TITLE,            1024);
        varchar(schema, MilvusMemoryStore.F_CONTENT,          8192);
        varchar(schema, MilvusMemoryStore.F_SOURCE_CHUNK_REF, 300);
        varchar(schema, MilvusMemoryStore.F_ENTITIES,         4096);
        scalar (schema, MilvusMemoryStore.F_RAW_CONFIDENCE,   DataType.Int32);
        varchar(schema, MilvusMemoryStore.F_REASONING,        4096);
        varchar(schema, MilvusMemoryStore.F_EVIDENCE,         16384);
        scalar (schema, MilvusMemoryStore.F_CONFIDENCE_SCORE, DataType.Float);
        varchar(schema, MilvusMemoryStore.F_EMBEDDING_MODE,   8);
        scalar (schema, MilvusMemoryStore.F_CREATED_MS,       DataType.Int64);
        scalar (schema, MilvusMemoryStore.F_TIMES_OBSERVED,   DataType.Int32);
        scalar (schema, MilvusMemoryStore.F_LAST_OBSERVED_MS, DataType.Int64);
        scalar (schema, MilvusMemoryStore.F_POSITIVE_FEEDBACK, DataType.Int32);
        scalar (schema, MilvusMemoryStore.F_NEGATIVE_FEEDBACK, DataType.Int32);

        schema.addField(AddFieldReq.builder()
                .fieldName(MilvusMemoryStore.F_EMBEDDING)
                .dataType(DataType.FloatVector)
                .dimension(props.vectorDimensions())
                .build());

        IndexParam vectorIndex = IndexParam.builder()
                .fieldName(MilvusMemoryStore.F_EMBEDDING)
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.COSINE)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();

        IndexParam sessionIndex = IndexParam.builder()
                .fieldName(MilvusMemoryStore.F_SESSION_ID)
                .indexType(IndexParam.IndexType.TRIE)
                .build();

        client.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex, sessionIndex))
                .build());

        log.info("[Milvus] Collection '{}' created successfully.", name);
    }

    private static void varchar(CreateCollectionReq.CollectionSchema schema, String field, int maxLength) {
        schema.addField(AddFieldReq.builder()
                .fieldName(field)
                .dataType(DataType.VarChar)
                .maxLength(maxLength)
                .build());
    }

    private static void scalar(CreateCollectionReq.CollectionSchema schema, String field, DataType type) {
        schema.addField(AddFieldReq.builder()
                .fieldName(field)
                .dataType(type)
                .build());
    }
}
