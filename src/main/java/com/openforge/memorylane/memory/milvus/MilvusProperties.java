package com.openforge.memorylane.memory.milvus;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection parameters for the Milvus-backed memory store.
 * Only read when memorylane.store.type=milvus.
 *
 * application.yml:
 *
 * memorylane:
 *   milvus:
 *     host: localhost
 *     port: 19530
 *     collection-name: memorylane_memories
 *     vector-dimensions: 1024
 *     query-batch-size: 1000
 */
@ConfigurationProperties(prefix = "memorylane.milvus")
public record MilvusProperties(
        @DefaultValue("localhost")           String host,
        @DefaultValue("19530")               int    port,
        @DefaultValue("memorylane_memories") String collectionName,
        @DefaultValue("1024")                int    vectorDimensions,
        @DefaultValue("1000")                int    queryBatchSize
) {}
