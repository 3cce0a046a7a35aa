package com.openforge.memorylane.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the local Ollama-compatible embedding endpoint.
 *
 * application.yml:
 *
 * memorylane:
 *   embedding:
 *     enabled: true
 *     base-url: http://localhost:11434
 *     model: mxbai-embed-large
 *     dimensions: 1024
 *     timeout-seconds: 30
 *     health-check-interval-seconds: 300
 *
 * Dimension reference:
 *   mxbai-embed-large  → 1024
 *   nomic-embed-text   → 768
 *   all-minilm         → 384
 *
 * enabled=false forces mock vectors without ever probing the endpoint.
 */
@ConfigurationProperties(prefix = "memorylane.embedding")
public record EmbeddingProperties(
        @DefaultValue("true")                   boolean enabled,
        @DefaultValue("http://localhost:11434") String  baseUrl,
        @DefaultValue("mxbai-embed-large")      String  model,
        @DefaultValue("1024")                   int     dimensions,
        @DefaultValue("30")                     int     timeoutSeconds,
        @DefaultValue("300")                    int     healthCheckIntervalSeconds
) {}
