package com.openforge.memorylane.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.memorylane.extraction.ExtractionProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Core infrastructure beans:
 *  - Extraction executor  → bounded pool; independent sessions are extracted in parallel
 *  - CLI I/O executor     → drains stdout/stderr of assistant CLI processes
 *  - Java HttpClient      → the ONLY HTTP engine, shared by the embedding client and the messages API
 *  - Jackson ObjectMapper → snake_case ↔ camelCase, Java time, tolerant deserialization
 *  - Clock                → created/observed timestamps and the embedding health-check cache
 */
@Configuration
public class AppConfig {

    /**
     * Stream readers for {@code ClaudeCliProvider}. Each call blocks on a pipe
     * until the process exits, so it gets its own pool.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService cliIoExecutor() {
        return Executors.newCachedThreadPool();
    }

    /**
     * Pool used by {@code MemoryExtractionService#extractSessions}. Chunks of a
     * single session are always processed sequentially on one worker.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService extractionExecutor(ExtractionProperties extractionProperties) {
        return Executors.newFixedThreadPool(extractionProperties.parallelSessions());
    }

    /**
     * Single, shared HttpClient instance.
     * Connect timeout is short because every endpoint we talk to is either
     * loopback (embedding) or a well-known API host; read timeouts are set per request.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper:
     *  - snake_case property names (confidence_score, related_entities, max_tokens …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (providers can add fields without breaking us)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
