package com.openforge.memorylane.config;

import com.openforge.memorylane.embedding.EmbeddingService;
import com.openforge.memorylane.embedding.EmbeddingStatus;
import com.openforge.memorylane.extraction.ExtractionProperties;
import com.openforge.memorylane.memory.MemoryStore;
import com.openforge.memorylane.memory.StoreProperties;
import com.openforge.memorylane.memory.milvus.MilvusProperties;
import com.openforge.memorylane.session.SessionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Reported:
 *   - Sessions: transcript directory and chunk size
 *   - Extraction: CLI command, messages API model (API key is masked)
 *   - Embedding: live status from EmbeddingService (runs the first health check)
 *   - Store: backend type and memory count
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final SessionProperties    sessionProperties;
    private final ExtractionProperties extractionProperties;
    private final StoreProperties      storeProperties;
    private final MilvusProperties     milvusProperties;
    private final EmbeddingService     embeddingService;
    private final MemoryStore          memoryStore;
    private final Environment          env;

    @Override
    public void run(ApplicationArguments args) {
        EmbeddingStatus embedding = embeddingService.embeddingStatus();
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");

        String store = "milvus".equalsIgnoreCase(storeProperties.type())
                ? "milvus  %s:%d/%s".formatted(milvusProperties.host(), milvusProperties.port(),
                        milvusProperties.collectionName())
                : "in-memory";

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║            MemoryLane  -  Startup Summary                ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Sessions                                                ║
                ║    Directory      : {}
                ║    Chunk Size     : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Extraction                                              ║
                ║    Local CLI      : {}  [{}]  timeout={}s
                ║    Messages API   : {}  [{}]  key={}
                ║    Dedup          : threshold={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Embedding                                               ║
                ║    Mode           : {}  reachable={}
                ║    Model          : {}  dim={}
                ║    Endpoint       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Store                                                   ║
                ║    Backend        : {}
                ║    Memories       : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,

                sessionProperties.directory(),
                sessionProperties.chunkSize(),

                extractionProperties.cli().enabled() ? "✔ enabled" : "✘ disabled",
                extractionProperties.cli().command(),
                extractionProperties.cli().timeoutSeconds(),
                extractionProperties.api().baseUrl(),
                extractionProperties.api().model(),
                maskKey(extractionProperties.api().apiKey()),
                extractionProperties.duplicateThreshold() > 1.0
                        ? "off" : extractionProperties.duplicateThreshold(),

                embedding.mode().wireName(),
                embedding.reachable() ? "✔" : "✘",
                embedding.model(),
                embedding.dimension(),
                embedding.endpoint(),

                store,
                memoryStore.count()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(per request)" when no key is configured.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(per request)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
