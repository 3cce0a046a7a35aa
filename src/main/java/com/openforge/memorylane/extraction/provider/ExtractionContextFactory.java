package com.openforge.memorylane.extraction.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memorylane.extraction.ExtractionContext;
import com.openforge.memorylane.extraction.ExtractionProperties;
import com.openforge.memorylane.extraction.ExtractionProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Builds the per-run {@link ExtractionContext}.
 *
 * A caller-supplied key wins over the configured one; with neither, the context
 * carries no API provider and the plan can only use the CLI.
 */
@Component
@RequiredArgsConstructor
public class ExtractionContextFactory {

    private final ClaudeCliProvider    cliProvider;
    private final HttpClient           httpClient;
    private final ObjectMapper         objectMapper;
    private final ExtractionProperties properties;

    public ExtractionContext create(String apiKey) {
        String key = apiKey != null && !apiKey.isBlank()
                ? apiKey
                : properties.api().hasApiKey() ? properties.api().apiKey() : null;

        ExtractionProvider api = key == null
                ? null
                : new MessagesApiProvider(httpClient, objectMapper, properties.api(), key);

        return new ExtractionContext(
                properties.cli().enabled() ? cliProvider : null,
                api,
                Duration.ofSeconds(properties.cli().timeoutSeconds()),
                Duration.ofSeconds(properties.api().timeoutSeconds()));
    }
}
