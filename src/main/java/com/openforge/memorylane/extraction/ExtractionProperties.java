package com.openforge.memorylane.extraction;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised extraction configuration.
 *
 * Reads from application.yml under the "memorylane.extraction" prefix:
 *
 * memorylane:
 *   extraction:
 *     parallel-sessions: 4
 *     duplicate-threshold: 0.9
 *     cli:
 *       enabled: true
 *       command: claude
 *       timeout-seconds: 120
 *       probe-timeout-seconds: 5
 *     api:
 *       base-url: https://api.anthropic.com
 *       api-key: ${ANTHROPIC_API_KEY:}
 *       model: claude-3-5-haiku-latest
 *       max-tokens: 4000
 *       version: 2023-06-01
 *       timeout-seconds: 120
 *
 * A duplicate-threshold above 1.0 disables the near-duplicate merge.
 */
@ConfigurationProperties(prefix = "memorylane.extraction")
public record ExtractionProperties(
        @DefaultValue("4")   int    parallelSessions,
        @DefaultValue("0.9") double duplicateThreshold,
        @DefaultValue        CliConfig cli,
        @DefaultValue        ApiConfig api
) {

    public record CliConfig(
            @DefaultValue("true")   boolean enabled,
            @DefaultValue("claude") String  command,
            @DefaultValue("120")    int     timeoutSeconds,
            @DefaultValue("5")      int     probeTimeoutSeconds
    ) {}

    public record ApiConfig(
            @DefaultValue("https://api.anthropic.com") String baseUrl,
            String apiKey,
            @DefaultValue("claude-3-5-haiku-latest")   String model,
            @DefaultValue("4000")                      int    maxTokens,
            @DefaultValue("2023-06-01")                String version,
            @DefaultValue("120")                       int    timeoutSeconds
    ) {

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
