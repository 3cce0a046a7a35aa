package com.openforge.memorylane.extraction;

import java.time.Duration;
import java.util.List;

/**
 * Everything one extraction call needs, passed explicitly instead of living in
 * shared mutable state: the provider handles and their timeouts.
 *
 * @param localAgent null when the CLI path is disabled by configuration
 * @param keyedApi   null when the caller has no API key
 */
public record ExtractionContext(
        LocalAgentProvider localAgent,
        ExtractionProvider keyedApi,
        Duration           cliTimeout,
        Duration           apiTimeout
) {

    public ExtractionContext {
        if (cliTimeout == null || cliTimeout.isNegative() || cliTimeout.isZero()) {
            throw new IllegalArgumentException("cliTimeout must be positive");
        }
        if (apiTimeout == null || apiTimeout.isNegative() || apiTimeout.isZero()) {
            throw new IllegalArgumentException("apiTimeout must be positive");
        }
    }

    /**
     * @throws ExtractionException.ProviderUnavailableException when this context carries
     *         no provider of that kind
     */
    public ExtractionProvider provider(ProviderKind kind) {
        ExtractionProvider provider = switch (kind) {
            case CLI -> localAgent;
            case API -> keyedApi;
        };
        if (provider == null) {
            throw new ExtractionException.ProviderUnavailableException(
                    "No %s provider in this context".formatted(kind.method()));
        }
        return provider;
    }

    public Duration timeout(ProviderKind kind) {
        return switch (kind) {
            case CLI -> cliTimeout;
            case API -> apiTimeout;
        };
    }

    /**
     * Orders the providers to try for one chunk. Pure: the CLI goes first when it is
     * installed and logged in, the keyed API follows when a key was supplied.
     * An empty plan means no provider can be used.
     */
    public static List<ProviderKind> plan(LocalAgentProvider.Status cliStatus, boolean apiKeyPresent) {
        boolean cli = cliStatus != null && cliStatus.usable();
        if (cli && apiKeyPresent) return List.of(ProviderKind.CLI, ProviderKind.API);
        if (cli)                  return List.of(ProviderKind.CLI);
        if (apiKeyPresent)        return List.of(ProviderKind.API);
        return List.of();
    }
}
