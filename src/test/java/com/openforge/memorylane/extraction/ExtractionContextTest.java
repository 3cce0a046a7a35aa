package com.openforge.memorylane.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractionContextTest {

    private static final LocalAgentProvider.Status READY         = new LocalAgentProvider.Status(true, true, "me@example.com");
    private static final LocalAgentProvider.Status LOGGED_OUT    = new LocalAgentProvider.Status(true, false, "not authenticated");
    private static final LocalAgentProvider.Status NOT_INSTALLED = LocalAgentProvider.Status.unavailable("not installed");

    @Test
    @DisplayName("authenticated CLI goes first, keyed API second")
    void plan_cliThenApi() {
        assertThat(ExtractionContext.plan(READY, true)).containsExactly(ProviderKind.CLI, ProviderKind.API);
    }

    @Test
    @DisplayName("CLI only when no key is present")
    void plan_cliOnly() {
        assertThat(ExtractionContext.plan(READY, false)).containsExactly(ProviderKind.CLI);
    }

    @Test
    @DisplayName("installed but logged-out CLI is skipped")
    void plan_loggedOut() {
        assertThat(ExtractionContext.plan(LOGGED_OUT, true)).containsExactly(ProviderKind.API);
    }

    @Test
    @DisplayName("no CLI and no key gives an empty plan")
    void plan_empty() {
        assertThat(ExtractionContext.plan(NOT_INSTALLED, false)).isEmpty();
        assertThat(ExtractionContext.plan(null, false)).isEmpty();
    }

    @Test
    @DisplayName("asking for a provider the context does not carry is an unavailable provider")
    void provider_missing() {
        ExtractionContext context = new ExtractionContext(null, null, Duration.ofSeconds(1), Duration.ofSeconds(1));

        assertThatThrownBy(() -> context.provider(ProviderKind.API))
                .isInstanceOf(ExtractionException.ProviderUnavailableException.class)
                .hasMessageContaining("api");
    }

    @Test
    @DisplayName("timeouts must be positive")
    void context_rejectsZeroTimeout() {
        assertThatThrownBy(() -> new ExtractionContext(null, null, Duration.ZERO, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
