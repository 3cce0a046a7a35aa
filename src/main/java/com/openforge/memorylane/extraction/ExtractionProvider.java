package com.openforge.memorylane.extraction;

import java.time.Duration;

/**
 * A transport able to run one extraction prompt and hand back the raw reply text.
 *
 * Implementations throw {@link ExtractionException.ProviderFailureException} on
 * timeout, transport error or a rejected request.
 */
public interface ExtractionProvider {

    ProviderKind kind();

    String send(String systemPrompt, String userPrompt, Duration timeout);
}
