package com.openforge.memorylane.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Defaults applied when a retrieval request leaves threshold or top-k unset.
 *
 * memorylane:
 *   retrieval:
 *     default-threshold: 0.4
 *     default-top-k: 10
 */
@ConfigurationProperties(prefix = "memorylane.retrieval")
public record RetrievalProperties(
        @DefaultValue("0.4") double defaultThreshold,
        @DefaultValue("10")  int    defaultTopK
) {}
