package com.openforge.memorylane.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * memorylane:
 *   store:
 *     type: memory   # or milvus
 */
@ConfigurationProperties(prefix = "memorylane.store")
public record StoreProperties(
        @DefaultValue("memory") String type
) {}
