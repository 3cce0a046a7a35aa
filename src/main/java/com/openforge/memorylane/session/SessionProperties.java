package com.openforge.memorylane.session;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Where recorded sessions live and how they are windowed.
 *
 * application.yml:
 *
 * memorylane:
 *   sessions:
 *     directory: ${user.home}/.claude/sessions
 *     chunk-size: 15
 */
@ConfigurationProperties(prefix = "memorylane.sessions")
public record SessionProperties(
        @DefaultValue("sessions") String directory,
        @DefaultValue("15") int chunkSize
) {}
