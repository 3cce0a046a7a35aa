package com.openforge.memorylane.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads sessions stored as one JSON object per line:
 *
 *   {"type":"input",  "content":"...", "timestamp":"2025-01-01T10:00:00Z"}
 *   {"type":"output", "content":"...", "timestamp":"2025-01-01T10:00:04Z"}
 *
 * "input" lines become user messages, "output" lines assistant messages.
 * Any other entry type is ignored; malformed lines are skipped with a warning.
 */
@Slf4j
@Component
public class JsonlSessionSource implements SessionSource {

    private static final String SUFFIX = ".jsonl";

    private final Path         directory;
    private final ObjectMapper objectMapper;

    public JsonlSessionSource(SessionProperties properties, ObjectMapper objectMapper) {
        this.directory    = Path.of(properties.directory());
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Message> getMessages(String sessionId) {
        Path file = resolve(sessionId);
        if (!Files.isRegularFile(file)) {
            throw new SessionNotFoundException(sessionId);
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read session file " + file, e);
        }

        List<Message> messages = new ArrayList<>();
        int skipped = 0;
        for (String line : lines) {
            if (line.isBlank()) continue;
            try {
                Message message = toMessage(objectMapper.readTree(line));
                if (message != null) messages.add(message);
            } catch (JsonProcessingException e) {
                skipped++;
                log.warn("[Sessions] Skipping malformed line in {}: {}", sessionId, e.getOriginalMessage());
            }
        }

        log.debug("[Sessions] Parsed {} messages from {} (skipped={})", messages.size(), sessionId, skipped);
        return messages;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Path resolve(String sessionId) {
        if (sessionId == null || sessionId.isBlank()
                || sessionId.contains("/") || sessionId.contains("\\") || sessionId.contains("..")) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
        return directory.resolve(sessionId + SUFFIX);
    }

    private Message toMessage(JsonNode entry) {
        String type = entry.path("type").asText("");
        String content = entry.path("content").asText("");
        Instant timestamp = timestamp(entry.get("timestamp"));

        return switch (type) {
            case "input"  -> Message.user(content, timestamp);
            case "output" -> Message.assistant(content, timestamp);
            default       -> null;
        };
    }

    private static Instant timestamp(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) return Instant.ofEpochMilli(node.asLong());
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
