package com.openforge.memorylane.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memorylane.extraction.ExtractionException.InvalidCandidateException;
import com.openforge.memorylane.extraction.ExtractionException.MalformedResponseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a provider reply into memory candidates.
 *
 * Two failure levels:
 *   whole reply  : no JSON array can be read → {@link MalformedResponseException},
 *                  which the client treats as a provider failure
 *   single item  : missing/invalid required field → item dropped, the rest is kept
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CandidateParser {

    private static final Pattern JSON_BLOCK =
            Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);

    private static final String DEFAULT_CATEGORY = "uncategorized";

    private final ObjectMapper objectMapper;

    public List<MemoryCandidate> parse(String raw, String chunkId) {
        JsonNode array = readArray(raw);

        List<MemoryCandidate> candidates = new ArrayList<>(array.size());
        int index = 0;
        for (JsonNode item : array) {
            try {
                candidates.add(toCandidate(item, chunkId));
            } catch (InvalidCandidateException e) {
                log.debug("[Extract] Dropping item {} of chunk {}: {}", index, chunkId, e.getMessage());
            }
            index++;
        }
        return candidates;
    }

    // ── Top level ────────────────────────────────────────────────────────────

    private JsonNode readArray(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedResponseException("Provider returned an empty reply");
        }

        String text = stripMarkdownJson(raw);
        int start = text.indexOf('[');
        int end   = text.lastIndexOf(']');
        if (start < 0 || end < start) {
            throw new MalformedResponseException("No JSON array found in provider reply");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(text.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException(
                    "Provider reply is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isArray()) {
            throw new MalformedResponseException("Provider reply is not a JSON array");
        }
        return node;
    }

    private static String stripMarkdownJson(String raw) {
        var m = JSON_BLOCK.matcher(raw);
        if (m.find()) return m.group(1).trim();
        return raw.trim();
    }

    // ── Per item ─────────────────────────────────────────────────────────────

    private MemoryCandidate toCandidate(JsonNode item, String chunkId) {
        if (item == null || !item.isObject()) {
            throw new InvalidCandidateException("item is not an object");
        }

        String typeName = text(item, "type");
        MemoryType type = MemoryType.fromWireName(typeName)
                .orElseThrow(() -> new InvalidCandidateException("unknown or missing type: " + typeName));

        String title   = required(item, "title");
        String content = required(item, "content");
        int confidence = confidence(item.get("confidence_score"));

        String category = text(item, "category");
        String excerpt  = text(item, "source_chunk");

        List<String> evidence = new ArrayList<>();
        if (excerpt != null && !excerpt.isBlank()) evidence.add(excerpt);
        JsonNode extraEvidence = item.get("evidence");
        if (extraEvidence != null && extraEvidence.isArray()) {
            extraEvidence.forEach(e -> {
                if (e.isTextual() && !e.asText().isBlank() && !evidence.contains(e.asText())) {
                    evidence.add(e.asText());
                }
            });
        }

        try {
            return MemoryCandidate.builder()
                    .type(type)
                    .category(category == null || category.isBlank() ? DEFAULT_CATEGORY : category)
                    .title(title)
                    .content(content)
                    .sourceChunkRef(chunkId)
                    .relatedEntities(entities(item.get("related_entities")))
                    .rawConfidence(confidence)
                    .reasoning(text(item, "reasoning"))
                    .evidence(evidence)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new InvalidCandidateException(e.getMessage(), e);
        }
    }

    private static String required(JsonNode item, String field) {
        String value = text(item, field);
        if (value == null || value.isBlank()) {
            throw new InvalidCandidateException("missing " + field);
        }
        return value.trim();
    }

    private static String text(JsonNode item, String field) {
        JsonNode node = item.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static int confidence(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new InvalidCandidateException("missing confidence_score");
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvalidCandidateException("confidence_score is not a number: " + node.asText());
            }
        }
        if (Double.isNaN(value) || value < 0 || value > 100) {
            throw new InvalidCandidateException("confidence_score out of range: " + value);
        }
        return (int) Math.round(value);
    }

    /** Accepts plain strings or {type, raw, slug} objects; keeps raw, else slug. */
    private static Set<String> entities(JsonNode node) {
        Set<String> entities = new LinkedHashSet<>();
        if (node == null || !node.isArray()) return entities;
        for (JsonNode e : node) {
            String name = null;
            if (e.isTextual()) {
                name = e.asText();
            } else if (e.isObject()) {
                name = text(e, "raw");
                if (name == null || name.isBlank()) name = text(e, "slug");
            }
            if (name != null && !name.isBlank()) entities.add(name.trim());
        }
        return entities;
    }
}
