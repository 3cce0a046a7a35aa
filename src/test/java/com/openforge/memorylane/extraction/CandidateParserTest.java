package com.openforge.memorylane.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memorylane.extraction.ExtractionException.MalformedResponseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateParserTest {

    private final CandidateParser parser = new CandidateParser(new ObjectMapper());

    @Test
    @DisplayName("fenced JSON array with prose around it is parsed")
    void parse_fencedArray() {
        String reply = """
                Here is what I found:
                ```json
                [{
                  "type": "correction",
                  "category": "db-choice",
                  "title": "Use Postgres not MySQL",
                  "content": "User corrected the database choice to Postgres",
                  "source_chunk": "User: no, use Postgres",
                  "related_entities": [{"type":"project","raw":"Billing Service","slug":"billing-service"}, "postgres"],
                  "confidence_score": 92,
                  "reasoning": "explicit correction"
                }]
                ```
                """;

        List<MemoryCandidate> candidates = parser.parse(reply, "s1#0");

        assertThat(candidates).hasSize(1);
        MemoryCandidate c = candidates.get(0);
        assertThat(c.type()).isEqualTo(MemoryType.CORRECTION);
        assertThat(c.rawConfidence()).isEqualTo(92);
        assertThat(c.sourceChunkRef()).isEqualTo("s1#0");
        assertThat(c.relatedEntities()).containsExactly("Billing Service", "postgres");
        assertThat(c.evidence()).containsExactly("User: no, use Postgres");
    }

    @Test
    @DisplayName("invalid items are dropped one by one, valid ones kept")
    void parse_dropsInvalidItems() {
        String reply = """
                [
                  {"type":"decision","title":"Keep","content":"kept","confidence_score":70},
                  {"type":"nonsense","title":"Bad type","content":"x","confidence_score":70},
                  {"type":"insight","content":"no title","confidence_score":70},
                  {"type":"insight","title":"Out of range","content":"x","confidence_score":140},
                  {"type":"pattern-seed","title":"Dash type","content":"lenient","confidence_score":"55"}
                ]
                """;

        List<MemoryCandidate> candidates = parser.parse(reply, "s1#2");

        assertThat(candidates).extracting(MemoryCandidate::title).containsExactly("Keep", "Dash type");
        assertThat(candidates.get(1).type()).isEqualTo(MemoryType.PATTERN_SEED);
        assertThat(candidates.get(0).category()).isEqualTo("uncategorized");
    }

    @Test
    @DisplayName("empty array means no memories")
    void parse_emptyArray() {
        assertThat(parser.parse("[]", "s1#0")).isEmpty();
    }

    @Test
    @DisplayName("reply without a JSON array is a malformed response")
    void parse_noArray() {
        assertThatThrownBy(() -> parser.parse("I could not find anything memorable.", "s1#0"))
                .isInstanceOf(MalformedResponseException.class);
    }

    @Test
    @DisplayName("broken JSON inside the brackets is a malformed response")
    void parse_brokenJson() {
        assertThatThrownBy(() -> parser.parse("[{\"type\": \"decision\",]", "s1#0"))
                .isInstanceOf(MalformedResponseException.class);
    }
}
