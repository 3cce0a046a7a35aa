package com.openforge.memorylane.embedding;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MockEmbeddingGeneratorTest {

    private final MockEmbeddingGenerator generator = new MockEmbeddingGenerator(1024);

    @Test
    @DisplayName("same text gives the same vector across instances")
    void generate_deterministic() {
        FixedVector a = generator.generate("Adopted Kafka for the billing events");
        FixedVector b = new MockEmbeddingGenerator(1024).generate("Adopted Kafka for the billing events");

        assertThat(a).isEqualTo(b);
        assertThat(a.isMock()).isTrue();
    }

    @Test
    @DisplayName("different texts give different vectors")
    void generate_distinct() {
        assertThat(generator.generate("alpha")).isNotEqualTo(generator.generate("beta"));
    }

    @Test
    @DisplayName("vector has the configured dimension and unit length")
    void generate_unitNorm() {
        FixedVector v = generator.generate("wireless");

        double norm = 0;
        for (int i = 0; i < v.dimension(); i++) {
            norm += (double) v.get(i) * v.get(i);
            assertThat(v.get(i)).isBetween(-1f, 1f);
        }
        assertThat(v.dimension()).isEqualTo(1024);
        assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-4));
    }

    @Test
    @DisplayName("FNV-1a 64 matches the reference values")
    void fnv1a64_reference() {
        assertThat(MockEmbeddingGenerator.fnv1a64("")).isEqualTo(0xcbf29ce484222325L);
        assertThat(MockEmbeddingGenerator.fnv1a64("a")).isEqualTo(0xaf63dc4c8601ec8cL);
    }
}
