package com.openforge.memorylane.embedding;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.SplittableRandom;

/**
 * Deterministic placeholder vectors for when no embedding model is reachable.
 *
 * A 64-bit FNV-1a hash of the UTF-8 text seeds a SplittableRandom; components are
 * drawn from [-1, 1] and the vector is L2-normalised. Same text, same vector, on
 * every JVM.
 */
@Component
public class MockEmbeddingGenerator {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME        = 0x100000001b3L;

    private final int dimensions;

    @Autowired
    public MockEmbeddingGenerator(EmbeddingProperties props) {
        this(props.dimensions());
    }

    MockEmbeddingGenerator(int dimensions) {
        if (dimensions < 1) {
            throw new IllegalArgumentException("dimensions must be >= 1");
        }
        this.dimensions = dimensions;
    }

    public FixedVector generate(String text) {
        SplittableRandom random = new SplittableRandom(fnv1a64(text == null ? "" : text));

        float[] values = new float[dimensions];
        double  norm   = 0.0;
        for (int i = 0; i < dimensions; i++) {
            values[i] = (float) (random.nextDouble() * 2.0 - 1.0);
            norm += values[i] * values[i];
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < dimensions; i++) {
                values[i] = (float) (values[i] / norm);
            }
        }
        return FixedVector.mock(values);
    }

    static long fnv1a64(String text) {
        long hash = FNV_OFFSET_BASIS;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
