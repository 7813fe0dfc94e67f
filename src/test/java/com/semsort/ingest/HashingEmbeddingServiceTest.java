package com.semsort.ingest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.semsort.vector.VectorMath;

class HashingEmbeddingServiceTest {

    @Test
    void shouldProduceDeterministicNormalizedVectors() {
        HashingEmbeddingService service = new HashingEmbeddingService(64);

        float[] first = service.embed("Quarterly invoice for office rent", "any");
        float[] second = service.embed("Quarterly invoice for office rent", "any");

        assertArrayEquals(first, second);
        assertEquals(64, first.length);
        assertEquals(1.0, VectorMath.cosineSimilarity(first, first), 1e-6);
    }

    @Test
    void shouldScoreRelatedTextHigherThanUnrelatedText() {
        HashingEmbeddingService service = new HashingEmbeddingService(128);

        float[] invoice = service.embed("invoice payment due for rent", "any");
        float[] related = service.embed("rent invoice payment", "any");
        float[] unrelated = service.embed("hiking trail near the lake", "any");

        assertTrue(VectorMath.cosineSimilarity(invoice, related) > VectorMath.cosineSimilarity(invoice, unrelated));
    }

    @Test
    void shouldRejectNonPositiveDimension() {
        assertThrows(IllegalArgumentException.class, () -> new HashingEmbeddingService(0));
    }
}
