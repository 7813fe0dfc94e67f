package com.semsort.ingest;

import java.util.Locale;

public class HashingEmbeddingService implements EmbeddingService {
    private final int dimension;

    public HashingEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text, String model) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        String[] tokens = text.toLowerCase(Locale.ROOT).split("\\W+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            if (token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
                }
            }
        }

        float norm = 0f;
        for (float v : vector) {
            norm += v * v;
        }
        norm = (float) Math.sqrt(norm);
        if (norm > 0f) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }
        return vector;
    }

    public int dimension() {
        return dimension;
    }

    private static void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }
}
