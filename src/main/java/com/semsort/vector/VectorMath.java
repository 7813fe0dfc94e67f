package com.semsort.vector;

import java.util.Arrays;

/**
 * Similarity and validation helpers for embedding vectors.
 *
 * <p>{@link #cosineSimilarity} is permissive and scores mismatched vectors as 0, while
 * {@link #squaredEuclideanDistance} rejects them. Callers rely on the difference.
 */
public final class VectorMath {
    private VectorMath() {
    }

    public static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0d;
        }
        double dot = 0d;
        double aNorm = 0d;
        double bNorm = 0d;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            aNorm += (double) a[i] * a[i];
            bNorm += (double) b[i] * b[i];
        }
        if (aNorm == 0d || bNorm == 0d) {
            return 0d;
        }
        double similarity = dot / (Math.sqrt(aNorm) * Math.sqrt(bNorm));
        return Double.isFinite(similarity) ? similarity : 0d;
    }

    public static double squaredEuclideanDistance(float[] a, float[] b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("vectors must not be null");
        }
        if (a.length != b.length) {
            throw new IllegalArgumentException("dimension mismatch: " + a.length + " != " + b.length);
        }
        double sum = 0d;
        for (int i = 0; i < a.length; i++) {
            double diff = (double) a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }

    /**
     * A {@code null} or non-positive expected dimension means no constraint.
     */
    public static boolean validateEmbeddingDimensions(float[] vector, Integer expectedDim) {
        if (expectedDim == null || expectedDim <= 0) {
            return true;
        }
        return vector != null && vector.length == expectedDim;
    }

    public static VectorValidation validateEmbeddingVector(float[] vector) {
        if (vector == null || vector.length == 0) {
            return VectorValidation.invalid("empty vector");
        }
        for (int i = 0; i < vector.length; i++) {
            if (!Float.isFinite(vector[i])) {
                return VectorValidation.invalid("non-finite value " + vector[i] + " at index " + i);
            }
        }
        return VectorValidation.ok();
    }

    public static float[] padOrTruncateVector(float[] vector, int dim) {
        if (dim < 0) {
            throw new IllegalArgumentException("dim must be >= 0");
        }
        if (vector.length == dim) {
            return vector;
        }
        return Arrays.copyOf(vector, dim);
    }

    public record VectorValidation(boolean valid, String reason) {
        static VectorValidation ok() {
            return new VectorValidation(true, null);
        }

        static VectorValidation invalid(String reason) {
            return new VectorValidation(false, reason);
        }
    }
}
