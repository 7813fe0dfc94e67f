package com.semsort.ingest;

public interface EmbeddingService {
    /**
     * @throws EmbeddingBackendException when the model runtime cannot produce a vector
     */
    float[] embed(String text, String model);
}
