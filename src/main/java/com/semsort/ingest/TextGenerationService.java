package com.semsort.ingest;

public interface TextGenerationService {
    /**
     * @throws EmbeddingBackendException when the model runtime cannot produce a completion
     */
    String generate(String prompt, String model);
}
