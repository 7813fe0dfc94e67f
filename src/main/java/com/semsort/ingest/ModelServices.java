package com.semsort.ingest;

import java.time.Duration;

import com.semsort.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class ModelServices {
    private ModelServices() {
    }

    public static OkHttpClient httpClient(AppConfig.EmbeddingConfig config) {
        Duration timeout = Duration.ofMillis(config.getRequestTimeoutMs());
        return new OkHttpClient.Builder()
                .callTimeout(timeout)
                .readTimeout(timeout)
                .build();
    }

    public static EmbeddingService embeddings(OkHttpClient httpClient, AppConfig.EmbeddingConfig config) {
        String endpoint = config.getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            int dimension = config.getDimensions() > 0 ? config.getDimensions() : 384;
            return new HashingEmbeddingService(dimension);
        }
        return new HttpEmbeddingService(httpClient, endpoint);
    }

    public static TextGenerationService generation(OkHttpClient httpClient, AppConfig.EmbeddingConfig config) {
        String endpoint = config.getGenerationEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            return (prompt, model) -> {
                throw new EmbeddingBackendException("No generation endpoint configured");
            };
        }
        return new HttpTextGenerationService(httpClient, endpoint);
    }
}
