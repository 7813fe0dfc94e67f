package com.semsort.ingest;

import java.io.IOException;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Embeddings from a local model server speaking the Ollama {@code /api/embeddings} shape.
 */
public class HttpEmbeddingService implements EmbeddingService {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;

    public HttpEmbeddingService(OkHttpClient httpClient, String endpoint) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
    }

    @Override
    public float[] embed(String text, String model) {
        try {
            String payload = mapper.writeValueAsString(Map.of("model", model, "prompt", text == null ? "" : text));
            Request request = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful() || body == null) {
                    throw new EmbeddingBackendException("Embedding request failed with HTTP " + response.code());
                }
                JsonNode vectorNode = mapper.readTree(body.string()).path("embedding");
                if (!vectorNode.isArray() || vectorNode.isEmpty()) {
                    throw new EmbeddingBackendException("Embedding response has no embedding array");
                }
                float[] out = new float[vectorNode.size()];
                for (int i = 0; i < vectorNode.size(); i++) {
                    out[i] = (float) vectorNode.get(i).asDouble(Double.NaN);
                }
                return out;
            }
        } catch (IOException e) {
            throw new EmbeddingBackendException("Embedding request to " + endpoint + " failed: " + e.getMessage(), e);
        }
    }
}
