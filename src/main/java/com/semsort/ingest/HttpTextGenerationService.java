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

public class HttpTextGenerationService implements TextGenerationService {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;

    public HttpTextGenerationService(OkHttpClient httpClient, String endpoint) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
    }

    @Override
    public String generate(String prompt, String model) {
        try {
            String payload = mapper.writeValueAsString(Map.of("model", model, "prompt", prompt, "stream", false));
            Request request = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful() || body == null) {
                    throw new EmbeddingBackendException("Generation request failed with HTTP " + response.code());
                }
                JsonNode textNode = mapper.readTree(body.string()).path("response");
                if (!textNode.isTextual()) {
                    throw new EmbeddingBackendException("Generation response has no response text");
                }
                return textNode.asText();
            }
        } catch (IOException e) {
            throw new EmbeddingBackendException("Generation request to " + endpoint + " failed: " + e.getMessage(), e);
        }
    }
}
