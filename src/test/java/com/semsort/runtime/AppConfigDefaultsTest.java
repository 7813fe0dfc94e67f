package com.semsort.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.InputStream;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToOfflineEmbeddingWithBoundedQueues() {
        AppConfig config = new AppConfig();

        assertEquals("nomic-embed-text", config.getEmbedding().getModel());
        assertTrue(config.getEmbedding().getEndpoint().isBlank());
        assertEquals(512, config.getEmbedding().getContextTokens());
        assertEquals(500, config.getCache().getMaxSize());
        assertEquals(3, config.getQueue().getMaxRetries());
        assertEquals(30_000L, config.getBatch().getLockTimeoutMs());
        assertEquals(5_000L, config.getTracker().getCooldownMs());
    }

    @Test
    void shouldKeepDefaultsForSectionsMissingFromYaml() throws Exception {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

        AppConfig config = mapper.readValue("""
                embedding:
                  model: mxbai-embed-large
                  dimensions: 1024
                cache: null
                unknownSection:
                  ignored: true
                """, AppConfig.class);

        assertEquals("mxbai-embed-large", config.getEmbedding().getModel());
        assertEquals(1024, config.getEmbedding().getDimensions());
        assertEquals(1000, config.getEmbedding().getChunkSize());
        assertEquals(600_000L, config.getCache().getTtlMs());
        assertEquals(2, config.getQueue().getConcurrency());
    }

    @Test
    void shouldMatchBundledApplicationYaml() throws Exception {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig config;
        try (InputStream in = AppConfigDefaultsTest.class.getResourceAsStream("/application.yml")) {
            config = mapper.readValue(in, AppConfig.class);
        }

        assertEquals(".semsort/queues", config.getQueue().getDirectory());
        assertEquals(".semsort/vector-index.json", config.getIndex().getPath());
        assertEquals(768, config.getEmbedding().getDimensions());
    }
}
