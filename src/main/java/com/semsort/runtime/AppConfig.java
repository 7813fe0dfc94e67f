package com.semsort.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private CacheConfig cache = new CacheConfig();
    private QueueConfig queue = new QueueConfig();
    private BatchConfig batch = new BatchConfig();
    private TrackerConfig tracker = new TrackerConfig();
    private IndexConfig index = new IndexConfig();

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache == null ? new CacheConfig() : cache;
    }

    public QueueConfig getQueue() {
        return queue;
    }

    public void setQueue(QueueConfig queue) {
        this.queue = queue == null ? new QueueConfig() : queue;
    }

    public BatchConfig getBatch() {
        return batch;
    }

    public void setBatch(BatchConfig batch) {
        this.batch = batch == null ? new BatchConfig() : batch;
    }

    public TrackerConfig getTracker() {
        return tracker;
    }

    public void setTracker(TrackerConfig tracker) {
        this.tracker = tracker == null ? new TrackerConfig() : tracker;
    }

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String model = "nomic-embed-text";
        private String endpoint = "";
        private String generationModel = "llama3.2";
        private String generationEndpoint = "";
        private int contextTokens = 512;
        private double charsPerToken = 3.5;
        private double headroomRatio = 0.85;
        private int minTokens = 32;
        private int dimensions = 768;
        private int chunkSize = 1000;
        private int chunkOverlap = 200;
        private int maxChunks = 50;
        private int requestTimeoutMs = 30000;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getGenerationModel() {
            return generationModel;
        }

        public void setGenerationModel(String generationModel) {
            this.generationModel = generationModel;
        }

        public String getGenerationEndpoint() {
            return generationEndpoint;
        }

        public void setGenerationEndpoint(String generationEndpoint) {
            this.generationEndpoint = generationEndpoint;
        }

        public int getContextTokens() {
            return contextTokens;
        }

        public void setContextTokens(int contextTokens) {
            this.contextTokens = contextTokens;
        }

        public double getCharsPerToken() {
            return charsPerToken;
        }

        public void setCharsPerToken(double charsPerToken) {
            this.charsPerToken = charsPerToken;
        }

        public double getHeadroomRatio() {
            return headroomRatio;
        }

        public void setHeadroomRatio(double headroomRatio) {
            this.headroomRatio = headroomRatio;
        }

        public int getMinTokens() {
            return minTokens;
        }

        public void setMinTokens(int minTokens) {
            this.minTokens = minTokens;
        }

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }

        public int getMaxChunks() {
            return maxChunks;
        }

        public void setMaxChunks(int maxChunks) {
            this.maxChunks = maxChunks;
        }

        public int getRequestTimeoutMs() {
            return requestTimeoutMs;
        }

        public void setRequestTimeoutMs(int requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CacheConfig {
        private int maxSize = 500;
        private long ttlMs = 600000;
        private long cleanupIntervalMs = 60000;

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public long getTtlMs() {
            return ttlMs;
        }

        public void setTtlMs(long ttlMs) {
            this.ttlMs = ttlMs;
        }

        public long getCleanupIntervalMs() {
            return cleanupIntervalMs;
        }

        public void setCleanupIntervalMs(long cleanupIntervalMs) {
            this.cleanupIntervalMs = cleanupIntervalMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueueConfig {
        private String directory = ".semsort/queues";
        private int concurrency = 2;
        private int maxRetries = 3;
        private long retryBackoffMs = 1000;

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BatchConfig {
        private long lockTimeoutMs = 30000;
        private long pollIntervalMs = 100;
        private long staleLockMs = 300000;

        public long getLockTimeoutMs() {
            return lockTimeoutMs;
        }

        public void setLockTimeoutMs(long lockTimeoutMs) {
            this.lockTimeoutMs = lockTimeoutMs;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getStaleLockMs() {
            return staleLockMs;
        }

        public void setStaleLockMs(long staleLockMs) {
            this.staleLockMs = staleLockMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TrackerConfig {
        private long cooldownMs = 5000;
        private String persistencePath = ".semsort/file-operations.json";
        private boolean caseInsensitive = true;

        public long getCooldownMs() {
            return cooldownMs;
        }

        public void setCooldownMs(long cooldownMs) {
            this.cooldownMs = cooldownMs;
        }

        public String getPersistencePath() {
            return persistencePath;
        }

        public void setPersistencePath(String persistencePath) {
            this.persistencePath = persistencePath;
        }

        public boolean isCaseInsensitive() {
            return caseInsensitive;
        }

        public void setCaseInsensitive(boolean caseInsensitive) {
            this.caseInsensitive = caseInsensitive;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private String path = ".semsort/vector-index.json";
        private String metadataPath = ".semsort/embedding-index-meta.json";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getMetadataPath() {
            return metadataPath;
        }

        public void setMetadataPath(String metadataPath) {
            this.metadataPath = metadataPath;
        }
    }
}
