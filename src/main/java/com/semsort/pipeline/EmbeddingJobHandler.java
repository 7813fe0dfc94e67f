package com.semsort.pipeline;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsort.cache.EmbeddingCache;
import com.semsort.ingest.EmbeddingBackendException;
import com.semsort.ingest.EmbeddingService;
import com.semsort.queue.JobCommit;
import com.semsort.queue.JobHandler;
import com.semsort.queue.QueueJob;
import com.semsort.vector.VectorMath;
import com.semsort.vector.VectorStore;

/**
 * Embeds one chunk, validates the vector and only then writes it to the cache and the vector store.
 */
public class EmbeddingJobHandler implements JobHandler<EmbeddingJob> {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingJobHandler.class);

    private final EmbeddingService embeddingService;
    private final EmbeddingCache cache;
    private final VectorStore vectorStore;
    private final PipelineMetrics metrics;
    private final Integer expectedDimensions;

    public EmbeddingJobHandler(
            EmbeddingService embeddingService,
            EmbeddingCache cache,
            VectorStore vectorStore,
            PipelineMetrics metrics,
            Integer expectedDimensions) {
        this.embeddingService = embeddingService;
        this.cache = cache;
        this.vectorStore = vectorStore;
        this.metrics = metrics;
        this.expectedDimensions = expectedDimensions;
    }

    @Override
    public void handle(QueueJob<EmbeddingJob> job) {
        handle(job, action -> {
            action.accept(job.payload());
            return true;
        });
    }

    /**
     * Stores the vector under the job's current path. Nothing is stored if the file was re-indexed or removed
     * while the embedding was computed.
     */
    @Override
    public void handle(QueueJob<EmbeddingJob> job, JobCommit<EmbeddingJob> commit) {
        EmbeddingJob payload = job.payload();
        long start = System.nanoTime();
        float[] vector;
        try {
            vector = embeddingService.embed(payload.text(), payload.model());
        } catch (EmbeddingBackendException e) {
            metrics.backendFailure();
            throw e;
        }
        long latencyMs = (System.nanoTime() - start) / 1_000_000;

        validate(vector, expectedDimensions, metrics);
        cache.set(payload.text(), payload.model(), vector);
        float[] embedded = vector;
        boolean stored = commit.commit(current -> vectorStore.put(current.vectorId(), embedded, metadata(current)));
        if (!stored) {
            log.debug("embedding.superseded id={}", payload.vectorId());
            return;
        }
        metrics.embeddingStored(latencyMs);
        log.debug("embedding.stored id={} dimensions={} latencyMs={} attempt={}",
                payload.vectorId(), vector.length, latencyMs, job.attempts() + 1);
    }

    static void validate(float[] vector, Integer expectedDimensions, PipelineMetrics metrics) {
        if (!VectorMath.validateEmbeddingDimensions(vector, expectedDimensions)) {
            metrics.validationFailure();
            throw new VectorValidationException("Expected " + expectedDimensions + " dimensions but got "
                    + (vector == null ? 0 : vector.length));
        }
        VectorMath.VectorValidation validation = VectorMath.validateEmbeddingVector(vector);
        if (!validation.valid()) {
            metrics.validationFailure();
            throw new VectorValidationException("Invalid embedding: " + validation.reason());
        }
    }

    static Map<String, String> metadata(EmbeddingJob job) {
        return Map.of(
                VectorStore.SOURCE_PATH, job.filePath(),
                "chunkIndex", Integer.toString(job.chunkIndex()),
                "charStart", Integer.toString(job.charStart()),
                "charEnd", Integer.toString(job.charEnd()),
                "model", job.model(),
                "truncated", Boolean.toString(job.truncated()));
    }
}
