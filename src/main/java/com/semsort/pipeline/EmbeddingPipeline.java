package com.semsort.pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsort.cache.CacheEntry;
import com.semsort.cache.EmbeddingCache;
import com.semsort.files.BatchFileMover;
import com.semsort.files.BatchLockTimeoutException;
import com.semsort.files.BatchMoveResult;
import com.semsort.files.FileOperationTracker;
import com.semsort.files.MoveRequest;
import com.semsort.ingest.EmbeddingInput;
import com.semsort.ingest.EmbeddingService;
import com.semsort.ingest.TextChunk;
import com.semsort.ingest.TextChunker;
import com.semsort.queue.StageQueue;
import com.semsort.vector.IndexMetadataStore;
import com.semsort.vector.SearchResult;
import com.semsort.vector.VectorStore;

/**
 * Turns file text into stored embeddings.
 *
 * <p>Each file is chunked and every chunk capped to the model's token budget. Chunks whose embedding is
 * already cached go straight to the vector store; the rest become jobs on the {@code embedding} stage queue,
 * where {@link EmbeddingJobHandler} embeds and validates them.
 */
public class EmbeddingPipeline {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingPipeline.class);

    public static final String EMBEDDING_STAGE = "embedding";
    public static final String WATCHER_SOURCE = "watcher";

    private final TextChunker chunker;
    private final EmbeddingInput input;
    private final EmbeddingCache cache;
    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final StageQueue<EmbeddingJob> embeddingQueue;
    private final StageQueue<FolderSuggestionJob> organizeQueue;
    private final FolderSuggestionService folderSuggestions;
    private final FileOperationTracker tracker;
    private final BatchFileMover mover;
    private final PipelineMetrics metrics;
    private final String model;
    private final Integer expectedDimensions;

    public EmbeddingPipeline(
            TextChunker chunker,
            EmbeddingInput input,
            EmbeddingCache cache,
            EmbeddingService embeddingService,
            VectorStore vectorStore,
            StageQueue<EmbeddingJob> embeddingQueue,
            StageQueue<FolderSuggestionJob> organizeQueue,
            FolderSuggestionService folderSuggestions,
            FileOperationTracker tracker,
            BatchFileMover mover,
            PipelineMetrics metrics,
            String model,
            Integer expectedDimensions) {
        this.chunker = chunker;
        this.input = input;
        this.cache = cache;
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
        this.embeddingQueue = embeddingQueue;
        this.organizeQueue = organizeQueue;
        this.folderSuggestions = folderSuggestions;
        this.tracker = tracker;
        this.mover = mover;
        this.metrics = metrics;
        this.model = model;
        this.expectedDimensions = expectedDimensions;
    }

    /**
     * Clears the vector store and cache when the recorded model or dimensionality differs from the active one.
     */
    public boolean reconcileIndex(IndexMetadataStore metadataStore) {
        int dimensions = expectedDimensions == null ? 0 : expectedDimensions;
        try {
            if (metadataStore.reconcile(model, dimensions)) {
                vectorStore.clear();
                cache.clear();
                log.info("index.reset model={} dimensions={}", model, dimensions);
                return true;
            }
        } catch (IOException e) {
            log.warn("index.metadata.failed model={} reason={}", model, e.getMessage());
        }
        return false;
    }

    public IndexSubmission indexText(String filePath, String text) {
        List<TextChunk> chunks = chunker.chunk(text);
        // Withdraws running jobs too, so none of them can store a vector for the old text after this.
        int dropped = embeddingQueue.removeByFilePath(filePath);
        int removed = vectorStore.removeBySourcePath(filePath);
        if (dropped > 0 || removed > 0) {
            log.debug("pipeline.replace path={} droppedJobs={} removedVectors={}", filePath, dropped, removed);
        }

        int hits = 0;
        int truncated = 0;
        List<EmbeddingJob> jobs = new ArrayList<>();
        for (TextChunk chunk : chunks) {
            EmbeddingInput.CappedInput capped = input.cap(chunk.text());
            if (capped.wasTruncated()) {
                truncated++;
            }
            EmbeddingJob job = new EmbeddingJob(filePath, chunk.index(), chunk.charStart(), chunk.charEnd(),
                    capped.text(), model, capped.estimatedTokens(), capped.wasTruncated());
            Optional<CacheEntry> cached = cache.get(capped.text(), model);
            if (cached.isPresent()) {
                metrics.cacheHit();
                vectorStore.put(job.vectorId(), cached.get().vector(), EmbeddingJobHandler.metadata(job));
                hits++;
            } else {
                metrics.cacheMiss();
                jobs.add(job);
            }
        }
        embeddingQueue.enqueueAll(jobs);
        metrics.fileSubmitted(chunks.size(), truncated);
        log.info("pipeline.submitted path={} chunks={} cacheHits={} enqueued={} truncated={}",
                filePath, chunks.size(), hits, jobs.size(), truncated);
        return new IndexSubmission(filePath, chunks.size(), hits, jobs.size(), truncated);
    }

    public void remove(String filePath) {
        int jobs = embeddingQueue.removeByFilePath(filePath);
        if (organizeQueue != null) {
            jobs += organizeQueue.removeByFilePath(filePath);
        }
        int vectors = vectorStore.removeBySourcePath(filePath);
        log.info("pipeline.removed path={} jobs={} vectors={}", filePath, jobs, vectors);
    }

    public List<SearchResult> search(String query, int k) {
        String text = input.cap(query).text();
        float[] vector = cache.get(text, model)
                .map(CacheEntry::vector)
                .orElse(null);
        if (vector == null) {
            vector = embeddingService.embed(text, model);
            EmbeddingJobHandler.validate(vector, expectedDimensions, metrics);
            cache.set(text, model, vector);
        }
        return vectorStore.search(vector, k);
    }

    public boolean shouldReprocess(String filePath) {
        return !tracker.wasRecentlyOperated(filePath, WATCHER_SOURCE);
    }

    public void recordWatcherEvent(String filePath, String operationType) {
        tracker.recordOperation(filePath, operationType, WATCHER_SOURCE);
    }

    public String requestFolderSuggestion(String filePath, String text, List<String> folders) {
        if (organizeQueue == null || folderSuggestions == null) {
            throw new IllegalStateException("Folder suggestions are not configured");
        }
        return organizeQueue.enqueue(folderSuggestions.newJob(filePath, text, folders));
    }

    public BatchMoveResult organize(List<MoveRequest> moves) throws BatchLockTimeoutException, InterruptedException {
        BatchMoveResult result = mover.move(moves);
        metrics.batchMove(result.success());
        return result;
    }

    public PipelineMetrics.MetricsSnapshot metrics() {
        return metrics.snapshot();
    }
}
