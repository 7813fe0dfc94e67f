package com.semsort.pipeline;

import java.util.concurrent.atomic.AtomicLong;

public class PipelineMetrics {
    private final AtomicLong filesSubmitted = new AtomicLong();
    private final AtomicLong chunksProduced = new AtomicLong();
    private final AtomicLong chunksTruncated = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong embeddingsStored = new AtomicLong();
    private final AtomicLong validationFailures = new AtomicLong();
    private final AtomicLong backendFailures = new AtomicLong();
    private final AtomicLong embedLatencyTotalMs = new AtomicLong();
    private final AtomicLong embedLatencyMaxMs = new AtomicLong();
    private final AtomicLong batchMoves = new AtomicLong();
    private final AtomicLong batchMoveFailures = new AtomicLong();

    void fileSubmitted(int chunks, int truncated) {
        filesSubmitted.incrementAndGet();
        chunksProduced.addAndGet(chunks);
        chunksTruncated.addAndGet(truncated);
    }

    void cacheHit() {
        cacheHits.incrementAndGet();
    }

    void cacheMiss() {
        cacheMisses.incrementAndGet();
    }

    void embeddingStored(long latencyMs) {
        embeddingsStored.incrementAndGet();
        embedLatencyTotalMs.addAndGet(latencyMs);
        embedLatencyMaxMs.accumulateAndGet(latencyMs, Math::max);
    }

    void validationFailure() {
        validationFailures.incrementAndGet();
    }

    void backendFailure() {
        backendFailures.incrementAndGet();
    }

    void batchMove(boolean success) {
        if (success) {
            batchMoves.incrementAndGet();
        } else {
            batchMoveFailures.incrementAndGet();
        }
    }

    public MetricsSnapshot snapshot() {
        long stored = embeddingsStored.get();
        return new MetricsSnapshot(
                filesSubmitted.get(),
                chunksProduced.get(),
                chunksTruncated.get(),
                cacheHits.get(),
                cacheMisses.get(),
                stored,
                validationFailures.get(),
                backendFailures.get(),
                stored == 0 ? 0d : (double) embedLatencyTotalMs.get() / stored,
                embedLatencyMaxMs.get(),
                batchMoves.get(),
                batchMoveFailures.get());
    }

    public record MetricsSnapshot(
            long filesSubmitted,
            long chunksProduced,
            long chunksTruncated,
            long cacheHits,
            long cacheMisses,
            long embeddingsStored,
            long validationFailures,
            long backendFailures,
            double averageEmbedLatencyMs,
            long maxEmbedLatencyMs,
            long batchMoves,
            long batchMoveFailures) {
    }
}
