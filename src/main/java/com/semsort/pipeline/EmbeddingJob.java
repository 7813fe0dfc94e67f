package com.semsort.pipeline;

import com.semsort.queue.FileScopedPayload;

public record EmbeddingJob(
        String filePath,
        int chunkIndex,
        int charStart,
        int charEnd,
        String text,
        String model,
        int estimatedTokens,
        boolean truncated) implements FileScopedPayload<EmbeddingJob> {

    public String vectorId() {
        return filePath + "#" + chunkIndex;
    }

    @Override
    public EmbeddingJob withFilePath(String newPath) {
        return new EmbeddingJob(newPath, chunkIndex, charStart, charEnd, text, model, estimatedTokens, truncated);
    }
}
