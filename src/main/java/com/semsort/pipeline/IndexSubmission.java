package com.semsort.pipeline;

public record IndexSubmission(String filePath, int chunks, int cacheHits, int enqueued, int truncated) {
}
