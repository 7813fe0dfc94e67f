package com.semsort.vector;

public record VectorStoreStats(int vectors, int sources, int dimensions) {
}
