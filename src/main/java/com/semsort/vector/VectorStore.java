package com.semsort.vector;

import java.util.List;
import java.util.Map;

public interface VectorStore {
    String SOURCE_PATH = "path";

    void put(String id, float[] vector, Map<String, String> metadata);

    List<SearchResult> search(float[] queryVector, int k);

    VectorStoreStats stats();

    int removeBySourcePath(String sourcePath);

    int updateSourcePath(String oldPath, String newPath);

    void clear();
}
