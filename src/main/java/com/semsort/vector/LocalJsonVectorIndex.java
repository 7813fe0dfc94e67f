package com.semsort.vector;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.semsort.persist.AtomicJsonFile;

public class LocalJsonVectorIndex implements VectorStore {
    private final Map<String, IndexedVector> vectors = new HashMap<>();
    private final Map<Integer, List<String>> annBuckets = new HashMap<>();

    @Override
    public synchronized void put(String id, float[] vector, Map<String, String> metadata) {
        IndexedVector previous = vectors.put(id, new IndexedVector(id, vector.clone(), Map.copyOf(metadata), signature(vector)));
        if (previous != null) {
            List<String> bucket = annBuckets.get(previous.signature());
            if (bucket != null) {
                bucket.remove(id);
            }
        }
        annBuckets.computeIfAbsent(signature(vector), unused -> new ArrayList<>()).add(id);
    }

    @Override
    public synchronized List<SearchResult> search(float[] queryVector, int k) {
        if (k <= 0 || vectors.isEmpty()) {
            return List.of();
        }
        return candidateIds(queryVector, k).stream()
                .map(vectors::get)
                .filter(item -> item != null)
                .map(indexed -> new SearchResult(indexed.id(),
                        VectorMath.cosineSimilarity(queryVector, indexed.vector()),
                        indexed.metadata()))
                .sorted(Comparator.comparingDouble(SearchResult::score).reversed())
                .limit(k)
                .toList();
    }

    @Override
    public synchronized VectorStoreStats stats() {
        Set<String> sources = new HashSet<>();
        int dimensions = 0;
        for (IndexedVector indexed : vectors.values()) {
            sources.add(indexed.metadata().getOrDefault(SOURCE_PATH, indexed.id()));
            dimensions = indexed.vector().length;
        }
        return new VectorStoreStats(vectors.size(), sources.size(), dimensions);
    }

    @Override
    public synchronized int removeBySourcePath(String sourcePath) {
        List<String> toRemove = vectors.values().stream()
                .filter(indexed -> sourcePath.equals(indexed.metadata().get(SOURCE_PATH)))
                .map(IndexedVector::id)
                .toList();
        toRemove.forEach(vectors::remove);
        if (!toRemove.isEmpty()) {
            rebuildAnnBuckets();
        }
        return toRemove.size();
    }

    @Override
    public synchronized int updateSourcePath(String oldPath, String newPath) {
        int updated = 0;
        for (IndexedVector indexed : List.copyOf(vectors.values())) {
            if (!oldPath.equals(indexed.metadata().get(SOURCE_PATH))) {
                continue;
            }
            Map<String, String> metadata = new HashMap<>(indexed.metadata());
            metadata.put(SOURCE_PATH, newPath);
            vectors.put(indexed.id(), new IndexedVector(indexed.id(), indexed.vector(), Map.copyOf(metadata), indexed.signature()));
            updated++;
        }
        return updated;
    }

    @Override
    public synchronized void clear() {
        vectors.clear();
        annBuckets.clear();
    }

    public synchronized void save(Path path, AtomicJsonFile jsonFile) throws IOException {
        jsonFile.write(path, new ArrayList<>(vectors.values()));
    }

    public static LocalJsonVectorIndex load(Path path, AtomicJsonFile jsonFile) throws IOException {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex();
        JavaType type = jsonFile.mapper().getTypeFactory().constructType(new TypeReference<List<IndexedVector>>() {
        });
        List<IndexedVector> loaded = jsonFile.<List<IndexedVector>>read(path, type).orElse(List.of());
        for (IndexedVector entry : loaded) {
            index.vectors.put(entry.id(), new IndexedVector(entry.id(), entry.vector(),
                    entry.metadata() == null ? Map.of() : Map.copyOf(entry.metadata()), signature(entry.vector())));
        }
        index.rebuildAnnBuckets();
        return index;
    }

    private Set<String> candidateIds(float[] queryVector, int k) {
        if (vectors.size() <= Math.max(150, k * 20)) {
            return new HashSet<>(vectors.keySet());
        }
        Set<String> candidates = new HashSet<>();
        int querySignature = signature(queryVector);
        List<Integer> probes = List.of(querySignature, querySignature ^ 0x00FF, querySignature ^ 0xFF00, querySignature ^ 0x0F0F);
        for (Integer probe : probes) {
            candidates.addAll(annBuckets.getOrDefault(probe, List.of()));
        }
        if (candidates.size() < k * 5) {
            candidates.addAll(vectors.keySet());
        }
        return candidates;
    }

    private void rebuildAnnBuckets() {
        annBuckets.clear();
        for (IndexedVector indexed : vectors.values()) {
            annBuckets.computeIfAbsent(indexed.signature(), unused -> new ArrayList<>()).add(indexed.id());
        }
    }

    private static int signature(float[] vector) {
        int signature = 0;
        for (int i = 0; i < Math.min(16, vector.length); i++) {
            if (vector[i] >= 0f) {
                signature |= (1 << i);
            }
        }
        return signature;
    }

    public record IndexedVector(String id, float[] vector, Map<String, String> metadata, int signature) {
    }
}
