package com.semsort.vector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.semsort.ingest.HashingEmbeddingService;
import com.semsort.persist.AtomicJsonFile;

class LocalJsonVectorIndexTest {

    @TempDir
    Path tempDir;

    private final HashingEmbeddingService embeddings = new HashingEmbeddingService(64);

    @Test
    void shouldRankClosestVectorsFirst() {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex();
        index.put("a#0", embeddings.embed("electricity bill march", "m"), Map.of(VectorStore.SOURCE_PATH, "/docs/a.txt"));
        index.put("b#0", embeddings.embed("mountain hiking photos", "m"), Map.of(VectorStore.SOURCE_PATH, "/docs/b.txt"));

        List<SearchResult> results = index.search(embeddings.embed("electricity bill", "m"), 1);

        assertEquals(1, results.size());
        assertEquals("a#0", results.get(0).id());
    }

    @Test
    void shouldRemoveAndRepointBySourcePath() {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex();
        index.put("a#0", new float[] { 1, 0 }, Map.of(VectorStore.SOURCE_PATH, "/docs/a.txt"));
        index.put("a#1", new float[] { 0, 1 }, Map.of(VectorStore.SOURCE_PATH, "/docs/a.txt"));
        index.put("b#0", new float[] { 1, 1 }, Map.of(VectorStore.SOURCE_PATH, "/docs/b.txt"));

        assertEquals(2, index.updateSourcePath("/docs/a.txt", "/archive/a.txt"));
        assertEquals(new VectorStoreStats(3, 2, 2), index.stats());
        assertEquals("/archive/a.txt", index.search(new float[] { 1, 0 }, 1).get(0).metadata().get(VectorStore.SOURCE_PATH));

        assertEquals(1, index.removeBySourcePath("/docs/b.txt"));
        assertEquals(2, index.stats().vectors());
    }

    @Test
    void shouldPersistAndReload() throws Exception {
        AtomicJsonFile jsonFile = new AtomicJsonFile();
        Path path = tempDir.resolve("index.json");
        LocalJsonVectorIndex index = new LocalJsonVectorIndex();
        index.put("a#0", new float[] { 0.5f, 0.5f }, Map.of(VectorStore.SOURCE_PATH, "/docs/a.txt", "chunkIndex", "0"));
        index.save(path, jsonFile);

        LocalJsonVectorIndex reloaded = LocalJsonVectorIndex.load(path, jsonFile);

        assertEquals(1, reloaded.stats().vectors());
        SearchResult hit = reloaded.search(new float[] { 0.5f, 0.5f }, 5).get(0);
        assertEquals("a#0", hit.id());
        assertEquals("0", hit.metadata().get("chunkIndex"));
    }

    @Test
    void shouldLoadEmptyIndexWhenFileMissing() throws Exception {
        LocalJsonVectorIndex index = LocalJsonVectorIndex.load(tempDir.resolve("missing.json"), new AtomicJsonFile());

        assertTrue(index.search(new float[] { 1 }, 3).isEmpty());
    }
}
