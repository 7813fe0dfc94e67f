package com.semsort.vector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.semsort.persist.AtomicJsonFile;
import com.semsort.support.MutableClock;

class IndexMetadataStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReportChangeOnlyWhenPreviousMetadataDiffers() throws Exception {
        MutableClock clock = new MutableClock();
        IndexMetadataStore store = new IndexMetadataStore(tempDir.resolve("meta.json"), new AtomicJsonFile(), clock);

        assertFalse(store.reconcile("nomic-embed-text", 768));
        assertFalse(store.reconcile("nomic-embed-text", 768));
        assertTrue(store.reconcile("mxbai-embed-large", 1024));

        IndexMetadata metadata = store.load().orElseThrow();
        assertEquals("mxbai-embed-large", metadata.model());
        assertEquals(1024, metadata.dimensions());
        assertEquals(clock.instant(), metadata.updatedAt());
    }

    @Test
    void shouldTreatDimensionChangeAsStale() throws Exception {
        IndexMetadataStore store = new IndexMetadataStore(tempDir.resolve("meta.json"));

        store.reconcile("model", 384);

        assertTrue(store.reconcile("model", 768));
    }
}
