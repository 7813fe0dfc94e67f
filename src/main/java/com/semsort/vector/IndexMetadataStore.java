package com.semsort.vector;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsort.persist.AtomicJsonFile;

/**
 * Remembers which model and dimensionality produced the vectors in the index.
 */
public class IndexMetadataStore {
    private static final Logger log = LoggerFactory.getLogger(IndexMetadataStore.class);

    private final Path path;
    private final AtomicJsonFile jsonFile;
    private final Clock clock;

    public IndexMetadataStore(Path path) {
        this(path, new AtomicJsonFile(), Clock.systemUTC());
    }

    public IndexMetadataStore(Path path, AtomicJsonFile jsonFile, Clock clock) {
        this.path = path;
        this.jsonFile = jsonFile;
        this.clock = clock;
    }

    public Optional<IndexMetadata> load() throws IOException {
        return jsonFile.read(path, IndexMetadata.class);
    }

    /**
     * Records the active model and dimensions.
     *
     * @return {@code true} when they differ from what was recorded before, meaning existing vectors are stale
     */
    public boolean reconcile(String model, int dimensions) throws IOException {
        Optional<IndexMetadata> current = load();
        if (current.isPresent()
                && current.get().model().equals(model)
                && current.get().dimensions() == dimensions) {
            return false;
        }
        jsonFile.write(path, new IndexMetadata(model, dimensions, clock.instant()));
        if (current.isPresent()) {
            log.info("index.metadata.changed previousModel={} previousDimensions={} model={} dimensions={}",
                    current.get().model(), current.get().dimensions(), model, dimensions);
            return true;
        }
        log.info("index.metadata.created model={} dimensions={}", model, dimensions);
        return false;
    }
}
