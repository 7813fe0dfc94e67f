package com.semsort.files;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.semsort.persist.AtomicJsonFile;

/**
 * Remembers which component touched which path recently, so a filesystem watcher can tell the pipeline's
 * own moves apart from external changes.
 *
 * <p>A record counts for {@code cooldownMs} after it was written. Records are kept per path and source;
 * they are persisted on {@link #shutdown()} and reloaded by {@link #initialize()}, minus anything that
 * expired in between.
 */
public class FileOperationTracker {
    private static final Logger log = LoggerFactory.getLogger(FileOperationTracker.class);
    private static final int PRUNE_THRESHOLD = 1000;

    private final long cooldownMs;
    private final Path persistencePath;
    private final boolean caseInsensitive;
    private final Clock clock;
    private final AtomicJsonFile jsonFile;
    private final Map<String, Map<String, OperationRecord>> operations = new ConcurrentHashMap<>();

    public FileOperationTracker(long cooldownMs) {
        this(cooldownMs, null, true, Clock.systemUTC(), new AtomicJsonFile());
    }

    public FileOperationTracker(long cooldownMs, Path persistencePath, boolean caseInsensitive, Clock clock, AtomicJsonFile jsonFile) {
        if (cooldownMs <= 0) {
            throw new IllegalArgumentException("cooldownMs must be > 0");
        }
        this.cooldownMs = cooldownMs;
        this.persistencePath = persistencePath;
        this.caseInsensitive = caseInsensitive;
        this.clock = clock;
        this.jsonFile = jsonFile;
    }

    public void recordOperation(String path, String operationType, String source) {
        String key = normalize(path);
        OperationRecord record = new OperationRecord(key, operationType, source, clock.millis());
        operations.compute(key, (unused, bySource) -> {
            Map<String, OperationRecord> records = bySource == null ? new ConcurrentHashMap<>() : bySource;
            records.put(source, record);
            return records;
        });
        if (operations.size() > PRUNE_THRESHOLD) {
            prune();
        }
    }

    public boolean wasRecentlyOperated(String path) {
        return wasRecentlyOperated(path, null);
    }

    /**
     * @param excludeSource records written by this source are ignored, may be {@code null}
     */
    public boolean wasRecentlyOperated(String path, String excludeSource) {
        Map<String, OperationRecord> bySource = operations.get(normalize(path));
        if (bySource == null) {
            return false;
        }
        long now = clock.millis();
        for (OperationRecord record : bySource.values()) {
            if (excludeSource != null && excludeSource.equals(record.source())) {
                continue;
            }
            if (!isExpired(record, now)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drops expired records. A path's entry is removed in the same atomic step that finds it empty, so a
     * concurrent {@link #recordOperation} is never written into a detached map.
     */
    public int prune() {
        long now = clock.millis();
        AtomicInteger removed = new AtomicInteger();
        for (String key : operations.keySet()) {
            operations.computeIfPresent(key, (unused, bySource) -> {
                int before = bySource.size();
                bySource.values().removeIf(record -> isExpired(record, now));
                removed.addAndGet(before - bySource.size());
                return bySource.isEmpty() ? null : bySource;
            });
        }
        return removed.get();
    }

    public int size() {
        return operations.values().stream().mapToInt(Map::size).sum();
    }

    public void clear() {
        operations.clear();
    }

    public void initialize() {
        if (persistencePath == null) {
            return;
        }
        JavaType type = jsonFile.mapper().getTypeFactory().constructType(new TypeReference<List<OperationRecord>>() {
        });
        List<OperationRecord> persisted;
        try {
            persisted = jsonFile.<List<OperationRecord>>read(persistencePath, type).orElse(List.of());
        } catch (IOException e) {
            log.warn("tracker.load.failed path={} reason={}", persistencePath, e.getMessage());
            return;
        }
        long now = clock.millis();
        int restored = 0;
        for (OperationRecord record : persisted) {
            if (record.path() == null || record.source() == null || isExpired(record, now)) {
                continue;
            }
            String key = normalize(record.path());
            OperationRecord loaded = new OperationRecord(key, record.operationType(), record.source(), record.timestamp());
            operations.compute(key, (unused, bySource) -> {
                Map<String, OperationRecord> records = bySource == null ? new ConcurrentHashMap<>() : bySource;
                records.merge(loaded.source(), loaded,
                        (existing, incoming) -> existing.timestamp() >= incoming.timestamp() ? existing : incoming);
                return records;
            });
            restored++;
        }
        log.info("tracker.loaded path={} restored={} discarded={}", persistencePath, restored, persisted.size() - restored);
    }

    public void shutdown() {
        prune();
        if (persistencePath == null) {
            return;
        }
        List<OperationRecord> records = new ArrayList<>();
        operations.values().forEach(bySource -> records.addAll(bySource.values()));
        try {
            jsonFile.write(persistencePath, records);
            log.info("tracker.persisted path={} records={}", persistencePath, records.size());
        } catch (IOException e) {
            log.warn("tracker.persist.failed path={} reason={}", persistencePath, e.getMessage());
        }
    }

    String normalize(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return caseInsensitive ? normalized.toLowerCase(Locale.ROOT) : normalized;
    }

    private boolean isExpired(OperationRecord record, long now) {
        return now - record.timestamp() >= cooldownMs;
    }
}
