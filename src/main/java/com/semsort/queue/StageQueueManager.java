package com.semsort.queue;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies file moves and deletions to every registered stage queue so pending work stays pointed at the
 * right files. Each queue still runs, retries and persists on its own.
 */
public class StageQueueManager {
    private final Map<String, StageQueue<?>> queues = new LinkedHashMap<>();

    public synchronized void register(StageQueue<?> queue) {
        if (queues.putIfAbsent(queue.stage(), queue) != null) {
            throw new IllegalArgumentException("Stage already registered: " + queue.stage());
        }
    }

    public synchronized Optional<StageQueue<?>> get(String stage) {
        return Optional.ofNullable(queues.get(stage));
    }

    public int updateByFilePath(String oldPath, String newPath) {
        int total = 0;
        for (StageQueue<?> queue : snapshot()) {
            total += queue.updateByFilePath(oldPath, newPath);
        }
        return total;
    }

    public int updateByFilePaths(Map<String, String> pathChanges) {
        int total = 0;
        for (StageQueue<?> queue : snapshot()) {
            total += queue.updateByFilePaths(pathChanges);
        }
        return total;
    }

    public int removeByFilePath(String filePath) {
        int total = 0;
        for (StageQueue<?> queue : snapshot()) {
            total += queue.removeByFilePath(filePath);
        }
        return total;
    }

    public int removeByFilePaths(Collection<String> filePaths) {
        int total = 0;
        for (StageQueue<?> queue : snapshot()) {
            total += queue.removeByFilePaths(filePaths);
        }
        return total;
    }

    public Map<String, QueueStats> getStats() {
        Map<String, QueueStats> stats = new LinkedHashMap<>();
        for (StageQueue<?> queue : snapshot()) {
            stats.put(queue.stage(), queue.getStats());
        }
        return stats;
    }

    public int retryDeadLetters() {
        int total = 0;
        for (StageQueue<?> queue : snapshot()) {
            total += queue.retryDeadLetters();
        }
        return total;
    }

    public void initializeAll() {
        snapshot().forEach(StageQueue::initialize);
    }

    public void startAll() {
        snapshot().forEach(StageQueue::start);
    }

    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (StageQueue<?> queue : snapshot()) {
            long remaining = deadline - System.nanoTime();
            if (!queue.awaitIdle(Duration.ofNanos(Math.max(0L, remaining)))) {
                return false;
            }
        }
        return true;
    }

    public void shutdown() {
        snapshot().forEach(StageQueue::shutdown);
    }

    private synchronized Collection<StageQueue<?>> snapshot() {
        return List.copyOf(queues.values());
    }
}
