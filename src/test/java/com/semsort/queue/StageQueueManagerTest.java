package com.semsort.queue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StageQueueManagerTest {

    @TempDir
    Path tempDir;

    private StageQueue<FilePayload> queue(String stage, JobHandler<FilePayload> handler) {
        return new StageQueue<>(new StageQueue.Settings(stage, tempDir, 1, 0, 0), FilePayload.class, handler);
    }

    @Test
    void shouldApplyPathChangesAcrossEveryStage() throws Exception {
        List<String> seen = new CopyOnWriteArrayList<>();
        StageQueue<FilePayload> embedding = queue("embedding", job -> seen.add("embedding:" + job.payload().filePath()));
        StageQueue<FilePayload> organize = queue("organize", job -> seen.add("organize:" + job.payload().filePath()));
        StageQueueManager manager = new StageQueueManager();
        manager.register(embedding);
        manager.register(organize);
        manager.initializeAll();

        embedding.enqueue(new FilePayload("/in/a.txt", "e"));
        organize.enqueue(new FilePayload("/in/a.txt", "o"));
        organize.enqueue(new FilePayload("/in/b.txt", "o"));

        assertEquals(2, manager.updateByFilePaths(Map.of("/in/a.txt", "/out/a.txt")));
        assertEquals(1, manager.removeByFilePath("/in/b.txt"));

        manager.startAll();
        assertTrue(manager.awaitIdle(Duration.ofSeconds(10)));
        assertEquals(2, seen.size());
        assertTrue(seen.contains("embedding:/out/a.txt"));
        assertTrue(seen.contains("organize:/out/a.txt"));
        assertEquals(List.of("embedding", "organize"), List.copyOf(manager.getStats().keySet()));
        manager.shutdown();
    }

    @Test
    void shouldRetryDeadLettersInEveryStage() throws Exception {
        StageQueue<FilePayload> failing = queue("embedding", job -> {
            throw new NonRetryableJobException("bad");
        });
        StageQueueManager manager = new StageQueueManager();
        manager.register(failing);
        manager.initializeAll();
        manager.startAll();
        failing.enqueue(new FilePayload("/in/a.txt", "e"));
        assertTrue(manager.awaitIdle(Duration.ofSeconds(10)));

        assertEquals(1, manager.retryDeadLetters());
        assertTrue(manager.awaitIdle(Duration.ofSeconds(10)));
        assertEquals(1, manager.getStats().get("embedding").failed());
        manager.shutdown();
    }

    @Test
    void shouldRejectDuplicateStages() {
        StageQueueManager manager = new StageQueueManager();
        manager.register(queue("embedding", job -> {
        }));

        assertThrows(IllegalArgumentException.class, () -> manager.register(queue("embedding", job -> {
        })));
        assertTrue(manager.get("embedding").isPresent());
        assertTrue(manager.get("missing").isEmpty());
    }
}
