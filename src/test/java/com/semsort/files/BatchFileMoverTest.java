package com.semsort.files;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.semsort.persist.AtomicJsonFile;
import com.semsort.queue.FilePayload;
import com.semsort.queue.StageQueue;
import com.semsort.queue.StageQueueManager;
import com.semsort.support.MutableClock;
import com.semsort.vector.LocalJsonVectorIndex;
import com.semsort.vector.VectorStore;

class BatchFileMoverTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock();
    private final FileOperationTracker tracker = new FileOperationTracker(5_000, null, false, clock, new AtomicJsonFile());
    private final BatchLockManager locks = new BatchLockManager(5, 60_000, clock);
    private final LocalJsonVectorIndex index = new LocalJsonVectorIndex();
    private final StageQueueManager queues = new StageQueueManager();

    private BatchFileMover mover() {
        return new BatchFileMover(locks, tracker, queues, index, 100);
    }

    @Test
    void shouldMoveFilesAndRepointQueuedJobsAndVectors() throws Exception {
        Files.createDirectories(tempDir.resolve("inbox"));
        Path source = Files.writeString(tempDir.resolve("inbox/invoice.txt"), "rent");
        Path destination = tempDir.resolve("sorted/finance/invoice.txt");
        List<String> processed = new CopyOnWriteArrayList<>();
        StageQueue<FilePayload> queue = new StageQueue<>(new StageQueue.Settings("embedding", tempDir.resolve("queues"), 1, 0, 0),
                FilePayload.class, job -> processed.add(job.payload().filePath()));
        queues.register(queue);
        queue.enqueue(new FilePayload(source.toString(), "chunk-0"));
        index.put(source + "#0", new float[] { 1f, 0f }, Map.of(VectorStore.SOURCE_PATH, source.toString()));

        BatchMoveResult result = mover().move(List.of(new MoveRequest(source, destination)));

        assertTrue(result.success());
        assertFalse(result.rolledBack());
        assertEquals(1, result.completed().size());
        assertTrue(Files.exists(destination));
        assertFalse(Files.exists(source));
        assertEquals(destination.toString(), index.search(new float[] { 1f, 0f }, 1).get(0).metadata().get(VectorStore.SOURCE_PATH));
        assertTrue(tracker.wasRecentlyOperated(source.toString()));
        assertTrue(tracker.wasRecentlyOperated(destination.toString()));
        assertEquals(BatchLockManager.State.FREE, locks.state());

        queue.start();
        assertTrue(queue.awaitIdle(Duration.ofSeconds(10)));
        assertEquals(List.of(destination.toString()), processed);
        queue.shutdown();
    }

    @Test
    void shouldRollBackCompletedMovesWhenALaterRequestIsInvalid() throws Exception {
        Files.createDirectories(tempDir.resolve("inbox"));
        Path first = Files.writeString(tempDir.resolve("inbox/a.txt"), "a");
        Path second = Files.writeString(tempDir.resolve("inbox/b.txt"), "b");

        BatchMoveResult result = mover().move(List.of(
                new MoveRequest(first, tempDir.resolve("sorted/a.txt")),
                new MoveRequest(second, null)));

        assertFalse(result.success());
        assertTrue(result.rolledBack());
        assertTrue(result.errors().get(0).contains("IllegalArgumentException"));
        assertTrue(Files.exists(first));
        assertTrue(Files.exists(second));
        assertFalse(Files.exists(tempDir.resolve("sorted/a.txt")));
        assertEquals(BatchLockManager.State.FREE, locks.state());
    }

    @Test
    void shouldRollBackCompletedMovesWhenALaterMoveFails() throws Exception {
        Files.createDirectories(tempDir.resolve("inbox"));
        Path first = Files.writeString(tempDir.resolve("inbox/a.txt"), "a");
        Path second = Files.writeString(tempDir.resolve("inbox/b.txt"), "b");
        Path occupied = Files.createDirectories(tempDir.resolve("sorted")).resolve("b.txt");
        Files.writeString(occupied, "already here");

        BatchMoveResult result = mover().move(List.of(
                new MoveRequest(first, tempDir.resolve("sorted/a.txt")),
                new MoveRequest(second, occupied)));

        assertFalse(result.success());
        assertTrue(result.rolledBack());
        assertTrue(result.completed().isEmpty());
        assertEquals(1, result.errors().size());
        assertTrue(Files.exists(first));
        assertTrue(Files.exists(second));
        assertFalse(Files.exists(tempDir.resolve("sorted/a.txt")));
        assertEquals("already here", Files.readString(occupied));
        assertEquals(BatchLockManager.State.FREE, locks.state());
    }

    @Test
    void shouldReportMissingSourceWithoutRollback() throws Exception {
        BatchMoveResult result = mover().move(List.of(
                new MoveRequest(tempDir.resolve("missing.txt"), tempDir.resolve("sorted/missing.txt"))));

        assertFalse(result.success());
        assertFalse(result.rolledBack());
        assertTrue(result.errors().get(0).contains("NoSuchFileException"));
    }

    @Test
    void shouldTimeOutWhileAnotherBatchHoldsTheLock() throws Exception {
        locks.acquire("other-batch", 0);

        assertThrows(BatchLockTimeoutException.class, () -> mover().move(List.of()));
    }
}
