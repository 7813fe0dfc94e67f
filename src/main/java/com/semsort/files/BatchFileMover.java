package com.semsort.files;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsort.queue.StageQueueManager;
import com.semsort.vector.VectorStore;

/**
 * Moves a batch of files while holding the batch lock.
 *
 * <p>Both ends of every move are recorded in the {@link FileOperationTracker} before the filesystem is
 * touched, so watcher events caused by the move are recognized as our own. If any move fails, the moves
 * already done are undone in reverse order. On success, queued jobs and indexed vectors follow the files
 * to their new paths.
 */
public class BatchFileMover {
    private static final Logger log = LoggerFactory.getLogger(BatchFileMover.class);

    public static final String SOURCE = "organizer";

    private final BatchLockManager lockManager;
    private final FileOperationTracker tracker;
    private final StageQueueManager queues;
    private final VectorStore vectorStore;
    private final long lockTimeoutMs;

    public BatchFileMover(
            BatchLockManager lockManager,
            FileOperationTracker tracker,
            StageQueueManager queues,
            VectorStore vectorStore,
            long lockTimeoutMs) {
        this.lockManager = lockManager;
        this.tracker = tracker;
        this.queues = queues;
        this.vectorStore = vectorStore;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    public BatchMoveResult move(List<MoveRequest> requests) throws BatchLockTimeoutException, InterruptedException {
        String batchId = UUID.randomUUID().toString();
        try {
            return lockManager.withBatchLock(batchId, lockTimeoutMs, () -> execute(batchId, requests));
        } catch (BatchLockTimeoutException | InterruptedException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Batch " + batchId + " failed unexpectedly", e);
        }
    }

    private BatchMoveResult execute(String batchId, List<MoveRequest> requests) {
        List<MoveRequest> completed = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        log.info("batch.move.started batchId={} files={}", batchId, requests.size());

        for (MoveRequest request : requests) {
            try {
                Path source = canonical(request.source());
                Path destination = canonical(request.destination());
                moveOne(source, destination);
                completed.add(new MoveRequest(source, destination));
            } catch (IOException | RuntimeException e) {
                errors.add(request.source() + " -> " + request.destination() + ": " + describe(e));
                log.warn("batch.move.failed batchId={} source={} destination={} reason={}",
                        batchId, request.source(), request.destination(), describe(e));
                break;
            }
        }

        if (!errors.isEmpty()) {
            List<String> rollbackErrors = rollback(batchId, completed);
            errors.addAll(rollbackErrors);
            return new BatchMoveResult(batchId, List.of(), List.copyOf(errors), !completed.isEmpty());
        }

        Map<String, String> pathChanges = new LinkedHashMap<>();
        for (MoveRequest move : completed) {
            pathChanges.put(move.source().toString(), move.destination().toString());
        }
        int requeued = queues.updateByFilePaths(pathChanges);
        int reindexed = 0;
        for (Map.Entry<String, String> change : pathChanges.entrySet()) {
            reindexed += vectorStore.updateSourcePath(change.getKey(), change.getValue());
        }
        log.info("batch.move.completed batchId={} moved={} queuedJobsUpdated={} vectorsUpdated={}",
                batchId, completed.size(), requeued, reindexed);
        return new BatchMoveResult(batchId, List.copyOf(completed), List.of(), false);
    }

    private void moveOne(Path source, Path destination) throws IOException {
        if (!Files.exists(source)) {
            throw new NoSuchFileException(source.toString());
        }
        if (Files.exists(destination)) {
            throw new FileAlreadyExistsException(destination.toString());
        }
        Path parent = destination.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        tracker.recordOperation(source.toString(), "move", SOURCE);
        tracker.recordOperation(destination.toString(), "move", SOURCE);
        try {
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, destination);
        }
    }

    private List<String> rollback(String batchId, List<MoveRequest> completed) {
        List<String> errors = new ArrayList<>();
        for (int i = completed.size() - 1; i >= 0; i--) {
            MoveRequest move = completed.get(i);
            try {
                Path parent = move.source().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                tracker.recordOperation(move.destination().toString(), "rollback", SOURCE);
                tracker.recordOperation(move.source().toString(), "rollback", SOURCE);
                Files.move(move.destination(), move.source());
            } catch (IOException | RuntimeException e) {
                errors.add("rollback " + move.destination() + " -> " + move.source() + ": " + describe(e));
                log.error("batch.rollback.failed batchId={} source={} destination={} reason={}",
                        batchId, move.source(), move.destination(), describe(e));
            }
        }
        log.warn("batch.rollback.completed batchId={} reverted={} failures={}", batchId, completed.size() - errors.size(), errors.size());
        return errors;
    }

    private static Path canonical(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("Move source and destination are required");
        }
        return path.toAbsolutePath().normalize();
    }

    private static String describe(Exception e) {
        return e.getClass().getSimpleName() + (e.getMessage() == null ? "" : " " + e.getMessage());
    }
}
