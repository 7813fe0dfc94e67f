package com.semsort.queue;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JavaType;
import com.semsort.persist.AtomicJsonFile;
import com.semsort.runtime.AppConfig;

/**
 * Durable job queue for one pipeline stage.
 *
 * <p>Pending work (including jobs in flight or waiting out a retry backoff) is written to
 * {@code <stage>-pending.json} after every state change; jobs that used up their retries are parked in
 * {@code <stage>-dead-letter.json} and only come back through {@link #retryDeadLetters()}. At most
 * {@code concurrency} handlers run at once. Persistence failures are logged and the queue keeps running
 * from memory.
 *
 * <p>Moving or removing a file also reaches jobs that are already running: a running job is re-pointed or
 * withdrawn, and a withdrawn job can no longer publish through its {@link JobCommit}.
 */
public class StageQueue<P extends FileScopedPayload<P>> {
    private static final Logger log = LoggerFactory.getLogger(StageQueue.class);

    private final Settings settings;
    private final JobHandler<P> handler;
    private final AtomicJsonFile jsonFile;
    private final Clock clock;
    private final JavaType jobListType;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Deque<QueueJob<P>> pending = new ArrayDeque<>();
    private final Map<String, QueueJob<P>> active = new LinkedHashMap<>();
    private final Map<String, QueueJob<P>> awaitingRetry = new LinkedHashMap<>();
    private final Set<String> withdrawn = new HashSet<>();
    private final List<QueueJob<P>> deadLetters = new ArrayList<>();

    private ExecutorService workers;
    private ScheduledExecutorService retryScheduler;
    private boolean running;
    private long completed;
    private long retried;

    public StageQueue(Settings settings, Class<P> payloadType, JobHandler<P> handler) {
        this(settings, payloadType, handler, new AtomicJsonFile(), Clock.systemUTC());
    }

    public StageQueue(Settings settings, Class<P> payloadType, JobHandler<P> handler, AtomicJsonFile jsonFile, Clock clock) {
        if (settings.concurrency() <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        if (settings.maxRetries() < 0 || settings.retryBackoffMs() < 0) {
            throw new IllegalArgumentException("retry settings must be >= 0");
        }
        this.settings = settings;
        this.handler = handler;
        this.jsonFile = jsonFile;
        this.clock = clock;
        JavaType jobType = jsonFile.mapper().getTypeFactory().constructParametricType(QueueJob.class, payloadType);
        this.jobListType = jsonFile.mapper().getTypeFactory().constructCollectionType(List.class, jobType);
    }

    public String stage() {
        return settings.stage();
    }

    /**
     * Restores persisted jobs. Jobs that were in flight when the process stopped are pending again.
     */
    public void initialize() {
        lock.lock();
        try {
            List<QueueJob<P>> restored = readJobs(settings.pendingFile());
            for (QueueJob<P> job : restored) {
                pending.addLast(job.withStatus(JobStatus.PENDING, clock.instant()));
            }
            deadLetters.addAll(readJobs(settings.deadLetterFile()));
            log.info("queue.loaded stage={} pending={} deadLetters={}", settings.stage(), pending.size(), deadLetters.size());
        } finally {
            lock.unlock();
        }
    }

    public void start() {
        lock.lock();
        try {
            if (running) {
                return;
            }
            AtomicInteger workerCount = new AtomicInteger();
            workers = Executors.newFixedThreadPool(settings.concurrency(), runnable -> {
                Thread thread = new Thread(runnable, "queue-" + settings.stage() + "-" + workerCount.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            retryScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "queue-" + settings.stage() + "-retry");
                thread.setDaemon(true);
                return thread;
            });
            running = true;
            dispatchLocked();
        } finally {
            lock.unlock();
        }
    }

    public String enqueue(P payload) {
        return enqueueAll(List.of(payload)).get(0);
    }

    public List<String> enqueueAll(Collection<P> payloads) {
        List<String> ids = new ArrayList<>(payloads.size());
        lock.lock();
        try {
            for (P payload : payloads) {
                String id = UUID.randomUUID().toString();
                pending.addLast(new QueueJob<>(id, settings.stage(), payload, 0, JobStatus.PENDING,
                        clock.instant(), clock.instant(), null));
                ids.add(id);
            }
            persistPendingLocked();
            dispatchLocked();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("queue.enqueued stage={} count={}", settings.stage(), ids.size());
        return ids;
    }

    public QueueStats getStats() {
        lock.lock();
        try {
            return new QueueStats(settings.stage(),
                    pending.size() + awaitingRetry.size(),
                    active.size(),
                    deadLetters.size(),
                    completed,
                    retried);
        } finally {
            lock.unlock();
        }
    }

    public List<QueueJob<P>> deadLetters() {
        lock.lock();
        try {
            return List.copyOf(deadLetters);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves every dead-lettered job back to the pending queue with a fresh retry budget.
     */
    public int retryDeadLetters() {
        lock.lock();
        try {
            int count = deadLetters.size();
            for (QueueJob<P> job : deadLetters) {
                pending.addLast(job.resetForRetry(clock.instant()));
            }
            deadLetters.clear();
            persistPendingLocked();
            persistDeadLettersLocked();
            dispatchLocked();
            if (count > 0) {
                log.info("queue.dead-letter.requeued stage={} count={}", settings.stage(), count);
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    public int clearDeadLetters() {
        lock.lock();
        try {
            int count = deadLetters.size();
            deadLetters.clear();
            persistDeadLettersLocked();
            return count;
        } finally {
            lock.unlock();
        }
    }

    public int updateByFilePath(String oldPath, String newPath) {
        return updateByFilePaths(Map.of(oldPath, newPath));
    }

    /**
     * Re-points queued and running jobs whose payload refers to a moved file.
     */
    public int updateByFilePaths(Map<String, String> pathChanges) {
        if (pathChanges.isEmpty()) {
            return 0;
        }
        lock.lock();
        try {
            int updated = 0;
            List<QueueJob<P>> rewritten = new ArrayList<>(pending.size());
            for (QueueJob<P> job : pending) {
                String target = pathChanges.get(job.payload().filePath());
                if (target != null) {
                    rewritten.add(job.withPayload(job.payload().withFilePath(target), clock.instant()));
                    updated++;
                } else {
                    rewritten.add(job);
                }
            }
            pending.clear();
            pending.addAll(rewritten);
            updated += repointLocked(awaitingRetry, pathChanges);
            updated += repointLocked(active, pathChanges);
            if (updated > 0) {
                persistPendingLocked();
            }
            return updated;
        } finally {
            lock.unlock();
        }
    }

    public int removeByFilePath(String filePath) {
        return removeByFilePaths(List.of(filePath));
    }

    public int removeByFilePaths(Collection<String> filePaths) {
        Set<String> targets = new HashSet<>(filePaths);
        lock.lock();
        try {
            int removed = 0;
            Iterator<QueueJob<P>> pendingIterator = pending.iterator();
            while (pendingIterator.hasNext()) {
                if (targets.contains(pendingIterator.next().payload().filePath())) {
                    pendingIterator.remove();
                    removed++;
                }
            }
            Iterator<QueueJob<P>> retryIterator = awaitingRetry.values().iterator();
            while (retryIterator.hasNext()) {
                if (targets.contains(retryIterator.next().payload().filePath())) {
                    retryIterator.remove();
                    removed++;
                }
            }
            for (QueueJob<P> job : active.values()) {
                if (targets.contains(job.payload().filePath()) && withdrawn.add(job.id())) {
                    removed++;
                }
            }
            if (removed > 0) {
                persistPendingLocked();
                changed.signalAll();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until nothing is pending, running or waiting for a retry.
     *
     * @return {@code false} if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        lock.lock();
        try {
            while (!pending.isEmpty() || !active.isEmpty() || !awaitingRetry.isEmpty()) {
                if (remainingNanos <= 0L) {
                    return false;
                }
                remainingNanos = changed.awaitNanos(remainingNanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void shutdown() {
        ExecutorService workersToStop;
        ScheduledExecutorService schedulerToStop;
        lock.lock();
        try {
            if (!running) {
                persistPendingLocked();
                return;
            }
            running = false;
            workersToStop = workers;
            schedulerToStop = retryScheduler;
        } finally {
            lock.unlock();
        }

        schedulerToStop.shutdownNow();
        workersToStop.shutdown();
        try {
            if (!workersToStop.awaitTermination(5, TimeUnit.SECONDS)) {
                workersToStop.shutdownNow();
            }
        } catch (InterruptedException e) {
            workersToStop.shutdownNow();
            Thread.currentThread().interrupt();
        }

        lock.lock();
        try {
            for (QueueJob<P> job : awaitingRetry.values()) {
                pending.addLast(job);
            }
            awaitingRetry.clear();
            persistPendingLocked();
            persistDeadLettersLocked();
            changed.signalAll();
            log.info("queue.shutdown stage={} pending={} active={} deadLetters={}",
                    settings.stage(), pending.size(), active.size(), deadLetters.size());
        } finally {
            lock.unlock();
        }
    }

    private void dispatchLocked() {
        while (running && active.size() < settings.concurrency() && !pending.isEmpty()) {
            QueueJob<P> job = pending.pollFirst().withStatus(JobStatus.ACTIVE, clock.instant());
            active.put(job.id(), job);
            workers.execute(() -> run(job));
        }
    }

    private void run(QueueJob<P> job) {
        try {
            handler.handle(job, action -> commit(job.id(), action));
            onSuccess(job);
        } catch (NonRetryableJobException e) {
            moveToDeadLetter(job, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            returnToPending(job);
        } catch (Exception e) {
            onFailure(job, e);
        } catch (Error e) {
            log.error("queue.job.crashed stage={} jobId={}", settings.stage(), job.id(), e);
            moveToDeadLetter(job, e.toString());
        }
    }

    private boolean commit(String jobId, Consumer<P> action) {
        lock.lock();
        try {
            QueueJob<P> current = active.get(jobId);
            if (current == null || withdrawn.contains(jobId)) {
                log.debug("queue.job.discarded stage={} jobId={}", settings.stage(), jobId);
                return false;
            }
            action.accept(current.payload());
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess(QueueJob<P> job) {
        lock.lock();
        try {
            finishLocked(job.id());
            completed++;
            persistPendingLocked();
            dispatchLocked();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void onFailure(QueueJob<P> job, Exception error) {
        String reason = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        lock.lock();
        try {
            QueueJob<P> current = finishLocked(job.id());
            if (current == null) {
                persistPendingLocked();
                dispatchLocked();
                changed.signalAll();
                return;
            }
            QueueJob<P> failed = current.failedAttempt(reason, JobStatus.PENDING, clock.instant());
            if (failed.attempts() > settings.maxRetries()) {
                deadLetterLocked(failed.withStatus(JobStatus.FAILED, clock.instant()));
                return;
            }

            long backoff = settings.retryBackoffMs() * failed.attempts();
            log.warn("queue.job.retry stage={} jobId={} attempt={} maxRetries={} backoffMs={} reason={}",
                    settings.stage(), job.id(), failed.attempts(), settings.maxRetries(), backoff, reason);
            retried++;
            if (!running || backoff == 0L) {
                pending.addLast(failed);
            } else {
                awaitingRetry.put(failed.id(), failed);
                retryScheduler.schedule(() -> releaseRetry(failed.id()), backoff, TimeUnit.MILLISECONDS);
            }
            persistPendingLocked();
            dispatchLocked();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void releaseRetry(String jobId) {
        lock.lock();
        try {
            QueueJob<P> job = awaitingRetry.remove(jobId);
            if (job != null) {
                pending.addLast(job);
                dispatchLocked();
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    private void moveToDeadLetter(QueueJob<P> job, String reason) {
        lock.lock();
        try {
            QueueJob<P> current = finishLocked(job.id());
            if (current == null) {
                persistPendingLocked();
                dispatchLocked();
                changed.signalAll();
                return;
            }
            deadLetterLocked(current.failedAttempt(reason, JobStatus.FAILED, clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    private void deadLetterLocked(QueueJob<P> job) {
        log.warn("queue.job.dead-letter stage={} jobId={} file={} attempts={} reason={}",
                settings.stage(), job.id(), job.payload().filePath(), job.attempts(), job.lastError());
        deadLetters.add(job);
        persistPendingLocked();
        persistDeadLettersLocked();
        dispatchLocked();
        changed.signalAll();
    }

    private void returnToPending(QueueJob<P> job) {
        lock.lock();
        try {
            QueueJob<P> current = finishLocked(job.id());
            if (current != null) {
                pending.addFirst(current.withStatus(JobStatus.PENDING, clock.instant()));
            }
            persistPendingLocked();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Frees the job's worker slot.
     *
     * @return the job as last re-pointed, or {@code null} if it was withdrawn while running
     */
    private QueueJob<P> finishLocked(String jobId) {
        QueueJob<P> current = active.remove(jobId);
        if (withdrawn.remove(jobId)) {
            log.debug("queue.job.withdrawn stage={} jobId={}", settings.stage(), jobId);
            return null;
        }
        return current;
    }

    private int repointLocked(Map<String, QueueJob<P>> jobs, Map<String, String> pathChanges) {
        int updated = 0;
        for (Map.Entry<String, QueueJob<P>> entry : jobs.entrySet()) {
            QueueJob<P> job = entry.getValue();
            String target = pathChanges.get(job.payload().filePath());
            if (target != null) {
                entry.setValue(job.withPayload(job.payload().withFilePath(target), clock.instant()));
                updated++;
            }
        }
        return updated;
    }

    private void persistPendingLocked() {
        List<QueueJob<P>> snapshot = new ArrayList<>(active.size() + pending.size() + awaitingRetry.size());
        for (QueueJob<P> job : active.values()) {
            if (!withdrawn.contains(job.id())) {
                snapshot.add(job);
            }
        }
        snapshot.addAll(pending);
        snapshot.addAll(awaitingRetry.values());
        write(settings.pendingFile(), snapshot);
    }

    private void persistDeadLettersLocked() {
        write(settings.deadLetterFile(), new ArrayList<>(deadLetters));
    }

    private void write(Path path, List<QueueJob<P>> jobs) {
        try {
            jsonFile.write(path, jobs);
        } catch (IOException e) {
            log.warn("queue.persist.failed stage={} path={} reason={}", settings.stage(), path, e.getMessage());
        }
    }

    private List<QueueJob<P>> readJobs(Path path) {
        try {
            return jsonFile.<List<QueueJob<P>>>read(path, jobListType).orElse(List.of());
        } catch (IOException e) {
            log.warn("queue.load.failed stage={} path={} reason={}", settings.stage(), path, e.getMessage());
            return List.of();
        }
    }

    public record Settings(String stage, Path directory, int concurrency, int maxRetries, long retryBackoffMs) {

        public static Settings from(String stage, AppConfig.QueueConfig config) {
            return new Settings(stage, Path.of(config.getDirectory()), config.getConcurrency(),
                    config.getMaxRetries(), config.getRetryBackoffMs());
        }

        public Path pendingFile() {
            return directory.resolve(stage + "-pending.json");
        }

        public Path deadLetterFile() {
            return directory.resolve(stage + "-dead-letter.json");
        }
    }
}
