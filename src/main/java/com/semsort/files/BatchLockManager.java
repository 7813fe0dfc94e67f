package com.semsort.files;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide advisory lock allowing one batch file operation at a time.
 *
 * <p>The lock is either {@link State#FREE} or {@link State#HELD}. Only the holder can release it. A lock
 * held longer than the stale ceiling is reclaimed by the next acquisition attempt, so a hung holder cannot
 * block the pipeline forever. Waiters poll at a fixed interval.
 */
public class BatchLockManager {
    private static final Logger log = LoggerFactory.getLogger(BatchLockManager.class);

    public static final long DEFAULT_POLL_INTERVAL_MS = 100;
    public static final long DEFAULT_STALE_LOCK_MS = Duration.ofMinutes(5).toMillis();

    public enum State {
        FREE,
        HELD
    }

    private final long pollIntervalMs;
    private final long staleLockMs;
    private final Clock clock;

    private String holderId;
    private Instant acquiredAt;

    public BatchLockManager() {
        this(DEFAULT_POLL_INTERVAL_MS, DEFAULT_STALE_LOCK_MS, Clock.systemUTC());
    }

    public BatchLockManager(long pollIntervalMs, long staleLockMs, Clock clock) {
        if (pollIntervalMs <= 0 || staleLockMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs and staleLockMs must be > 0");
        }
        this.pollIntervalMs = pollIntervalMs;
        this.staleLockMs = staleLockMs;
        this.clock = clock;
    }

    /**
     * Bounded acquire.
     *
     * @return {@code true} once the lock is held by {@code holderId}, {@code false} if {@code timeoutMs} elapsed first
     */
    public boolean acquire(String holderId, long timeoutMs) throws InterruptedException {
        requireHolder(holderId);
        long deadline = System.nanoTime() + Duration.ofMillis(Math.max(0L, timeoutMs)).toNanos();
        while (true) {
            if (tryAcquire(holderId)) {
                return true;
            }
            long remainingMs = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
            if (remainingMs <= 0L) {
                log.warn("batch.lock.timeout holder={} timeoutMs={} currentHolder={}", holderId, timeoutMs, currentHolder().orElse("none"));
                return false;
            }
            Thread.sleep(Math.min(pollIntervalMs, remainingMs));
        }
    }

    /**
     * Waits for as long as it takes. Stale reclamation still bounds the wait behind a hung holder.
     */
    public void acquireUnbounded(String holderId) throws InterruptedException {
        requireHolder(holderId);
        while (!tryAcquire(holderId)) {
            Thread.sleep(pollIntervalMs);
        }
    }

    public synchronized boolean tryAcquire(String holderId) {
        requireHolder(holderId);
        reclaimStaleLocked();
        if (this.holderId == null) {
            this.holderId = holderId;
            this.acquiredAt = clock.instant();
            log.debug("batch.lock.acquired holder={}", holderId);
            return true;
        }
        if (this.holderId.equals(holderId)) {
            this.acquiredAt = clock.instant();
            return true;
        }
        return false;
    }

    /**
     * Releases the lock if {@code holderId} holds it; any other caller is ignored.
     *
     * @return whether the lock was released
     */
    public synchronized boolean release(String holderId) {
        if (this.holderId == null || !this.holderId.equals(holderId)) {
            log.debug("batch.lock.release.ignored holder={} currentHolder={}", holderId, this.holderId);
            return false;
        }
        this.holderId = null;
        this.acquiredAt = null;
        log.debug("batch.lock.released holder={}", holderId);
        return true;
    }

    public <T> T withBatchLock(String holderId, long timeoutMs, LockedOperation<T> operation) throws Exception {
        if (!acquire(holderId, timeoutMs)) {
            throw new BatchLockTimeoutException(holderId, timeoutMs, currentHolder().orElse("none"));
        }
        try {
            return operation.run();
        } finally {
            release(holderId);
        }
    }

    public synchronized State state() {
        return holderId == null ? State.FREE : State.HELD;
    }

    public synchronized Optional<String> currentHolder() {
        return Optional.ofNullable(holderId);
    }

    private void reclaimStaleLocked() {
        if (holderId == null) {
            return;
        }
        long heldMs = clock.instant().toEpochMilli() - acquiredAt.toEpochMilli();
        if (heldMs >= staleLockMs) {
            log.warn("batch.lock.reclaimed-stale holder={} heldMs={} staleLockMs={}", holderId, heldMs, staleLockMs);
            holderId = null;
            acquiredAt = null;
        }
    }

    private static void requireHolder(String holderId) {
        if (holderId == null || holderId.isBlank()) {
            throw new IllegalArgumentException("holderId is required");
        }
    }

    @FunctionalInterface
    public interface LockedOperation<T> {
        T run() throws Exception;
    }
}
