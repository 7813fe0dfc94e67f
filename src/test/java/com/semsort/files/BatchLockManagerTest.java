package com.semsort.files;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.semsort.support.MutableClock;

class BatchLockManagerTest {

    private final MutableClock clock = new MutableClock();

    @Test
    void shouldGrantLockToOneHolderAtATime() throws Exception {
        BatchLockManager locks = new BatchLockManager(10, 60_000, clock);

        assertTrue(locks.acquire("batch-a", 100));
        assertEquals(BatchLockManager.State.HELD, locks.state());
        assertFalse(locks.tryAcquire("batch-b"));
        assertFalse(locks.release("batch-b"));
        assertEquals("batch-a", locks.currentHolder().orElseThrow());

        assertTrue(locks.release("batch-a"));
        assertEquals(BatchLockManager.State.FREE, locks.state());
        assertTrue(locks.tryAcquire("batch-b"));
    }

    @Test
    void shouldLetCurrentHolderReacquire() throws Exception {
        BatchLockManager locks = new BatchLockManager(10, 1_000, clock);
        assertTrue(locks.acquire("batch-a", 0));

        clock.advanceMillis(900);
        assertTrue(locks.acquire("batch-a", 0));
        clock.advanceMillis(900);

        assertFalse(locks.tryAcquire("batch-b"));
    }

    @Test
    void shouldReturnFalseWhenBoundedAcquireTimesOut() throws Exception {
        BatchLockManager locks = new BatchLockManager(5, 60_000, clock);
        locks.acquire("batch-a", 0);

        long start = System.nanoTime();
        assertFalse(locks.acquire("batch-b", 50));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs >= 40, "waited " + elapsedMs + "ms");
        assertEquals("batch-a", locks.currentHolder().orElseThrow());
    }

    @Test
    void shouldWaitUntilReleaseWhenAcquiringUnbounded() throws Exception {
        BatchLockManager locks = new BatchLockManager(5, 60_000, clock);
        locks.acquire("batch-a", 0);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> waiter = executor.submit(() -> {
                locks.acquireUnbounded("batch-b");
                return null;
            });
            Thread.sleep(30);
            assertFalse(waiter.isDone());

            locks.release("batch-a");
            waiter.get();
        } finally {
            executor.shutdownNow();
        }

        assertEquals("batch-b", locks.currentHolder().orElseThrow());
    }

    @Test
    void shouldReclaimStaleLock() throws Exception {
        BatchLockManager locks = new BatchLockManager(10, 1_000, clock);
        locks.acquire("hung-batch", 0);

        clock.advanceMillis(1_000);

        assertTrue(locks.acquire("batch-b", 0));
        assertEquals("batch-b", locks.currentHolder().orElseThrow());
        assertFalse(locks.release("hung-batch"));
    }

    @Test
    void shouldThrowTimeoutFromWithBatchLock() throws Exception {
        BatchLockManager locks = new BatchLockManager(5, 60_000, clock);
        locks.acquire("batch-a", 0);

        BatchLockTimeoutException error = assertThrows(BatchLockTimeoutException.class,
                () -> locks.withBatchLock("batch-b", 20, () -> "never"));

        assertEquals("batch-b", error.holderId());
        assertEquals(20, error.timeoutMs());
    }

    @Test
    void shouldReleaseAfterOperationEvenWhenItFails() {
        BatchLockManager locks = new BatchLockManager(5, 60_000, clock);

        assertThrows(IllegalStateException.class, () -> locks.withBatchLock("batch-a", 10, () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(BatchLockManager.State.FREE, locks.state());
    }

    @Test
    void shouldSerializeConcurrentBatches() throws Exception {
        BatchLockManager locks = new BatchLockManager(1, 60_000, clock);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                String holder = "batch-" + i;
                futures.add(executor.submit(() -> locks.withBatchLock(holder, 5_000, () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    Thread.sleep(10);
                    return inside.decrementAndGet();
                })));
            }
            for (Future<Integer> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxInside.get());
        assertEquals(BatchLockManager.State.FREE, locks.state());
    }

    @Test
    void shouldRequireHolderId() {
        BatchLockManager locks = new BatchLockManager();

        assertThrows(IllegalArgumentException.class, () -> locks.tryAcquire(" "));
    }
}
