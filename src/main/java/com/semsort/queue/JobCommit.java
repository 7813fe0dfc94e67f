package com.semsort.queue;

import java.util.function.Consumer;

/**
 * Publishes the result of a running job against the job's current payload.
 *
 * <p>While a job runs, its file may be moved (the payload is re-pointed) or deleted and re-submitted (the job
 * is withdrawn). The action runs under the queue lock, so neither can interleave with it.
 */
@FunctionalInterface
public interface JobCommit<P> {

    /**
     * @return {@code false} if the job was withdrawn and the action did not run
     */
    boolean commit(Consumer<P> action);
}
