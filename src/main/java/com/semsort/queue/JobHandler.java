package com.semsort.queue;

@FunctionalInterface
public interface JobHandler<P> {
    void handle(QueueJob<P> job) throws Exception;

    /**
     * Called by the queue. Handlers that write results keyed by file path override this and publish through
     * {@code commit}.
     */
    default void handle(QueueJob<P> job, JobCommit<P> commit) throws Exception {
        handle(job);
    }
}
