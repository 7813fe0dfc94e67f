package com.semsort.queue;

import java.time.Instant;

public record QueueJob<P>(
        String id,
        String stage,
        P payload,
        int attempts,
        JobStatus status,
        Instant enqueuedAt,
        Instant updatedAt,
        String lastError) {

    QueueJob<P> withStatus(JobStatus newStatus, Instant now) {
        return new QueueJob<>(id, stage, payload, attempts, newStatus, enqueuedAt, now, lastError);
    }

    QueueJob<P> failedAttempt(String error, JobStatus newStatus, Instant now) {
        return new QueueJob<>(id, stage, payload, attempts + 1, newStatus, enqueuedAt, now, error);
    }

    QueueJob<P> withPayload(P newPayload, Instant now) {
        return new QueueJob<>(id, stage, newPayload, attempts, status, enqueuedAt, now, lastError);
    }

    QueueJob<P> resetForRetry(Instant now) {
        return new QueueJob<>(id, stage, payload, 0, JobStatus.PENDING, enqueuedAt, now, lastError);
    }
}
