package com.semsort.queue;

public enum JobStatus {
    PENDING,
    ACTIVE,
    FAILED
}
