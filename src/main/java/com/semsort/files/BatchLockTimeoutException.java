package com.semsort.files;

public class BatchLockTimeoutException extends Exception {
    private final String holderId;
    private final long timeoutMs;

    public BatchLockTimeoutException(String holderId, long timeoutMs, String currentHolder) {
        super("Batch lock not acquired by " + holderId + " within " + timeoutMs + " ms; held by " + currentHolder);
        this.holderId = holderId;
        this.timeoutMs = timeoutMs;
    }

    public String holderId() {
        return holderId;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
