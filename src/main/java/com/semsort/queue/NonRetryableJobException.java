package com.semsort.queue;

/**
 * A job failure that another attempt cannot fix. The job goes straight to the dead-letter set.
 */
public class NonRetryableJobException extends RuntimeException {
    public NonRetryableJobException(String message) {
        super(message);
    }

    public NonRetryableJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
