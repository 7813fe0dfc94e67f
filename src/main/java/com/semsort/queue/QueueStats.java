package com.semsort.queue;

public record QueueStats(String stage, int size, int active, int failed, long completed, long retried) {
}
