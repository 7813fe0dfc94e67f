package com.semsort.cache;

import java.time.Instant;

public record CacheEntry(float[] vector, String model, Instant createdAt) {
}
