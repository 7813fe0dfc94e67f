package com.semsort.vector;

import java.time.Instant;

public record IndexMetadata(String model, int dimensions, Instant updatedAt) {
}
