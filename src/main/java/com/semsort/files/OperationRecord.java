package com.semsort.files;

public record OperationRecord(String path, String operationType, String source, long timestamp) {
}
