package com.semsort.vector;

import java.util.Map;

public record SearchResult(String id, double score, Map<String, String> metadata) {
}
