package com.semsort.ingest;

/**
 * One window of a source text. Offsets refer to the original text, after the window was trimmed.
 */
public record TextChunk(int index, int charStart, int charEnd, String text) {
}
