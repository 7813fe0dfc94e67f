package com.semsort.ingest;

import java.util.ArrayList;
import java.util.List;

public class TextChunker {
    private final int chunkSize;
    private final int overlap;
    private final int maxChunks;

    public TextChunker(int chunkSize, int overlap, int maxChunks) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be >= 0 and < chunkSize");
        }
        if (maxChunks <= 0) {
            throw new IllegalArgumentException("maxChunks must be > 0");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
        this.maxChunks = maxChunks;
    }

    public List<TextChunk> chunk(String text) {
        List<TextChunk> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }

        int length = text.length();
        int step = chunkSize - overlap;
        int start = 0;
        while (start < length && chunks.size() < maxChunks) {
            int windowStart = alignToCodePoint(text, start);
            int end = Math.min(length, start + chunkSize);
            int windowEnd = end < length ? alignToCodePoint(text, end) : end;

            int trimmedStart = windowStart;
            while (trimmedStart < windowEnd && isBlank(text.charAt(trimmedStart))) {
                trimmedStart++;
            }
            int trimmedEnd = windowEnd;
            while (trimmedEnd > trimmedStart && isBlank(text.charAt(trimmedEnd - 1))) {
                trimmedEnd--;
            }

            if (trimmedEnd > trimmedStart) {
                chunks.add(new TextChunk(chunks.size(), trimmedStart, trimmedEnd, text.substring(trimmedStart, trimmedEnd)));
            }
            if (end >= length) {
                break;
            }
            start += step;
        }
        return chunks;
    }

    // Moves an offset that lands between a surrogate pair back to the pair's start.
    private static int alignToCodePoint(String text, int offset) {
        if (offset > 0 && offset < text.length()
                && Character.isLowSurrogate(text.charAt(offset))
                && Character.isHighSurrogate(text.charAt(offset - 1))) {
            return offset - 1;
        }
        return offset;
    }

    private static boolean isBlank(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF';
    }
}
