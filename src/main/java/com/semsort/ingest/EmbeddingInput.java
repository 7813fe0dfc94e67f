package com.semsort.ingest;

/**
 * Token estimation and context capping for embedding requests.
 *
 * <p>Token counts are estimated from character length; the real tokenizer lives in the model runtime.
 * Limits keep a headroom fraction of the context window free so that estimation error does not push a
 * request over the model's hard input limit.
 */
public class EmbeddingInput {
    public static final double DEFAULT_CHARS_PER_TOKEN = 3.5;
    public static final double DEFAULT_HEADROOM_RATIO = 0.85;
    public static final int DEFAULT_MIN_TOKENS = 32;

    private final int defaultContextTokens;
    private final double charsPerToken;
    private final double headroomRatio;
    private final int minTokens;

    public EmbeddingInput(int defaultContextTokens) {
        this(defaultContextTokens, DEFAULT_CHARS_PER_TOKEN, DEFAULT_HEADROOM_RATIO, DEFAULT_MIN_TOKENS);
    }

    public EmbeddingInput(int defaultContextTokens, double charsPerToken, double headroomRatio, int minTokens) {
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be > 0");
        }
        if (headroomRatio <= 0 || headroomRatio > 1) {
            throw new IllegalArgumentException("headroomRatio must be in (0, 1]");
        }
        this.defaultContextTokens = defaultContextTokens;
        this.charsPerToken = charsPerToken;
        this.headroomRatio = headroomRatio;
        this.minTokens = minTokens;
    }

    public static int estimateTokens(Object input) {
        return estimateTokens(input, DEFAULT_CHARS_PER_TOKEN);
    }

    public static int estimateTokens(Object input, double charsPerToken) {
        if (input == null) {
            return 0;
        }
        String text = String.valueOf(input);
        return (int) Math.ceil(text.length() / charsPerToken);
    }

    public int tokenLimit() {
        return tokenLimit(null);
    }

    public int tokenLimit(Integer explicitLimit) {
        int base = explicitLimit != null && explicitLimit > 0 ? explicitLimit : defaultContextTokens;
        return Math.max(minTokens, (int) Math.floor(base * headroomRatio));
    }

    public static TruncationResult truncateToTokenLimit(String text, int maxTokens, double charsPerToken) {
        int maxChars = (int) Math.floor(maxTokens * charsPerToken);
        if (text == null) {
            return new TruncationResult("", false, maxChars);
        }
        if (text.length() <= maxChars) {
            return new TruncationResult(text, false, maxChars);
        }
        int cut = Math.max(0, maxChars);
        if (cut > 0 && Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        return new TruncationResult(text.substring(0, cut), true, maxChars);
    }

    public CappedInput cap(String text) {
        return cap(text, null, charsPerToken);
    }

    public CappedInput cap(String text, Integer maxTokens, double charsPerToken) {
        String source = text == null ? "" : text;
        int limit = tokenLimit(maxTokens);
        int estimated = estimateTokens(source, charsPerToken);
        TruncationResult truncated = truncateToTokenLimit(source, limit, charsPerToken);
        return new CappedInput(truncated.text(), truncated.wasTruncated(), estimated, limit);
    }

    public double charsPerToken() {
        return charsPerToken;
    }

    public record TruncationResult(String text, boolean wasTruncated, int maxChars) {
    }

    public record CappedInput(String text, boolean wasTruncated, int estimatedTokens, int maxTokens) {
    }
}
