package io.hearthwarrio.pagelens.core.stream;

import io.hearthwarrio.pagelens.core.page.TextCursor;

import java.util.Objects;

/**
 * Emits page text as bounded chunks under a token budget.
 * <p>
 * The cumulative length of all chunks never exceeds {@code floor(maxTokens * charsPerToken)} and the chunks
 * concatenate to a prefix of the source text. The controller never buffers the whole page.
 */
public class StreamingExtractionController {

    public static final int DEFAULT_CHUNK_CHARS = 1800;
    public static final int DEFAULT_MAX_CHUNKS = 12;

    private final int defaultChunkChars;
    private final int maxChunks;

    public StreamingExtractionController() {
        this(DEFAULT_CHUNK_CHARS, DEFAULT_MAX_CHUNKS);
    }

    /**
     * @param defaultChunkChars chunk size used when the caller does not pass one
     * @param maxChunks         hard limit on chunks per stream
     */
    public StreamingExtractionController(int defaultChunkChars, int maxChunks) {
        if (defaultChunkChars <= 0) {
            throw new IllegalArgumentException("defaultChunkChars must be positive: " + defaultChunkChars);
        }
        if (maxChunks <= 0) {
            throw new IllegalArgumentException("maxChunks must be positive: " + maxChunks);
        }
        this.defaultChunkChars = defaultChunkChars;
        this.maxChunks = maxChunks;
    }

    public ChunkStream stream(TextCursor source, int maxTokens, double charsPerToken) {
        return stream(source, maxTokens, charsPerToken, defaultChunkChars);
    }

    /**
     * @param source        text to stream
     * @param maxTokens     token budget, positive
     * @param charsPerToken estimated characters per token, positive
     * @param chunkChars    maximum characters per chunk, positive
     */
    public ChunkStream stream(TextCursor source, int maxTokens, double charsPerToken, int chunkChars) {
        Objects.requireNonNull(source, "source must not be null");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (!(charsPerToken > 0.0) || Double.isInfinite(charsPerToken)) {
            throw new IllegalArgumentException("charsPerToken must be positive: " + charsPerToken);
        }
        if (chunkChars <= 0) {
            throw new IllegalArgumentException("chunkChars must be positive: " + chunkChars);
        }
        long budget = (long) Math.floor(maxTokens * charsPerToken);
        return new ChunkStream(source, budget, charsPerToken, chunkChars, maxChunks);
    }

    public int getDefaultChunkChars() {
        return defaultChunkChars;
    }

    public int getMaxChunks() {
        return maxChunks;
    }
}
