package io.hearthwarrio.pagelens.core.stream;

import io.hearthwarrio.pagelens.core.page.TextCursor;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Pull-based, finite, non-restartable stream of {@link StreamChunk}s.
 * <p>
 * Text is read from the {@link TextCursor} only when the consumer asks for the next chunk; at most one chunk is read
 * ahead so the last chunk can be flagged as final. Not thread-safe.
 */
public final class ChunkStream implements Iterator<StreamChunk>, AutoCloseable {

    private final TextCursor source;
    private final long charBudget;
    private final double charsPerToken;
    private final int chunkChars;
    private final int maxChunks;

    private long reservedChars;
    private int readChunks;
    private int emittedChunks;
    private long emittedChars;
    private String pending;
    private boolean started;
    private boolean emptyChunkDue;
    private StopReason stopReason;

    ChunkStream(TextCursor source, long charBudget, double charsPerToken, int chunkChars, int maxChunks) {
        this.source = source;
        this.charBudget = charBudget;
        this.charsPerToken = charsPerToken;
        this.chunkChars = chunkChars;
        this.maxChunks = maxChunks;
    }

    @Override
    public boolean hasNext() {
        start();
        return pending != null || emptyChunkDue;
    }

    @Override
    public StreamChunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException("stream is finished");
        }
        if (emptyChunkDue) {
            emptyChunkDue = false;
            emittedChunks++;
            return new StreamChunk(0, "", true);
        }
        String text = pending;
        pending = readAhead();
        StreamChunk chunk = new StreamChunk(emittedChunks, text, pending == null);
        emittedChunks++;
        emittedChars += text.length();
        return chunk;
    }

    /**
     * @return totals so far; the stop reason is set once the last chunk was read
     */
    public StreamSummary summary() {
        return new StreamSummary(emittedChunks, emittedChars, charBudget, charsPerToken, stopReason);
    }

    @Override
    public void close() {
        if (stopReason == null) {
            stopReason = StopReason.CLOSED;
        }
        pending = null;
        emptyChunkDue = false;
        source.close();
    }

    private void start() {
        if (started) {
            return;
        }
        started = true;
        pending = readAhead();
        emptyChunkDue = pending == null;
    }

    private String readAhead() {
        if (stopReason != null) {
            return null;
        }
        if (readChunks == maxChunks) {
            return stop(StopReason.MAX_CHUNKS);
        }
        long remaining = charBudget - reservedChars;
        if (remaining <= 0) {
            return stop(StopReason.BUDGET);
        }
        String text = source.read((int) Math.min(chunkChars, remaining));
        if (text.isEmpty()) {
            stopReason = StopReason.SOURCE_EXHAUSTED;
            return null;
        }
        readChunks++;
        reservedChars += text.length();
        return text;
    }

    /**
     * Distinguishes "limit hit" from "nothing left anyway" by probing one more character.
     */
    private String stop(StopReason limitReason) {
        stopReason = source.read(1).isEmpty() ? StopReason.SOURCE_EXHAUSTED : limitReason;
        return null;
    }
}
