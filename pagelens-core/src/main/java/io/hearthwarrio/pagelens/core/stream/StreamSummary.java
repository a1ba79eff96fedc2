package io.hearthwarrio.pagelens.core.stream;

/**
 * Totals of a finished (or closed) chunk stream.
 */
public final class StreamSummary {

    private final int chunks;
    private final long emittedChars;
    private final long charBudget;
    private final double charsPerToken;
    private final StopReason stopReason;

    public StreamSummary(int chunks, long emittedChars, long charBudget, double charsPerToken, StopReason stopReason) {
        this.chunks = chunks;
        this.emittedChars = emittedChars;
        this.charBudget = charBudget;
        this.charsPerToken = charsPerToken;
        this.stopReason = stopReason;
    }

    public int getChunks() {
        return chunks;
    }

    public long getEmittedChars() {
        return emittedChars;
    }

    public long getCharBudget() {
        return charBudget;
    }

    /**
     * @return {@code ceil(emitted / chars_per_token)}
     */
    public long getEstimatedTokens() {
        return (long) Math.ceil(emittedChars / charsPerToken);
    }

    /**
     * @return true when text was left unread because of a limit
     */
    public boolean isTruncated() {
        return stopReason == StopReason.BUDGET || stopReason == StopReason.MAX_CHUNKS;
    }

    /**
     * @return stop reason, {@code null} while the stream is still open
     */
    public StopReason getStopReason() {
        return stopReason;
    }

    @Override
    public String toString() {
        return "StreamSummary{" +
                "chunks=" + chunks +
                ", emittedChars=" + emittedChars +
                ", charBudget=" + charBudget +
                ", stopReason=" + stopReason +
                '}';
    }
}
