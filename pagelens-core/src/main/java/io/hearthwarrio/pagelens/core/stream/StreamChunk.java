package io.hearthwarrio.pagelens.core.stream;

import java.util.Objects;

/**
 * One bounded slice of streamed page text.
 */
public final class StreamChunk {

    private final int sequence;
    private final String text;
    private final boolean last;

    public StreamChunk(int sequence, String text, boolean last) {
        this.sequence = sequence;
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.last = last;
    }

    /**
     * @return zero-based, strictly increasing position in the stream
     */
    public int getSequence() {
        return sequence;
    }

    public String getText() {
        return text;
    }

    /**
     * @return true for the last chunk of the stream
     */
    public boolean isFinal() {
        return last;
    }

    @Override
    public String toString() {
        return "StreamChunk{" + sequence + ", " + text.length() + " chars" + (last ? ", final" : "") + '}';
    }
}
