package io.hearthwarrio.pagelens.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ExtractionSettings {

    @JsonProperty("max_table_rows")
    private int maxTableRows = 1000;
    @JsonProperty("max_text_length")
    private int maxTextLength = 12000;
    @JsonProperty("stream_chunk_chars")
    private int streamChunkChars = 1800;
    @JsonProperty("max_stream_chunks")
    private int maxStreamChunks = 12;
    @JsonProperty("chars_per_token")
    private double charsPerToken = 4.0;
    @JsonProperty("max_snapshot_nodes")
    private int maxSnapshotNodes = 5000;

    void validate() {
        maxTableRows = Math.max(10, maxTableRows);
        maxTextLength = Math.max(500, maxTextLength);
        streamChunkChars = Math.max(200, streamChunkChars);
        maxStreamChunks = Math.max(1, maxStreamChunks);
        charsPerToken = charsPerToken > 0.0 ? charsPerToken : 4.0;
        maxSnapshotNodes = Math.max(100, maxSnapshotNodes);
    }

    public int getMaxTableRows() {
        return maxTableRows;
    }

    public int getMaxTextLength() {
        return maxTextLength;
    }

    public int getStreamChunkChars() {
        return streamChunkChars;
    }

    public int getMaxStreamChunks() {
        return maxStreamChunks;
    }

    public double getCharsPerToken() {
        return charsPerToken;
    }

    public int getMaxSnapshotNodes() {
        return maxSnapshotNodes;
    }
}
