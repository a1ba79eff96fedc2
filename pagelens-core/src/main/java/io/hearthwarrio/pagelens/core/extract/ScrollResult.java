package io.hearthwarrio.pagelens.core.extract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"scroll_count", "stopped_reason", "final_height"})
public final class ScrollResult {

    public static final String NO_NEW_CONTENT = "no_new_content";
    public static final String MAX_SCROLLS_REACHED = "max_scrolls_reached";

    private final int scrollCount;
    private final String stoppedReason;
    private final long finalHeight;

    ScrollResult(int scrollCount, String stoppedReason, long finalHeight) {
        this.scrollCount = scrollCount;
        this.stoppedReason = stoppedReason;
        this.finalHeight = finalHeight;
    }

    @JsonProperty("scroll_count")
    public int getScrollCount() {
        return scrollCount;
    }

    @JsonProperty("stopped_reason")
    public String getStoppedReason() {
        return stoppedReason;
    }

    @JsonProperty("final_height")
    public long getFinalHeight() {
        return finalHeight;
    }
}
