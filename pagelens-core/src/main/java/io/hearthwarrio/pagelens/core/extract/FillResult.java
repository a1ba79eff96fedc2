package io.hearthwarrio.pagelens.core.extract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"filled_fields", "skipped_fields", "submitted"})
public final class FillResult {

    private final List<String> filledFields;
    private final List<String> skippedFields;
    private final boolean submitted;

    FillResult(List<String> filledFields, List<String> skippedFields, boolean submitted) {
        this.filledFields = List.copyOf(filledFields);
        this.skippedFields = List.copyOf(skippedFields);
        this.submitted = submitted;
    }

    @JsonProperty("filled_fields")
    public List<String> getFilledFields() {
        return filledFields;
    }

    /**
     * Keys for which no matching control was found.
     */
    @JsonProperty("skipped_fields")
    public List<String> getSkippedFields() {
        return skippedFields;
    }

    @JsonProperty("submitted")
    public boolean isSubmitted() {
        return submitted;
    }
}
