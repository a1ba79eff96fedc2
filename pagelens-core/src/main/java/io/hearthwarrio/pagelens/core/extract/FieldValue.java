package io.hearthwarrio.pagelens.core.extract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.hearthwarrio.pagelens.core.FieldType;

import java.util.List;
import java.util.Objects;

/**
 * Extracted value of one requested field plus how it was found.
 * <p>
 * {@link #getStrategy()} is a strategy wire name ({@code direct}, {@code cached}, {@code text}, {@code semantic}),
 * {@code table}/{@code list} for collection fields, or {@value #NOT_FOUND}.
 */
@JsonPropertyOrder({"logical_name", "type", "strategy", "selector", "confidence", "healed", "item_count", "attempted"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FieldValue {

    public static final String NOT_FOUND = "not_found";

    private final String logicalName;
    private final FieldType type;
    private final Object value;
    private final String strategy;
    private final String selector;
    private final Double confidence;
    private final Boolean healed;
    private final Integer itemCount;
    private final List<String> attempted;

    private FieldValue(
            String logicalName,
            FieldType type,
            Object value,
            String strategy,
            String selector,
            Double confidence,
            Boolean healed,
            Integer itemCount,
            List<String> attempted
    ) {
        this.logicalName = Objects.requireNonNull(logicalName, "logicalName must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.value = value;
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.selector = selector;
        this.confidence = confidence;
        this.healed = healed;
        this.itemCount = itemCount;
        this.attempted = attempted == null ? null : List.copyOf(attempted);
    }

    public static FieldValue resolved(String logicalName, FieldType type, Object value, String strategy, String selector,
                                      double confidence, boolean healed) {
        return new FieldValue(logicalName, type, value, strategy, selector, confidence, healed, null, null);
    }

    public static FieldValue collection(String logicalName, FieldType type, Object value, String strategy, String selector,
                                        int itemCount) {
        return new FieldValue(logicalName, type, value, strategy, selector, null, null, itemCount, null);
    }

    public static FieldValue notFound(String logicalName, FieldType type, List<String> attempted) {
        return new FieldValue(logicalName, type, null, NOT_FOUND, null, null, null, null, attempted);
    }

    @JsonProperty("logical_name")
    public String getLogicalName() {
        return logicalName;
    }

    @JsonProperty("type")
    public String getTypeName() {
        return type.wireName();
    }

    public FieldType getType() {
        return type;
    }

    /**
     * Typed value; reported under {@code data}, not in the field metadata.
     */
    @JsonIgnore
    public Object getValue() {
        return value;
    }

    @JsonProperty("strategy")
    public String getStrategy() {
        return strategy;
    }

    @JsonProperty("selector")
    public String getSelector() {
        return selector;
    }

    @JsonProperty("confidence")
    public Double getConfidence() {
        return confidence;
    }

    @JsonProperty("healed")
    public Boolean getHealed() {
        return healed;
    }

    @JsonProperty("item_count")
    public Integer getItemCount() {
        return itemCount;
    }

    @JsonProperty("attempted")
    public List<String> getAttempted() {
        return attempted;
    }

    public boolean isFound() {
        return !NOT_FOUND.equals(strategy);
    }

    @Override
    public String toString() {
        return "FieldValue{" +
                "name='" + logicalName + '\'' +
                ", strategy=" + strategy +
                ", value=" + value +
                '}';
    }
}
