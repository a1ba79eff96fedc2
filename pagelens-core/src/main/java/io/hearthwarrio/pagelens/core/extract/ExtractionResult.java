package io.hearthwarrio.pagelens.core.extract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Values of all requested fields for one page, keyed by the caller's field names in request order.
 */
public final class ExtractionResult {

    private final String url;
    private final Map<String, FieldValue> fields;

    public ExtractionResult(String url, Map<String, FieldValue> fields) {
        this.url = Objects.requireNonNull(url, "url must not be null");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String getUrl() {
        return url;
    }

    public Map<String, FieldValue> getFields() {
        return fields;
    }

    /**
     * @return field name to typed value ({@code null} for fields that were not found)
     */
    public Map<String, Object> data() {
        Map<String, Object> data = new LinkedHashMap<>();
        for (Map.Entry<String, FieldValue> e : fields.entrySet()) {
            data.put(e.getKey(), e.getValue().getValue());
        }
        return data;
    }

    public FieldValue field(String name) {
        return fields.get(name);
    }
}
