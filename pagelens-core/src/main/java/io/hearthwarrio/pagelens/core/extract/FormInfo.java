package io.hearthwarrio.pagelens.core.extract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A form found on the page and its input controls.
 */
@JsonPropertyOrder({"index", "id", "action", "method", "selector", "fields"})
public final class FormInfo {

    private final int index;
    private final String id;
    private final String action;
    private final String method;
    private final String selector;
    private final List<Field> fields;

    FormInfo(int index, String id, String action, String method, String selector, List<Field> fields) {
        this.index = index;
        this.id = id;
        this.action = action;
        this.method = method;
        this.selector = selector;
        this.fields = List.copyOf(fields);
    }

    @JsonProperty("index")
    public int getIndex() {
        return index;
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("action")
    public String getAction() {
        return action;
    }

    @JsonProperty("method")
    public String getMethod() {
        return method;
    }

    @JsonProperty("selector")
    public String getSelector() {
        return selector;
    }

    @JsonProperty("fields")
    public List<Field> getFields() {
        return fields;
    }

    @JsonPropertyOrder({"name", "type", "id", "placeholder"})
    public static final class Field {
        private final String name;
        private final String type;
        private final String id;
        private final String placeholder;

        Field(String name, String type, String id, String placeholder) {
            this.name = name;
            this.type = type;
            this.id = id;
            this.placeholder = placeholder;
        }

        @JsonProperty("name")
        public String getName() {
            return name;
        }

        /**
         * @return {@code type} attribute, or the tag name for {@code textarea}/{@code select}/untyped inputs
         */
        @JsonProperty("type")
        public String getType() {
            return type;
        }

        @JsonProperty("id")
        public String getId() {
            return id;
        }

        @JsonProperty("placeholder")
        public String getPlaceholder() {
            return placeholder;
        }
    }
}
