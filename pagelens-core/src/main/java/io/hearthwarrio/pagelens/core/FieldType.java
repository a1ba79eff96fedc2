package io.hearthwarrio.pagelens.core;

import java.util.Locale;

/**
 * Kind of value a logical target is expected to hold; drives value casting and default selectors.
 */
public enum FieldType {
    TEXT,
    NUMBER,
    BOOLEAN,
    LINK,
    BUTTON,
    TABLE,
    LIST;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return matching type, or {@code null} for blank / unknown values
     */
    public static FieldType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim().toUpperCase(Locale.ROOT);
        for (FieldType t : values()) {
            if (t.name().equals(v)) {
                return t;
            }
        }
        return null;
    }
}
