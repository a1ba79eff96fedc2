package io.hearthwarrio.pagelens.core;

import java.util.Locale;

/**
 * Identifies the resolution tier that produced a locator.
 */
public enum StrategyTag {
    DIRECT,
    CACHED,
    TEXT,
    SEMANTIC;

    /**
     * @return lower-case name used in configuration and task output
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a configuration value; {@code cache} is accepted as an alias of {@link #CACHED}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static StrategyTag fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("strategy name must not be null");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if ("cache".equals(v)) {
            return CACHED;
        }
        for (StrategyTag tag : values()) {
            if (tag.wireName().equals(v)) {
                return tag;
            }
        }
        throw new IllegalArgumentException("Unknown strategy: " + value);
    }
}
