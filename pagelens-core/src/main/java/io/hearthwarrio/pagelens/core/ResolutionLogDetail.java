package io.hearthwarrio.pagelens.core;

/**
 * Controls how much of a resolution a {@link ResolutionListener} reports.
 */
public enum ResolutionLogDetail {

    /**
     * Logical name and strategy only.
     */
    SUMMARY,

    /**
     * Adds the locator and confidence.
     */
    LOCATOR,

    /**
     * Adds a description of the matched node.
     */
    FULL
}
