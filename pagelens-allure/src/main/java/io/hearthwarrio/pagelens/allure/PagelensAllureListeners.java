package io.hearthwarrio.pagelens.allure;

import io.hearthwarrio.pagelens.core.ResolutionListener;
import io.hearthwarrio.pagelens.core.ResolutionLogDetail;

/**
 * Factory methods for Allure-related Pagelens listeners.
 */
public final class PagelensAllureListeners {

    private PagelensAllureListeners() {
        // utility class
    }

    /**
     * Creates a listener that reports locators of every resolution.
     */
    public static ResolutionListener resolutions() {
        return new AllureResolutionListener(ResolutionLogDetail.LOCATOR, false);
    }

    /**
     * Creates a listener with explicit detail, optionally limited to healed resolutions.
     */
    public static ResolutionListener resolutions(ResolutionLogDetail detail, boolean healedOnly) {
        return new AllureResolutionListener(detail, healedOnly);
    }
}
