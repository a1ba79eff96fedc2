package io.hearthwarrio.pagelens.core.page;

/**
 * Applies anti-detection tweaks to pages and paces interactions.
 */
public interface StealthProvider {

    /**
     * Called once for each newly opened page.
     */
    void apply(PageHandle page);

    /**
     * Sleeps for a randomized, human-like interval.
     *
     * @throws InterruptedException when the calling task is cancelled
     */
    void humanDelay() throws InterruptedException;

    static StealthProvider none() {
        return new StealthProvider() {
            @Override
            public void apply(PageHandle page) {
            }

            @Override
            public void humanDelay() {
            }
        };
    }
}
