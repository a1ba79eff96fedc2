package io.hearthwarrio.pagelens.core.extract;

import io.hearthwarrio.pagelens.core.page.InteractionDriver;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Scrolls to the bottom repeatedly until the document stops growing.
 * <p>
 * With {@code stopIfNoNewContent} the loop ends after two consecutive rounds without height growth.
 */
public class ScrollHandler {

    private static final Logger logger = LoggerFactory.getLogger(ScrollHandler.class);

    public static final int DEFAULT_MAX_SCROLLS = 20;
    public static final long DEFAULT_DELAY_MS = 800;
    public static final long MIN_DELAY_MS = 100;
    static final int NO_CHANGE_ROUNDS = 2;

    private final InteractionDriver interactions;

    public ScrollHandler(InteractionDriver interactions) {
        this.interactions = Objects.requireNonNull(interactions, "interactions must not be null");
    }

    /**
     * @throws InterruptedException when interrupted while waiting for content to load
     */
    public ScrollResult autoScroll(PageHandle page, int maxScrolls, long delayMs, boolean stopIfNoNewContent)
            throws InterruptedException {
        int scrolls = Math.max(1, maxScrolls);
        long delay = Math.max(MIN_DELAY_MS, delayMs);
        long previousHeight = interactions.scrollHeight(page);
        int unchanged = 0;

        for (int i = 0; i < scrolls; i++) {
            interactions.scrollToBottom(page);
            pause(delay);

            long currentHeight = interactions.scrollHeight(page);
            if (currentHeight <= previousHeight) {
                unchanged++;
                if (stopIfNoNewContent && unchanged >= NO_CHANGE_ROUNDS) {
                    logger.debug("Auto scroll stopped after {} rounds: no new content", i + 1);
                    return new ScrollResult(i + 1, ScrollResult.NO_NEW_CONTENT, currentHeight);
                }
            } else {
                unchanged = 0;
            }
            previousHeight = Math.max(previousHeight, currentHeight);
        }
        return new ScrollResult(scrolls, ScrollResult.MAX_SCROLLS_REACHED, previousHeight);
    }

    protected void pause(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }
}
