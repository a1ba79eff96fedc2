package io.hearthwarrio.pagelens.core.extract;

import io.hearthwarrio.pagelens.core.page.InteractionDriver;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ScrollHandlerTest {

    private final InteractionDriver interactions = Mockito.mock(InteractionDriver.class);
    private final PageHandle page = () -> "page-1";
    private final List<Long> pauses = new ArrayList<>();

    private final ScrollHandler handler = new ScrollHandler(interactions) {
        @Override
        protected void pause(long millis) {
            pauses.add(millis);
        }
    };

    @Test
    void stopsAfterTwoRoundsWithoutGrowth() throws Exception {
        when(interactions.scrollHeight(page)).thenReturn(1000L, 2000L, 3000L, 3000L, 3000L);

        ScrollResult result = handler.autoScroll(page, 20, 500, true);

        assertEquals(4, result.getScrollCount());
        assertEquals(ScrollResult.NO_NEW_CONTENT, result.getStoppedReason());
        assertEquals(3000L, result.getFinalHeight());
        verify(interactions, times(4)).scrollToBottom(page);
    }

    @Test
    void growingPageRunsUntilLimit() throws Exception {
        AtomicLong height = new AtomicLong();
        when(interactions.scrollHeight(page)).thenAnswer(inv -> height.addAndGet(500));

        ScrollResult result = handler.autoScroll(page, 3, 500, true);

        assertEquals(3, result.getScrollCount());
        assertEquals(ScrollResult.MAX_SCROLLS_REACHED, result.getStoppedReason());
        assertEquals(2000L, result.getFinalHeight());
    }

    @Test
    void keepsScrollingWhenAskedToIgnoreStalls() throws Exception {
        when(interactions.scrollHeight(page)).thenReturn(800L);

        ScrollResult result = handler.autoScroll(page, 5, 500, false);

        assertEquals(5, result.getScrollCount());
        assertEquals(ScrollResult.MAX_SCROLLS_REACHED, result.getStoppedReason());
    }

    @Test
    void delayHasAFloor() throws Exception {
        when(interactions.scrollHeight(page)).thenReturn(800L);

        handler.autoScroll(page, 2, 10, false);

        assertEquals(List.of(ScrollHandler.MIN_DELAY_MS, ScrollHandler.MIN_DELAY_MS), pauses);
    }
}
