package io.hearthwarrio.pagelens.core.pool;

import io.hearthwarrio.pagelens.core.NavigationException;
import io.hearthwarrio.pagelens.core.fixture.FixturePageProvider;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static io.hearthwarrio.pagelens.core.fixture.FixtureDom.body;
import static io.hearthwarrio.pagelens.core.fixture.FixtureDom.el;
import static org.junit.jupiter.api.Assertions.*;

public class TabOrchestratorTest {

    private final FixturePageProvider provider = new FixturePageProvider();

    private List<String> registerPages(int n) {
        String[] urls = new String[n];
        for (int i = 0; i < n; i++) {
            urls[i] = "https://news.example/story/" + i;
            provider.page(urls[i], "Story " + i, body(el("h1", "Story " + i)));
        }
        return List.of(urls);
    }

    @Test
    void runsEveryUrlWithBoundedConcurrency() {
        List<String> urls = registerPages(6);
        TabOrchestrator orchestrator = new TabOrchestrator(new PagePool(provider, 3, Duration.ofSeconds(10)));
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        List<UrlOutcome<String>> outcomes = orchestrator.runParallel(urls, 2, (page, url) -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(40);
            inFlight.decrementAndGet();
            return provider.title(page);
        });

        assertEquals(6, outcomes.size());
        for (int i = 0; i < 6; i++) {
            UrlOutcome<String> o = outcomes.get(i);
            assertTrue(o.isSuccess());
            assertEquals(urls.get(i), o.getUrl());
            assertEquals("parallel_" + i, o.getTabId());
            assertEquals("Story " + i, o.getValue());
        }
        assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
    }

    @Test
    void failedUnitDoesNotAffectSiblings() {
        List<String> urls = registerPages(2);
        List<String> withBroken = List.of(urls.get(0), "https://news.example/missing", urls.get(1));
        TabOrchestrator orchestrator = new TabOrchestrator(new PagePool(provider, 2, Duration.ofSeconds(10)));

        List<UrlOutcome<String>> outcomes = orchestrator.runParallel(withBroken, 2, (page, url) -> provider.title(page));

        assertEquals(3, outcomes.size());
        assertTrue(outcomes.get(0).isSuccess());
        assertFalse(outcomes.get(1).isSuccess());
        assertTrue(outcomes.get(1).getError() instanceof NavigationException);
        assertTrue(outcomes.get(2).isSuccess());
    }

    @Test
    void concurrencyIsCappedByPoolSize() {
        List<String> urls = registerPages(4);
        PagePool pool = new PagePool(provider, 1, Duration.ofSeconds(10));
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        List<UrlOutcome<Integer>> outcomes = new TabOrchestrator(pool).runParallel(urls, 8, (page, url) -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Thread.sleep(20);
            return inFlight.decrementAndGet();
        });

        assertEquals(4, outcomes.size());
        assertEquals(1, peak.get());
        assertTrue(pool.size() <= 1);
    }

    @Test
    void emptyInputGivesNoOutcomes() {
        TabOrchestrator orchestrator = new TabOrchestrator(new PagePool(provider, 2, Duration.ofSeconds(1)));

        assertTrue(orchestrator.runParallel(List.of(), 2, (page, url) -> url).isEmpty());
    }
}
