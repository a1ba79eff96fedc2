package io.hearthwarrio.pagelens.core.cache;

import io.hearthwarrio.pagelens.core.LocatorCandidate;
import io.hearthwarrio.pagelens.core.StrategyTag;
import io.hearthwarrio.pagelens.core.fixture.MutableClock;
import io.hearthwarrio.pagelens.core.page.Locator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class FileSelectorCacheTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

    @Test
    void entriesSurviveReload() {
        Path file = dir.resolve("cache/selectors.json");
        FileSelectorCache first = new FileSelectorCache(file, Duration.ofHours(168), clock);
        first.put("shop.example", "product_price",
                new LocatorCandidate(Locator.xpath("/html/body/div/span"), StrategyTag.SEMANTIC, 0.42, 4));

        assertTrue(Files.isRegularFile(file));

        FileSelectorCache second = new FileSelectorCache(file, Duration.ofHours(168), clock);
        SelectorCacheEntry entry = second.entry("shop.example", "product_price").orElseThrow();
        assertEquals(Locator.xpath("/html/body/div/span"), entry.getCandidate().getLocator());
        assertEquals(StrategyTag.SEMANTIC, entry.getCandidate().getStrategy());
        assertEquals(0.42, entry.getCandidate().getConfidence(), 1e-9);
        assertEquals(4, entry.getCandidate().getNodeDepth());
        assertEquals(clock.instant(), entry.getLastVerifiedAt());
    }

    @Test
    void invalidationIsPersisted() {
        Path file = dir.resolve("selectors.json");
        FileSelectorCache first = new FileSelectorCache(file, Duration.ofHours(1), clock);
        first.put("shop.example", "title", new LocatorCandidate(Locator.css("h1"), StrategyTag.TEXT, 0.85, 1));
        first.invalidate("shop.example", "title");

        FileSelectorCache second = new FileSelectorCache(file, Duration.ofHours(1), clock);
        assertEquals(0, second.size());
    }

    @Test
    void unreadableFileStartsEmpty() throws Exception {
        Path file = dir.resolve("broken.json");
        Files.write(file, "{not json".getBytes(StandardCharsets.UTF_8));

        FileSelectorCache cache = new FileSelectorCache(file, Duration.ofHours(1), clock);

        assertEquals(0, cache.size());
    }

    @Test
    void expiredEntriesAreNotServedAfterReload() {
        Path file = dir.resolve("selectors.json");
        new FileSelectorCache(file, Duration.ofHours(1), clock)
                .put("shop.example", "title", new LocatorCandidate(Locator.css("h1"), StrategyTag.TEXT, 0.85, 1));

        clock.advance(Duration.ofHours(2));

        FileSelectorCache reloaded = new FileSelectorCache(file, Duration.ofHours(1), clock);
        assertTrue(reloaded.entry("shop.example", "title").isEmpty());
    }
}
