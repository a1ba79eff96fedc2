package io.hearthwarrio.pagelens.core;

import io.hearthwarrio.pagelens.core.cache.InMemorySelectorCache;
import io.hearthwarrio.pagelens.core.fixture.FixturePageProvider;
import io.hearthwarrio.pagelens.core.fixture.MutableClock;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import io.hearthwarrio.pagelens.core.page.PageNode;
import io.hearthwarrio.pagelens.core.strategy.DirectSelectorStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.hearthwarrio.pagelens.core.fixture.FixtureDom.body;
import static io.hearthwarrio.pagelens.core.fixture.FixtureDom.el;
import static org.junit.jupiter.api.Assertions.*;

public class SelectorResolverTest {

    private static final String URL = "https://shop.example/kettle";
    private static final String SITE = "shop.example";

    private final FixturePageProvider provider = new FixturePageProvider()
            .page(URL, "Kettle", productPage());
    private final InMemorySelectorCache cache =
            new InMemorySelectorCache(Duration.ofHours(168), new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
    private final List<Resolution> resolved = new ArrayList<>();
    private final SelectorResolver resolver = new SelectorResolver(
            provider, cache, ResolutionStrategies.defaults(), (site, resolution) -> resolved.add(resolution));

    private final PageHandle page = provider.open(URL);

    private static List<PageNode> productPage() {
        return body(
                el("div").cls("product").child(
                        el("h1", "Acme Kettle"),
                        el("h2", "Price"),
                        el("span", "$19.99")
                )
        );
    }

    private static LogicalTarget productPrice() {
        return LogicalTarget.named("product_price")
                .selectorHint(".old-price")
                .fieldType(FieldType.NUMBER)
                .build();
    }

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    void directHintWinsWhenItMatches() {
        LogicalTarget target = LogicalTarget.named("title").selectorHint("h1").build();

        Resolution r = resolver.resolve(page, SITE, target);

        assertEquals(StrategyTag.DIRECT, r.getCandidate().getStrategy());
        assertEquals(1.0, r.getCandidate().getConfidence());
        assertEquals("Acme Kettle", r.getNode().getText());
        assertFalse(r.isHealed());
    }

    @Test
    void brokenSelectorHealsByTextThenServesFromCache() {
        Resolution first = resolver.resolve(page, SITE, productPrice());

        assertEquals(StrategyTag.TEXT, first.getCandidate().getStrategy());
        assertEquals("$19.99", first.getNode().getOwnText());
        assertEquals("body > div.product > span", first.getCandidate().getLocator().getExpression());
        assertTrue(first.isHealed());

        Resolution second = resolver.resolve(page, SITE, productPrice());

        assertEquals(StrategyTag.CACHED, second.getCandidate().getStrategy());
        assertEquals(first.getNode().getIndex(), second.getNode().getIndex());
        assertEquals(first.getCandidate().getConfidence(), second.getCandidate().getConfidence());
        assertEquals(2, resolved.size());
    }

    @Test
    void staleCacheEntryFallsThroughToTextMatch() {
        resolver.resolve(page, SITE, productPrice());

        provider.page(URL, "Kettle", body(
                el("section").child(
                        el("h2", "Price"),
                        el("strong", "$21.50")
                )
        ));

        Resolution healed = resolver.resolve(page, SITE, productPrice());

        assertEquals(StrategyTag.TEXT, healed.getCandidate().getStrategy());
        assertEquals("$21.50", healed.getNode().getOwnText());
        assertEquals("body > section > strong",
                cache.entry(SITE, "product_price").orElseThrow().getCandidate().getLocator().getExpression());
    }

    @Test
    void cachedEntryIsDroppedWhenNoTierMatchesAnymore() {
        resolver.resolve(page, SITE, productPrice());
        assertTrue(cache.entry(SITE, "product_price").isPresent());

        provider.page(URL, "Kettle", body(
                el("section").child(
                        el("h1", "Acme Kettle"),
                        el("p", "Sold out")
                )
        ));

        assertThrows(SelectorResolutionException.class, () -> resolver.resolve(page, SITE, productPrice()));
        assertTrue(cache.entry(SITE, "product_price").isEmpty());
    }

    @Test
    void disabledCacheTierIsSkipped() {
        resolver.resolve(page, SITE, productPrice());
        ResolverSettings noCache = new ResolverSettings(
                List.of(StrategyTag.DIRECT, StrategyTag.TEXT, StrategyTag.SEMANTIC), 3.5, 1800, true);

        Resolution r = resolver.resolve(page, SITE, productPrice(), noCache);

        assertEquals(StrategyTag.TEXT, r.getCandidate().getStrategy());
    }

    @Test
    void semanticTierRecognizesPriceArchetype() {
        provider.page("https://shop.example/bare", "Bare", body(
                el("p", "Ships in two days"),
                el("span", "$42.00")
        ));
        PageHandle bare = provider.open("https://shop.example/bare");

        Resolution r = resolver.resolve(bare, SITE, LogicalTarget.named("cost").build());

        assertEquals(StrategyTag.SEMANTIC, r.getCandidate().getStrategy());
        assertEquals("$42.00", r.getNode().getOwnText());
        assertTrue(r.getCandidate().getConfidence() < 0.6);
    }

    @Test
    void failureListsEveryAttemptedTier() {
        LogicalTarget target = LogicalTarget.named("shipping_weight").selectorHint("#weight").build();

        SelectorResolutionException ex = assertThrows(
                SelectorResolutionException.class,
                () -> resolver.resolve(page, SITE, target)
        );

        assertEquals(ErrorKind.RESOLUTION_FAILURE, ex.getKind());
        assertEquals(
                List.of(StrategyTag.DIRECT, StrategyTag.CACHED, StrategyTag.TEXT, StrategyTag.SEMANTIC),
                ex.getAttemptedStrategies()
        );
        assertTrue(ex.getMessage().contains("shipping_weight"));
        assertTrue(cache.entry(SITE, "shipping_weight").isEmpty());
    }

    @Test
    void throwingStrategyCountsAsNoMatch() {
        ResolutionStrategy broken = new ResolutionStrategy() {
            @Override
            public StrategyTag tag() {
                return StrategyTag.TEXT;
            }

            @Override
            public Optional<Resolution> attempt(ResolutionContext context) {
                throw new IllegalStateException("boom");
            }
        };
        SelectorResolver partial = new SelectorResolver(
                provider, cache, List.of(broken, new DirectSelectorStrategy()), null);

        Resolution r = partial.resolve(page, SITE, LogicalTarget.named("title").selectorHint("h1").build());
        assertEquals(StrategyTag.DIRECT, r.getCandidate().getStrategy());

        SelectorResolutionException ex = assertThrows(
                SelectorResolutionException.class,
                () -> partial.resolve(page, SITE, LogicalTarget.named("price").build())
        );
        assertEquals(List.of(StrategyTag.DIRECT, StrategyTag.TEXT), ex.getAttemptedStrategies());
    }

    @Test
    void interruptedResolutionStopsAndLeavesCacheUntouched() {
        Thread.currentThread().interrupt();

        assertThrows(TaskTimeoutException.class, () -> resolver.resolve(page, SITE, productPrice()));

        assertTrue(cache.entry(SITE, "product_price").isEmpty());
    }
}
