package io.hearthwarrio.pagelens.core.extract;

import io.hearthwarrio.pagelens.core.FieldType;
import io.hearthwarrio.pagelens.core.LogicalTarget;
import io.hearthwarrio.pagelens.core.ResolverSettings;
import io.hearthwarrio.pagelens.core.SelectorResolutionException;
import io.hearthwarrio.pagelens.core.SelectorResolver;
import io.hearthwarrio.pagelens.core.cache.InMemorySelectorCache;
import io.hearthwarrio.pagelens.core.fixture.FixturePageProvider;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.hearthwarrio.pagelens.core.fixture.FixtureDom.body;
import static io.hearthwarrio.pagelens.core.fixture.FixtureDom.el;
import static org.junit.jupiter.api.Assertions.*;

public class FieldExtractorTest {

    private static final String URL = "https://shop.example/kettle";

    private final FixturePageProvider provider = new FixturePageProvider().page(URL, "Kettle", body(
            el("div").cls("product").child(
                    el("h1", "Acme Kettle"),
                    el("h2", "Price"),
                    el("span", "$19.99"),
                    el("a", "Reviews").attr("href", "/kettle/reviews")
            ),
            el("ul").child(el("li", "1.7 litres"), el("li", "Auto shut-off"), el("li", "Steel body")),
            el("table").child(
                    el("tr").child(el("td", "Weight"), el("td", "1.2 kg")),
                    el("tr").child(el("td", "Colour"), el("td", "Red"))
            )
    ));
    private final SelectorResolver resolver = new SelectorResolver(
            provider, new InMemorySelectorCache(Duration.ofHours(1), Clock.systemUTC()));
    private final FieldExtractor extractor =
            new FieldExtractor(provider, resolver, new ValueCaster(1000), new TableExtractor(100), 5000);
    private final PageHandle page = provider.open(URL);

    private ExtractionResult extract(Map<String, LogicalTarget> targets) {
        return extractor.extract(page, "shop.example", targets, ResolverSettings.defaults());
    }

    @Test
    void extractsTypedScalarsWithProvenance() {
        Map<String, LogicalTarget> targets = new LinkedHashMap<>();
        targets.put("title", LogicalTarget.named("title").selectorHint("h1").build());
        targets.put("price", LogicalTarget.named("product_price").selectorHint(".price").fieldType(FieldType.NUMBER).build());
        targets.put("reviews", LogicalTarget.named("reviews").selectorHint("a").attribute("href").build());

        ExtractionResult result = extract(targets);

        assertEquals(URL, result.getUrl());
        assertEquals("Acme Kettle", result.data().get("title"));
        assertEquals(19.99, result.data().get("price"));
        assertEquals("/kettle/reviews", result.data().get("reviews"));

        FieldValue title = result.field("title");
        assertEquals("direct", title.getStrategy());
        assertEquals("h1", title.getSelector());
        assertFalse(title.getHealed());

        FieldValue price = result.field("price");
        assertEquals("text", price.getStrategy());
        assertTrue(price.getHealed());
        assertEquals("body > div.product > span", price.getSelector());
    }

    @Test
    void optionalMissingFieldIsReportedNotFound() {
        ExtractionResult result = extract(Map.of("warranty", LogicalTarget.named("warranty").build()));

        FieldValue warranty = result.field("warranty");
        assertFalse(warranty.isFound());
        assertEquals(FieldValue.NOT_FOUND, warranty.getStrategy());
        assertEquals(List.of("direct", "cached", "text", "semantic"), warranty.getAttempted());
        assertNull(result.data().get("warranty"));
    }

    @Test
    void mandatoryMissingFieldFailsTheExtraction() {
        Map<String, LogicalTarget> targets = Map.of("warranty", LogicalTarget.named("warranty").mandatory(true).build());

        SelectorResolutionException ex = assertThrows(SelectorResolutionException.class, () -> extract(targets));
        assertEquals("warranty", ex.getLogicalName());
    }

    @Test
    void absentAttributeYieldsNull() {
        ExtractionResult result = extract(Map.of("image", LogicalTarget.named("image").selectorHint("h1").attribute("src").build()));

        assertTrue(result.field("image").isFound());
        assertNull(result.data().get("image"));
    }

    @Test
    void collectsListsAndTables() {
        Map<String, LogicalTarget> targets = new LinkedHashMap<>();
        targets.put("features", LogicalTarget.named("features").selectorHint("ul li").fieldType(FieldType.LIST).build());
        targets.put("specs", LogicalTarget.named("specs").fieldType(FieldType.TABLE).build());

        ExtractionResult result = extract(targets);

        assertEquals(List.of("1.7 litres", "Auto shut-off", "Steel body"), result.data().get("features"));
        assertEquals(3, result.field("features").getItemCount());
        assertEquals("list", result.field("features").getStrategy());

        FieldValue specs = result.field("specs");
        assertEquals(1, specs.getItemCount());
        assertEquals("table", specs.getSelector());
        assertTrue(specs.getValue() instanceof List);
    }

    @Test
    void listWithoutMatchesIsEmpty() {
        ExtractionResult result = extract(Map.of("tags",
                LogicalTarget.named("tags").selectorHint(".tag").fieldType(FieldType.LIST).build()));

        assertEquals(List.of(), result.data().get("tags"));
        assertEquals(0, result.field("tags").getItemCount());
    }
}
