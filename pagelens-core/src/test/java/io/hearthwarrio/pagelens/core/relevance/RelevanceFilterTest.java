package io.hearthwarrio.pagelens.core.relevance;

import io.hearthwarrio.pagelens.core.page.DomTree;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.hearthwarrio.pagelens.core.fixture.FixtureDom.body;
import static io.hearthwarrio.pagelens.core.fixture.FixtureDom.el;
import static org.junit.jupiter.api.Assertions.*;

public class RelevanceFilterTest {

    private final RelevanceFilter filter = new RelevanceFilter();

    private static List<ContentBlock> catalogBlocks() {
        List<ContentBlock> blocks = new ArrayList<>();
        int index = 0;
        for (int i = 0; i < 10; i++) {
            if (i == 1 || i == 4 || i == 8) {
                blocks.add(new ContentBlock(index++, "h2", BlockKind.HEADING, "Price list " + i, "h2"));
            } else {
                blocks.add(new ContentBlock(index++, "p", BlockKind.TEXT,
                        "Our team ships every order within two business days of purchase.", "p"));
            }
        }
        return blocks;
    }

    @Test
    void keepsOnlyMatchingHeadingsInDocumentOrder() {
        List<ScoredBlock> kept = filter.filter(catalogBlocks(), List.of("price"), 0.5, 3);

        assertEquals(3, kept.size());
        assertEquals(1, kept.get(0).getBlock().getIndex());
        assertEquals(4, kept.get(1).getBlock().getIndex());
        assertEquals(8, kept.get(2).getBlock().getIndex());
        for (ScoredBlock s : kept) {
            assertTrue(s.getScore() >= 0.5);
        }
    }

    @Test
    void maxItemsKeepsHighestScores() {
        List<ContentBlock> blocks = List.of(
                ContentBlock.of(0, "p", "Shipping is free on orders above fifty dollars for members."),
                new ContentBlock(1, "h2", BlockKind.HEADING, "Price and shipping", "h2"),
                ContentBlock.of(2, "p", "The price shown includes tax and the shipping price is extra.")
        );

        List<ScoredBlock> kept = filter.filter(blocks, List.of("price", "shipping"), 0.0, 2);

        assertEquals(2, kept.size());
        assertEquals(1, kept.get(0).getBlock().getIndex());
        assertEquals(2, kept.get(1).getBlock().getIndex());
    }

    @Test
    void keywordsAreCaseInsensitive() {
        ContentBlock block = new ContentBlock(0, "h2", BlockKind.HEADING, "PRICE", "h2");

        assertEquals(
                filter.score(block, List.of("price")),
                filter.filter(List.of(block), List.of("  Price "), 0.0, 1).get(0).getScore()
        );
    }

    @Test
    void withoutKeywordsLongerBlocksScoreHigher() {
        ContentBlock shortBlock = ContentBlock.of(0, "p", "Short paragraph of text that is still ok.");
        ContentBlock longBlock = ContentBlock.of(1, "p", "x".repeat(450));

        assertTrue(filter.score(longBlock, List.of()) > filter.score(shortBlock, List.of()));
    }

    @Test
    void negativeMaxItemsIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> filter.filter(List.of(), List.of("a"), 0.0, -1));
    }

    @Test
    void collectorSkipsBoilerplate() {
        DomTree tree = new DomTree(body(
                el("nav").child(el("p", "Home Catalog Price list Contact us today please")),
                el("main").child(
                        el("h2", "Price"),
                        el("p", "Every kettle comes with a two year warranty."),
                        el("div").cls("advert").child(el("p", "Buy the best price kettles right now online"))
                ),
                el("footer").child(el("p", "Copyright 2024 Acme Kettles and friends"))
        ));

        List<ContentBlock> blocks = new BlockCollector().collect(tree);

        assertEquals(2, blocks.size());
        assertEquals("Price", blocks.get(0).getText());
        assertEquals(BlockKind.HEADING, blocks.get(0).getKind());
        assertEquals("Every kettle comes with a two year warranty.", blocks.get(1).getText());
    }
}
