package io.hearthwarrio.pagelens.core.nlq;

import io.hearthwarrio.pagelens.core.FieldType;
import io.hearthwarrio.pagelens.core.LogicalTarget;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FieldQueryParserTest {

    private final FieldQueryParser parser = new FieldQueryParser();

    @Test
    void mapsSynonymToCanonicalName() {
        LogicalTarget t = parser.parse("customer_rating");

        assertEquals("rating", t.getLogicalName());
        assertEquals(FieldType.NUMBER, t.getFieldType());
        assertEquals("customer rating", t.getTextHint());
        assertEquals("rating", t.getSemanticHint());
    }

    @Test
    void linkFieldsReadHref() {
        LogicalTarget t = parser.parse("product url");

        assertEquals("link", t.getLogicalName());
        assertEquals(FieldType.LINK, t.getFieldType());
        assertEquals("href", t.getAttribute());
        assertEquals("link", t.getSemanticHint());
    }

    @Test
    void tableHintWinsOverOtherTypes() {
        assertEquals(FieldType.TABLE, parser.parse("price table").getFieldType());
        assertEquals(FieldType.LIST, parser.parse("search results").getFieldType());
    }

    @Test
    void unknownWordsAreJoinedIntoName() {
        LogicalTarget t = parser.parse("Add to cart");

        assertEquals("add_cart", t.getLogicalName());
        assertEquals(FieldType.BUTTON, t.getFieldType());
        assertEquals("button", t.getSemanticHint());
    }

    @Test
    void explicitSpecOverridesInference() {
        FieldSpec spec = new FieldSpec("#sku", FieldType.TEXT, "data-sku", "SKU", "code", true);

        LogicalTarget t = parser.parse("price", spec);

        assertEquals("price", t.getLogicalName());
        assertEquals("#sku", t.getSelectorHint());
        assertEquals(FieldType.TEXT, t.getFieldType());
        assertEquals("data-sku", t.getAttribute());
        assertEquals("SKU", t.getTextHint());
        assertEquals("code", t.getSemanticHint());
        assertTrue(t.isMandatory());
    }

    @Test
    void queryWithoutUsableWordsIsRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> parser.parse("the of"));
        assertTrue(ex.getMessage().contains("no usable words"));
    }

    @Test
    void parseAllKeepsCallerOrder() {
        Map<String, FieldSpec> fields = new LinkedHashMap<>();
        fields.put("title", null);
        fields.put("price", FieldSpec.selector(".price"));
        fields.put("rating", FieldSpec.empty());

        Map<String, LogicalTarget> targets = parser.parseAll(fields);

        assertEquals(List.of("title", "price", "rating"), new ArrayList<>(targets.keySet()));
        assertEquals(".price", targets.get("price").getSelectorHint());
    }

    @Test
    void defaultSelectorsIncludeNameAndTypeSpecificOnes() {
        List<String> selectors = FieldQueryParser.defaultSelectors("price", FieldType.NUMBER);

        assertEquals("[data-field='price']", selectors.get(0));
        assertTrue(selectors.contains("#price"));
        assertTrue(selectors.contains("[itemprop='price']"));
        assertTrue(FieldQueryParser.defaultSelectors("Unit Price", FieldType.TEXT).contains(".unit_price"));
    }
}
