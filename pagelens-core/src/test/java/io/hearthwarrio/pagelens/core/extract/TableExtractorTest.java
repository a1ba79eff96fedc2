package io.hearthwarrio.pagelens.core.extract;

import io.hearthwarrio.pagelens.core.fixture.FixtureDom.El;
import io.hearthwarrio.pagelens.core.page.DomTree;
import io.hearthwarrio.pagelens.core.page.PageNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.hearthwarrio.pagelens.core.fixture.FixtureDom.body;
import static io.hearthwarrio.pagelens.core.fixture.FixtureDom.el;
import static org.junit.jupiter.api.Assertions.*;

public class TableExtractorTest {

    private final TableExtractor extractor = new TableExtractor(100);

    private static El row(String... cells) {
        El tr = el("tr");
        for (String c : cells) {
            tr.child(el("td", c));
        }
        return tr;
    }

    private static List<PageNode> tables(DomTree tree) {
        List<PageNode> out = new ArrayList<>();
        for (PageNode n : tree.nodes()) {
            if ("table".equals(n.getTagName())) {
                out.add(n);
            }
        }
        return out;
    }

    @Test
    void readsTheadHeadersAndTypedBodyRows() {
        DomTree tree = new DomTree(body(
                el("table").id("plans").child(
                        el("thead").child(el("tr").child(el("th", "Plan"), el("th", "Monthly Price"))),
                        el("tbody").child(row("Basic", "$10"), row("Pro", "$25"))
                )
        ));

        List<TableData> result = extractor.extract(tree, tables(tree));

        assertEquals(1, result.size());
        TableData t = result.get(0);
        assertEquals(List.of("Plan", "Monthly Price"), t.getHeaders());
        assertEquals(2, t.getRowCount());
        assertEquals(List.of("Basic", 10.0), t.getRows().get(0));
        assertEquals(Map.of("plan", "Pro", "monthly_price", 25.0), t.getRecords().get(1));
    }

    @Test
    void usesFirstRowAsHeaderWhenItLooksLikeOne() {
        DomTree tree = new DomTree(body(
                el("table").child(row("Name", "Score"), row("Ann", "91"), row("Bob", "88"))
        ));

        TableData t = extractor.extract(tree, tables(tree)).get(0);

        assertEquals(List.of("Name", "Score"), t.getHeaders());
        assertEquals(List.of(List.of("Ann", 91.0), List.of("Bob", 88.0)), t.getRows());
    }

    @Test
    void numericFirstRowGetsGeneratedHeaders() {
        DomTree tree = new DomTree(body(el("table").child(row("1", "2"), row("3", "4"))));

        TableData t = extractor.extract(tree, tables(tree)).get(0);

        assertEquals(List.of("column_1", "column_2"), t.getHeaders());
        assertEquals(2, t.getRowCount());
        assertEquals(3.0, t.getRecords().get(1).get("column_1"));
    }

    @Test
    void containerMatchContributesItsTablesAndNestedRowsStayNested() {
        DomTree tree = new DomTree(body(
                el("div").cls("report").child(
                        el("table").child(
                                el("tr").child(
                                        el("td", "Outer"),
                                        el("td").child(el("table").child(row("inner", "cell")))
                                )
                        )
                )
        ));
        PageNode container = tree.nodes().get(1);

        List<TableData> result = extractor.extract(tree, List.of(container));

        assertEquals(2, result.size());
        assertEquals(1, result.get(0).getRowCount());
        assertEquals(1, result.get(1).getIndex());
    }

    @Test
    void rowLimitHasAFloor() {
        El table = el("table");
        for (int i = 0; i < 15; i++) {
            table.child(row(String.valueOf(i), String.valueOf(i * 2)));
        }
        DomTree tree = new DomTree(body(table));

        TableData t = new TableExtractor(3).extract(tree, tables(tree)).get(0);

        assertEquals(TableExtractor.MIN_ROWS, t.getRowCount());
    }
}
