package io.hearthwarrio.pagelens.core.extract;

import io.hearthwarrio.pagelens.core.page.DomTree;
import io.hearthwarrio.pagelens.core.page.PageNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads HTML tables from a page snapshot into headers, rows and header-keyed records.
 * <p>
 * Headers come from {@code thead th}; otherwise the first row is used when every cell contains a letter; otherwise
 * {@code column_1..column_n}. Rows inside nested tables belong to the nested table only.
 */
public class TableExtractor {

    public static final int MIN_ROWS = 10;

    private final int maxTableRows;

    public TableExtractor(int maxTableRows) {
        this.maxTableRows = Math.max(MIN_ROWS, maxTableRows);
    }

    /**
     * @param tree    snapshot of the page
     * @param matches nodes matched by the table selector; non-table matches contribute the tables they contain
     */
    public List<TableData> extract(DomTree tree, List<PageNode> matches) {
        List<PageNode> tables = new ArrayList<>();
        for (PageNode match : matches) {
            Optional<PageNode> node = tree.node(match.getIndex());
            if (node.isEmpty()) {
                continue;
            }
            if ("table".equals(node.get().getTagName())) {
                addOnce(tables, node.get());
            } else {
                for (PageNode d : tree.descendants(node.get())) {
                    if ("table".equals(d.getTagName())) {
                        addOnce(tables, d);
                    }
                }
            }
        }

        List<TableData> out = new ArrayList<>(tables.size());
        for (PageNode table : tables) {
            out.add(read(tree, table, out.size()));
        }
        return out;
    }

    private TableData read(DomTree tree, PageNode table, int index) {
        List<PageNode> ownRows = new ArrayList<>();
        List<String> headers = new ArrayList<>();
        boolean hasBody = false;

        for (PageNode d : tree.descendants(table)) {
            if (closestTable(tree, d) != table.getIndex()) {
                continue;
            }
            if ("tbody".equals(d.getTagName())) {
                hasBody = true;
            }
            if ("th".equals(d.getTagName()) && insideSection(tree, d, "thead")) {
                headers.add(clean(d.getText()));
            }
            if ("tr".equals(d.getTagName())) {
                ownRows.add(d);
            }
        }

        List<List<String>> rawRows = new ArrayList<>();
        for (PageNode row : ownRows) {
            if (rawRows.size() == maxTableRows) {
                break;
            }
            if (hasBody && !insideSection(tree, row, "tbody")) {
                continue;
            }
            List<String> cells = new ArrayList<>();
            for (PageNode cell : tree.children(row)) {
                if ("td".equals(cell.getTagName()) || "th".equals(cell.getTagName())) {
                    cells.add(clean(cell.getText()));
                }
            }
            rawRows.add(cells);
        }

        if (headers.isEmpty() && !rawRows.isEmpty() && isHeaderLike(rawRows.get(0))) {
            headers.addAll(rawRows.remove(0));
        }
        if (headers.isEmpty() && !rawRows.isEmpty()) {
            int width = 0;
            for (List<String> r : rawRows) {
                width = Math.max(width, r.size());
            }
            for (int i = 1; i <= width; i++) {
                headers.add("column_" + i);
            }
        }

        List<List<Object>> rows = new ArrayList<>(rawRows.size());
        for (List<String> r : rawRows) {
            List<Object> typed = new ArrayList<>(r.size());
            for (String cell : r) {
                typed.add(ValueCaster.normalizeCell(cell));
            }
            rows.add(typed);
        }
        return new TableData(index, headers, rows, toRecords(headers, rows));
    }

    static List<Map<String, Object>> toRecords(List<String> headers, List<List<Object>> rows) {
        if (headers.isEmpty()) {
            return List.of();
        }
        List<String> keys = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            String h = headers.get(i) == null ? "" : headers.get(i).trim();
            keys.add(h.isEmpty() ? "column_" + (i + 1) : h.toLowerCase(Locale.ROOT).replace(' ', '_'));
        }
        List<Map<String, Object>> records = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                record.put(keys.get(i), i < row.size() ? row.get(i) : null);
            }
            records.add(record);
        }
        return records;
    }

    private static boolean isHeaderLike(List<String> cells) {
        if (cells.isEmpty()) {
            return false;
        }
        for (String c : cells) {
            if (!c.matches(".*[a-zA-Z].*")) {
                return false;
            }
        }
        return true;
    }

    private static int closestTable(DomTree tree, PageNode node) {
        for (PageNode a : tree.ancestors(node)) {
            if ("table".equals(a.getTagName())) {
                return a.getIndex();
            }
        }
        return -1;
    }

    private static boolean insideSection(DomTree tree, PageNode node, String sectionTag) {
        for (PageNode a : tree.ancestors(node)) {
            if (sectionTag.equals(a.getTagName())) {
                return true;
            }
            if ("table".equals(a.getTagName())) {
                return false;
            }
        }
        return false;
    }

    private static void addOnce(List<PageNode> tables, PageNode table) {
        for (PageNode t : tables) {
            if (t.getIndex() == table.getIndex()) {
                return;
            }
        }
        tables.add(table);
    }

    private static String clean(String s) {
        return s == null ? "" : s.replaceAll("\\s+", " ").trim();
    }

    public int getMaxTableRows() {
        return maxTableRows;
    }
}
