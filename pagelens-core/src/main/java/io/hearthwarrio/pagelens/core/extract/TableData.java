package io.hearthwarrio.pagelens.core.extract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * One extracted table. Cells are numbers or strings.
 */
@JsonPropertyOrder({"index", "headers", "rows", "records", "row_count", "column_count"})
public final class TableData {

    private final int index;
    private final List<String> headers;
    private final List<List<Object>> rows;
    private final List<Map<String, Object>> records;

    public TableData(int index, List<String> headers, List<List<Object>> rows, List<Map<String, Object>> records) {
        this.index = index;
        this.headers = List.copyOf(headers);
        this.rows = rows;
        this.records = records;
    }

    @JsonProperty("index")
    public int getIndex() {
        return index;
    }

    @JsonProperty("headers")
    public List<String> getHeaders() {
        return headers;
    }

    @JsonProperty("rows")
    public List<List<Object>> getRows() {
        return rows;
    }

    /**
     * Rows keyed by normalized header ({@code lower_snake}); missing cells are {@code null}.
     */
    @JsonProperty("records")
    public List<Map<String, Object>> getRecords() {
        return records;
    }

    @JsonProperty("row_count")
    public int getRowCount() {
        return rows.size();
    }

    @JsonProperty("column_count")
    public int getColumnCount() {
        return headers.size();
    }
}
