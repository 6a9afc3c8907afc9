package io.github.jsummarise.table;

import io.github.jsummarise.exception.IllegalSizeException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;

public class TableBuilder {
    private final List<Column> columns;

    public TableBuilder(Map<String, Type> columnTypeMap) {
        columns = new ArrayList<>(columnTypeMap.size());
        for (Map.Entry<String, Type> entry : columnTypeMap.entrySet()) {
            columns.add(new Column(entry.getKey(), entry.getValue()));
        }
    }

    /**
     * columns typed by their first non null value
     */
    public TableBuilder(String... columnNames) {
        columns = new ArrayList<>(columnNames.length);
        for (String columnName : columnNames) {
            columns.add(new Column(columnName));
        }
    }

    public void append(int index, Comparable comparable) {
        columns.get(index).add(comparable);
    }

    public TableBuilder appendRow(Comparable... comparables) {
        if (comparables.length != columns.size()) {
            throw new IllegalSizeException(format("row of %d values for %d columns", comparables.length, columns.size()));
        }
        for (int i = 0; i < comparables.length; i++) {
            columns.get(i).add(comparables[i]);
        }
        return this;
    }

    public int columnCount() {
        return columns.size();
    }

    public Table build() {
        return new Table(columns);
    }
}
