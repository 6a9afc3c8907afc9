package io.github.jsummarise.table;

import io.github.jsummarise.exception.ColumnNotFoundException;

import java.util.List;

import static java.lang.String.format;

/**
 * A row read through from its table, nothing is copied.
 */
public class RowByTable implements Row {
    private final Table table;
    private final int row;

    public RowByTable(Table table, int row) {
        this.table = table;
        this.row = row;
    }

    @Override
    public List<String> getColumnNames() {
        return table.getColumnNames();
    }

    @Override
    public int size() {
        return table.columnCount();
    }

    @Override
    public Comparable getComparable(int index) {
        return table.getColumn(index).get(row);
    }

    @Override
    public Comparable getComparable(String columnName) {
        Integer index = table.getIndex(columnName);
        if (null == index) {
            throw new ColumnNotFoundException(format("column '%s' not exists in row %d", columnName, row));
        }
        return getComparable(index);
    }
}
