package io.github.jsummarise.table;

import io.github.jsummarise.exception.ColumnNotFoundException;
import io.github.jsummarise.exception.IllegalSizeException;
import io.github.jsummarise.json.JsonTables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable column-oriented table: equally long columns, a (possibly multi-level) header and a row index.
 * Columns are looked up by their level 0 label.
 */
public class Table {
    private final Header header;
    private final Index index;
    private final List<Column> columns;
    private final LinkedHashMap<String, Integer> columnName2Index = new LinkedHashMap<>();

    public Table(List<Column> columns) {
        this(headerOf(columns), Index.range(columns.isEmpty() ? 0 : columns.get(0).size()), columns);
    }

    public Table(Header header, Index index, List<Column> columns) {
        this.header = requireNonNull(header);
        this.index = requireNonNull(index);
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        if (header.width() != columns.size()) {
            throw new IllegalSizeException(format("header has %d labels for %d columns", header.width(), columns.size()));
        }
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).size() != index.size()) {
                throw new IllegalSizeException(format("column '%s' has %d rows, index has %d",
                        header.flatLabel(i), columns.get(i).size(), index.size()));
            }
            String name = header.level(0).get(i);
            if (!columnName2Index.containsKey(name)) {
                columnName2Index.put(name, i);
            }
        }
    }

    private static Header headerOf(List<Column> columns) {
        List<String> names = new ArrayList<>(columns.size());
        for (Column column : columns) {
            names.add(column.name());
        }
        return Header.of(names);
    }

    public Header getHeader() {
        return header;
    }

    public Index getRowIndex() {
        return index;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public Column getColumn(int index) {
        return columns.get(index);
    }

    public Column getColumn(String columnName) {
        Integer index = getIndex(columnName);
        if (null == index) {
            throw new ColumnNotFoundException(format("column '%s' not exists", columnName));
        }
        return columns.get(index);
    }

    /**
     * @return position of the first column labelled columnName at level 0, null if there is none
     */
    public Integer getIndex(String columnName) {
        return columnName2Index.get(columnName);
    }

    /**
     * @return read-only view, level 0 label to the position of its first column
     */
    public Map<String, Integer> getColumnIndex() {
        return Collections.unmodifiableMap(columnName2Index);
    }

    public List<String> getColumnNames() {
        return header.level(0);
    }

    public boolean hasColumn(String columnName) {
        return columnName2Index.containsKey(columnName);
    }

    /**
     * @return number of rows
     */
    public int size() {
        return index.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public Row getRow(int row) {
        return new RowByTable(this, row);
    }

    public List<Row> getRows(List<Integer> rows) {
        List<Row> ret = new ArrayList<>(rows.size());
        for (int row : rows) {
            ret.add(new RowByTable(this, row));
        }
        return ret;
    }

    /**
     * the named columns in the given order, keeping the row index
     */
    public Table select(List<String> columnNames) {
        List<Integer> positions = new ArrayList<>(columnNames.size());
        List<Column> selected = new ArrayList<>(columnNames.size());
        for (String columnName : columnNames) {
            Integer position = getIndex(columnName);
            if (null == position) {
                throw new ColumnNotFoundException(format("column '%s' not exists", columnName));
            }
            positions.add(position);
            selected.add(columns.get(position));
        }
        return new Table(header.select(positions), index, selected);
    }

    public Table take(List<Integer> rows) {
        List<Column> taken = new ArrayList<>(columns.size());
        for (Column column : columns) {
            taken.add(column.take(rows));
        }
        return new Table(header, index.take(rows), taken);
    }

    public Table withHeader(Header newHeader) {
        return new Table(newHeader, index, columns);
    }

    public Table withRowIndex(Index newIndex) {
        return new Table(header, newIndex, columns);
    }

    @Override
    public String toString() {
        return JsonTables.write(this);
    }
}
