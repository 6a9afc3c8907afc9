package io.github.jsummarise.table;

import java.math.BigDecimal;
import java.util.List;

import static io.github.jsummarise.util.ScalarUtil.toBigDecimal;
import static io.github.jsummarise.util.ScalarUtil.toBoolean;
import static io.github.jsummarise.util.ScalarUtil.toDouble;
import static io.github.jsummarise.util.ScalarUtil.toInteger;
import static io.github.jsummarise.util.ScalarUtil.toLong;
import static io.github.jsummarise.util.ScalarUtil.toStr;

/**
 * One row of a table as seen by row aggregation functions. The typed getters cast strictly: a cell of
 * another type fails with a ClassCastException, a null cell gives null.
 */
public interface Row {
    /**
     * @return level 0 labels in column order
     */
    List<String> getColumnNames();

    int size();

    Comparable getComparable(int index);

    /**
     * @throws io.github.jsummarise.exception.ColumnNotFoundException if the row has no such column
     */
    Comparable getComparable(String columnName);

    default Comparable[] getAll() {
        Comparable[] comparables = new Comparable[size()];
        for (int i = 0; i < comparables.length; i++) {
            comparables[i] = getComparable(i);
        }
        return comparables;
    }

    default String getString(String columnName) {
        return toStr(getComparable(columnName));
    }

    default Integer getInteger(String columnName) {
        return toInteger(getComparable(columnName));
    }

    default Long getLong(String columnName) {
        return toLong(getComparable(columnName));
    }

    default Double getDouble(String columnName) {
        return toDouble(getComparable(columnName));
    }

    default BigDecimal getBigDecimal(String columnName) {
        return toBigDecimal(getComparable(columnName));
    }

    default Boolean getBoolean(String columnName) {
        return toBoolean(getComparable(columnName));
    }
}
