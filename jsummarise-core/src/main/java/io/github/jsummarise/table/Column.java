package io.github.jsummarise.table;

import io.github.jsummarise.exception.InconsistentColumnTypeException;
import io.github.jsummarise.util.ScalarUtil;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.lang.String.format;

public class Column<T extends Comparable> {
    public static final int DEFAULT_CAPACITY = 16;

    private final String name;
    private Type type;
    private final List<T> values;

    public Column(String name) {
        this(name, DEFAULT_CAPACITY);
    }

    public Column(String name, int initSize) {
        this.name = name;
        this.values = new ArrayList<>(initSize > 0 ? initSize : DEFAULT_CAPACITY);
    }

    public Column(String name, Type type) {
        this(name);
        this.type = type;
    }

    /**
     * column holding the given values, numeric values of different types are widened to Double
     * and any other mix of types gives an OBJECT column
     */
    public static Column<Comparable> of(String name, List<? extends Comparable> values) {
        Type common = null;
        boolean mixed = false;
        for (Comparable value : values) {
            if (null == value) {
                continue;
            }
            Type type = Type.getType(value);
            if (null == common) {
                common = type;
            } else if (common != type) {
                mixed = true;
                if (common.isNumeric() && type.isNumeric()) {
                    common = Type.DOUBLE;
                } else {
                    common = Type.OBJECT;
                }
            }
        }

        Column<Comparable> column = null == common ? new Column<>(name, values.size()) : new Column<>(name, common);
        for (Comparable value : values) {
            if (mixed && Type.DOUBLE == common && null != value) {
                column.add(ScalarUtil.toDoubleValue(value));
            } else {
                column.add(value);
            }
        }
        return column;
    }

    public void add(T value) {
        if (null != value && Type.OBJECT != type) {
            if (null == type) {
                type = Type.getType(value);
            } else if (Type.getType(value) != type) {
                throw new InconsistentColumnTypeException(format("column '%s': %s %s", name, value.getClass().getName(), type.name()));
            }
        }
        values.add(value);
    }

    public T get(int row) {
        return values.get(row);
    }

    public String getString(int row) {
        return ScalarUtil.toStr(get(row));
    }

    public BigDecimal getBigDecimal(int row) {
        return ScalarUtil.toBigDecimal(get(row));
    }

    public Double getDouble(int row) {
        return ScalarUtil.toDouble(get(row));
    }

    public Long getLong(int row) {
        return ScalarUtil.toLong(get(row));
    }

    public Integer getInteger(int row) {
        return ScalarUtil.toInteger(get(row));
    }

    public List<T> values() {
        return Collections.unmodifiableList(values);
    }

    /**
     * values at the given row positions, in the given order
     */
    public List<Comparable> values(List<Integer> rows) {
        List<Comparable> ret = new ArrayList<>(rows.size());
        for (int row : rows) {
            ret.add(values.get(row));
        }
        return ret;
    }

    public Column<T> take(List<Integer> rows) {
        Column<T> column = new Column<>(name, rows.size());
        column.type = type;
        for (int row : rows) {
            column.values.add(values.get(row));
        }
        return column;
    }

    public Column<T> rename(String newName) {
        Column<T> column = new Column<>(newName, values.size());
        column.type = type;
        column.values.addAll(values);
        return column;
    }

    public String name() {
        return name;
    }

    public int size() {
        return values.size();
    }

    /**
     * @return null while the column holds nulls only
     */
    public Type getType() {
        return type;
    }

    public boolean isNumeric() {
        return null == type || type.isNumeric();
    }
}
