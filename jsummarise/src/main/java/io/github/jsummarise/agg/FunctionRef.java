package io.github.jsummarise.agg;

import io.github.jsummarise.exception.IllegalSizeException;
import io.github.jsummarise.function.AggregationFunction;
import io.github.jsummarise.function.ColumnFunction;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One aggregation function of a request: a built-in known by name, a column reducer, or a row function that
 * sees the rows of a whole group.
 */
public final class FunctionRef {
    public enum Kind {
        NAMED,
        COLUMN,
        ROWS
    }

    public static final String DESCRIBE = "describe";
    // label of a callable registered without one
    public static final String LAMBDA = "<lambda>";

    private final Kind kind;
    private final String label;
    private final ColumnFunction columnFunction;
    private final AggregationFunction aggregationFunction;
    private final List<String> outputColumns;

    private FunctionRef(Kind kind, String label, ColumnFunction columnFunction,
                        AggregationFunction aggregationFunction, List<String> outputColumns) {
        this.kind = kind;
        this.label = requireNonNull(label);
        this.columnFunction = columnFunction;
        this.aggregationFunction = aggregationFunction;
        this.outputColumns = outputColumns;
    }

    public static FunctionRef named(String name) {
        return new FunctionRef(Kind.NAMED, name, null, null, null);
    }

    public static FunctionRef describe() {
        return named(DESCRIBE);
    }

    public static FunctionRef column(ColumnFunction function) {
        return column(LAMBDA, function);
    }

    public static FunctionRef column(String label, ColumnFunction function) {
        return new FunctionRef(Kind.COLUMN, label, requireNonNull(function), null, null);
    }

    /**
     * @param outputColumns names of the values the function returns per group, defaults to the label
     */
    public static FunctionRef rows(String label, AggregationFunction function, String... outputColumns) {
        List<String> outputs = outputColumns.length == 0
                ? Collections.singletonList(label)
                : Collections.unmodifiableList(Arrays.asList(outputColumns.clone()));
        return new FunctionRef(Kind.ROWS, label, null, requireNonNull(function), outputs);
    }

    public static FunctionRef rows(AggregationFunction function, String... outputColumns) {
        return rows(LAMBDA, function, outputColumns);
    }

    public Kind kind() {
        return kind;
    }

    public String label() {
        return label;
    }

    public ColumnFunction columnFunction() {
        return columnFunction;
    }

    public AggregationFunction aggregationFunction() {
        return aggregationFunction;
    }

    public List<String> outputColumns() {
        return outputColumns;
    }

    /**
     * @param out   the values a row function returned for one group
     */
    public void checkRowSize(Comparable[] out) {
        int expected = outputColumns.size();
        if (null == out || out.length != expected) {
            throw new IllegalSizeException(format("%s returned %d values for %d output columns %s",
                    this, null == out ? 0 : out.length, expected, outputColumns));
        }
    }

    public boolean isCallable() {
        return Kind.NAMED != kind;
    }

    public boolean isDescribe() {
        return Kind.NAMED == kind && DESCRIBE.equals(label);
    }

    @Override
    public String toString() {
        return Kind.NAMED == kind ? "'" + label + "'" : kind.name().toLowerCase() + "(" + label + ")";
    }
}
