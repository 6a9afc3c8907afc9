package io.github.jsummarise.summarise;

import java.util.Arrays;

/**
 * Fluent spelling of a (column, function(s), name) request:
 * {@code col("run").agg("mean").rename("run_avg")}.
 */
public class AggregationTuple {
    private final Object col;
    private Object func;
    private Object name;

    AggregationTuple(Object col) {
        this.col = col;
    }

    /**
     * @param functions one function, or several applied side by side
     */
    public AggregationTuple agg(Object... functions) {
        this.func = functions.length == 1 ? functions[0] : Arrays.asList(functions);
        return this;
    }

    public AggregationTuple rename(Object name) {
        this.name = name;
        return this;
    }

    public Object[] toArray() {
        if (null == func) {
            return new Object[]{col};
        }
        return null == name ? new Object[]{col, func} : new Object[]{col, func, name};
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }
}
