package io.github.jsummarise.agg;

import io.github.jsummarise.table.Table;

import java.util.List;

/**
 * Selected columns of a dataset, grouped or not, ready to be aggregated.
 */
public interface AggregationView {
    List<String> getColumnNames();

    /**
     * applies every function of the spec in one pass; the spec must be supported by the primitive
     */
    Table aggregate(FunctionSpec spec);

    /**
     * descriptive statistics of every selected column
     */
    Table describe();

    /**
     * applies a single function on its own, the only way to run a row function
     */
    Table apply(FunctionRef function);
}
