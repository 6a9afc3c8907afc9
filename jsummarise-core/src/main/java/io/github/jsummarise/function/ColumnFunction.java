package io.github.jsummarise.function;

import java.util.List;

/**
 * Reduces the values of one column (or of one column within a group) to a scalar.
 */
public interface ColumnFunction {
    Comparable apply(List<Comparable> values);
}
