package io.github.jsummarise.group;

import io.github.jsummarise.table.Table;

import java.util.List;
import java.util.Map;

/**
 * Partitions the rows of a table by the values of key columns.
 */
public interface Grouping {
    GroupedTable group(Table dataset, List<String> keys);

    /**
     * @param options   see {@link GroupingConfig}; the by option names key columns literally
     */
    GroupedTable group(Table dataset, Map<String, Object> options);
}
