package io.github.jsummarise.summarise;

import io.github.jsummarise.group.GroupedTable;
import io.github.jsummarise.group.Grouping;
import io.github.jsummarise.group.GroupingConfig;
import io.github.jsummarise.selector.ColumnSelector;
import io.github.jsummarise.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Binds the by argument of a summarise call to a {@link GroupedTable}, or to nothing when no grouping is asked for.
 */
public class GroupingResolver {
    private static final Logger logger = LoggerFactory.getLogger(GroupingResolver.class);

    private final ColumnResolver columnResolver;
    private final Grouping grouping;

    public GroupingResolver(ColumnResolver columnResolver, Grouping grouping) {
        this.columnResolver = requireNonNull(columnResolver);
        this.grouping = requireNonNull(grouping);
    }

    /**
     * @param by    null, a selector of key columns, a {@link GroupingConfig} or a map of grouping options
     * @return      null when by asks for no grouping or selects no key column
     */
    public GroupedTable resolve(Table dataset, Object by) {
        if (isAbsent(by)) {
            return null;
        }
        if (by instanceof GroupingConfig) {
            logger.debug("grouping with options {}", by);
            return grouping.group(dataset, ((GroupingConfig) by).options());
        }
        if (by instanceof Map) {
            logger.debug("grouping with options {}", by);
            return grouping.group(dataset, GroupingConfig.of((Map<?, ?>) by).options());
        }
        List<String> keys = columnResolver.resolve(ColumnSelector.of(by), dataset);
        if (keys.isEmpty()) {
            logger.debug("{} selects no key column, not grouping", by);
            return null;
        }
        logger.debug("grouping by {}", keys);
        return grouping.group(dataset, keys);
    }

    private static boolean isAbsent(Object by) {
        if (null == by) {
            return true;
        }
        if (by instanceof String) {
            return ((String) by).isEmpty();
        }
        if (by instanceof Collection) {
            return ((Collection<?>) by).isEmpty();
        }
        if (by instanceof Object[]) {
            return ((Object[]) by).length == 0;
        }
        return by instanceof Map && ((Map<?, ?>) by).isEmpty();
    }
}
