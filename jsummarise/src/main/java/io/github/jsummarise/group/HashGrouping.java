package io.github.jsummarise.group;

import io.github.jsummarise.agg.AggregationPrimitive;
import io.github.jsummarise.exception.InvalidArgumentException;
import io.github.jsummarise.table.Column;
import io.github.jsummarise.table.Table;
import io.github.jsummarise.util.ScalarUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

public class HashGrouping implements Grouping {
    private static final Logger logger = LoggerFactory.getLogger(HashGrouping.class);

    private static final Comparator<List<Comparable>> KEY_ORDER = new Comparator<List<Comparable>>() {
        @Override
        public int compare(List<Comparable> o1, List<Comparable> o2) {
            for (int i = 0; i < o1.size(); i++) {
                int c = ScalarUtil.compare(o1.get(i), o2.get(i));
                if (0 != c) {
                    return c;
                }
            }
            return 0;
        }
    };

    private final AggregationPrimitive primitive;
    private final boolean sort;
    private final boolean dropna;

    /**
     * @param sort      default for the sort option: order groups by key, or else by first appearance
     * @param dropna    default for the dropna option: drop rows with a null key value
     */
    public HashGrouping(AggregationPrimitive primitive, boolean sort, boolean dropna) {
        this.primitive = requireNonNull(primitive);
        this.sort = sort;
        this.dropna = dropna;
    }

    @Override
    public GroupedTable group(Table dataset, List<String> keys) {
        return group(dataset, keys, sort, dropna);
    }

    @Override
    public GroupedTable group(Table dataset, Map<String, Object> options) {
        List<String> keys = null;
        boolean sort = this.sort;
        boolean dropna = this.dropna;
        for (Map.Entry<String, Object> option : options.entrySet()) {
            switch (option.getKey()) {
                case GroupingConfig.BY:
                    keys = toKeys(option.getValue());
                    break;
                case GroupingConfig.SORT:
                    sort = toBoolean(option);
                    break;
                case GroupingConfig.DROPNA:
                    dropna = toBoolean(option);
                    break;
                default:
                    throw new InvalidArgumentException(format("unexpected grouping option '%s'", option.getKey()));
            }
        }
        if (null == keys || keys.isEmpty()) {
            throw new InvalidArgumentException("grouping options need at least one key column in 'by'");
        }
        return group(dataset, keys, sort, dropna);
    }

    private GroupedTable group(Table dataset, List<String> keys, boolean sort, boolean dropna) {
        List<Column> keyColumns = new ArrayList<>(keys.size());
        for (String key : keys) {
            keyColumns.add(dataset.getColumn(key));
        }

        Map<List<Comparable>, List<Integer>> groups = new LinkedHashMap<>();
        rows:
        for (int row = 0; row < dataset.size(); row++) {
            List<Comparable> key = new ArrayList<>(keyColumns.size());
            for (Column column : keyColumns) {
                Comparable value = column.get(row);
                if (null == value && dropna) {
                    continue rows;
                }
                key.add(value);
            }
            List<Integer> rowsOfGroup = groups.get(key);
            if (null == rowsOfGroup) {
                rowsOfGroup = new ArrayList<>();
                groups.put(Collections.unmodifiableList(key), rowsOfGroup);
            }
            rowsOfGroup.add(row);
        }

        if (sort) {
            List<List<Comparable>> sortedKeys = new ArrayList<>(groups.keySet());
            Collections.sort(sortedKeys, KEY_ORDER);
            Map<List<Comparable>, List<Integer>> sorted = new LinkedHashMap<>();
            for (List<Comparable> key : sortedKeys) {
                sorted.put(key, groups.get(key));
            }
            groups = sorted;
        }

        logger.debug("grouped {} rows by {} into {} groups", dataset.size(), keys, groups.size());
        return new GroupedTable(dataset, keys, groups, primitive);
    }

    private static List<String> toKeys(Object by) {
        if (by instanceof String) {
            return Collections.singletonList((String) by);
        }
        if (by instanceof String[]) {
            return Arrays.asList((String[]) by);
        }
        if (by instanceof Collection) {
            List<String> keys = new ArrayList<>();
            for (Object key : (Collection<?>) by) {
                if (!(key instanceof String)) {
                    throw new InvalidArgumentException(format("grouping key %s is not a column name", key));
                }
                keys.add((String) key);
            }
            return keys;
        }
        throw new InvalidArgumentException(format("grouping option 'by' must name columns, got %s", by));
    }

    private static boolean toBoolean(Map.Entry<String, Object> option) {
        if (!(option.getValue() instanceof Boolean)) {
            throw new InvalidArgumentException(format("grouping option '%s' must be a boolean, got %s",
                    option.getKey(), option.getValue()));
        }
        return (Boolean) option.getValue();
    }
}
