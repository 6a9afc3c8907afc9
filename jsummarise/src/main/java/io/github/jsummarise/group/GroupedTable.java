package io.github.jsummarise.group;

import io.github.jsummarise.agg.AggregationPrimitive;
import io.github.jsummarise.table.Index;
import io.github.jsummarise.table.Table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A dataset bound to one partition of its rows. Every selection made from it sees the same groups in the
 * same order.
 */
public class GroupedTable {
    private final Table dataset;
    private final List<String> keyNames;
    private final List<List<Comparable>> keys;
    private final List<List<Integer>> rows;
    private final AggregationPrimitive primitive;

    GroupedTable(Table dataset, List<String> keyNames, Map<List<Comparable>, List<Integer>> groups, AggregationPrimitive primitive) {
        this.dataset = dataset;
        this.keyNames = Collections.unmodifiableList(new ArrayList<>(keyNames));
        this.keys = new ArrayList<>(groups.size());
        this.rows = new ArrayList<>(groups.size());
        for (Map.Entry<List<Comparable>, List<Integer>> entry : groups.entrySet()) {
            keys.add(entry.getKey());
            rows.add(Collections.unmodifiableList(entry.getValue()));
        }
        this.primitive = primitive;
    }

    public GroupedView select(List<String> columnNames) {
        return new GroupedView(this, dataset.select(columnNames), primitive);
    }

    public Table getDataset() {
        return dataset;
    }

    public List<String> getKeyNames() {
        return keyNames;
    }

    public int groupCount() {
        return keys.size();
    }

    public List<Comparable> getKey(int group) {
        return keys.get(group);
    }

    public List<Integer> getRows(int group) {
        return rows.get(group);
    }

    /**
     * row index of grouped results: one row per group, named after the key columns
     */
    public Index toIndex() {
        return Index.of(keyNames, keys);
    }
}
