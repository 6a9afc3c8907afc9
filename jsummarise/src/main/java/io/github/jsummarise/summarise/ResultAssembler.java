package io.github.jsummarise.summarise;

import io.github.jsummarise.table.Column;
import io.github.jsummarise.table.Header;
import io.github.jsummarise.table.Index;
import io.github.jsummarise.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges partial results into one table. Headers of different depths are first padded with empty labels to the
 * deepest one. Grouped partials are placed side by side with rows aligned on their group keys; ungrouped
 * partials are stacked with columns aligned on their labels.
 */
public class ResultAssembler {
    private static final Logger logger = LoggerFactory.getLogger(ResultAssembler.class);

    public Table assemble(List<Table> partials, boolean grouped) {
        if (partials.isEmpty()) {
            throw new IllegalStateException("nothing to assemble");
        }
        if (partials.size() == 1) {
            return partials.get(0);
        }

        List<Table> aligned = alignDepths(partials);
        return grouped ? concatColumns(aligned) : concatRows(aligned);
    }

    static List<Table> alignDepths(List<Table> partials) {
        int minDepth = Integer.MAX_VALUE;
        int maxDepth = 0;
        for (Table partial : partials) {
            minDepth = Math.min(minDepth, partial.getHeader().depth());
            maxDepth = Math.max(maxDepth, partial.getHeader().depth());
        }
        if (minDepth == maxDepth) {
            return partials;
        }

        logger.debug("padding headers of {} partial results to depth {}", partials.size(), maxDepth);
        List<Table> padded = new ArrayList<>(partials.size());
        for (Table partial : partials) {
            padded.add(partial.withHeader(partial.getHeader().pad(maxDepth)));
        }
        return padded;
    }

    private static Table concatColumns(List<Table> partials) {
        int depth = partials.get(0).getHeader().depth();

        // rows in the order of the first partial, keys it lacks appended as they show up
        LinkedHashMap<List<Comparable>, Integer> keys = new LinkedHashMap<>();
        for (Table partial : partials) {
            for (List<Comparable> key : partial.getRowIndex().keys()) {
                if (!keys.containsKey(key)) {
                    keys.put(key, keys.size());
                }
            }
        }

        List<List<String>> labels = new ArrayList<>();
        List<Column> columns = new ArrayList<>();
        for (Table partial : partials) {
            Map<List<Comparable>, Integer> rowOfKey = new HashMap<>();
            for (int row = 0; row < partial.size(); row++) {
                if (!rowOfKey.containsKey(partial.getRowIndex().key(row))) {
                    rowOfKey.put(partial.getRowIndex().key(row), row);
                }
            }
            for (int i = 0; i < partial.columnCount(); i++) {
                Column column = partial.getColumn(i);
                List<Comparable> values = new ArrayList<>(keys.size());
                for (List<Comparable> key : keys.keySet()) {
                    Integer row = rowOfKey.get(key);
                    values.add(null == row ? null : (Comparable) column.get(row));
                }
                labels.add(partial.getHeader().label(i));
                columns.add(Column.of(partial.getHeader().level(0).get(i), values));
            }
        }

        Index index = Index.of(partials.get(0).getRowIndex().names(), new ArrayList<>(keys.keySet()));
        return new Table(Header.ofTuples(labels, depth), index, columns);
    }

    private static Table concatRows(List<Table> partials) {
        int depth = partials.get(0).getHeader().depth();

        // a label seen n times in one partial takes the first n slots carrying that label
        LinkedHashMap<List<Object>, Integer> slots = new LinkedHashMap<>();
        List<List<String>> labels = new ArrayList<>();
        List<int[]> slotOfColumn = new ArrayList<>(partials.size());
        for (Table partial : partials) {
            Map<List<String>, Integer> seen = new HashMap<>();
            int[] slotOf = new int[partial.columnCount()];
            for (int i = 0; i < partial.columnCount(); i++) {
                List<String> label = partial.getHeader().label(i);
                int occurrence = seen.merge(label, 1, Integer::sum);
                List<Object> slotKey = Arrays.<Object>asList(label, occurrence);
                Integer slot = slots.get(slotKey);
                if (null == slot) {
                    slot = slots.size();
                    slots.put(slotKey, slot);
                    labels.add(label);
                }
                slotOf[i] = slot;
            }
            slotOfColumn.add(slotOf);
        }

        int rows = 0;
        for (Table partial : partials) {
            rows += partial.size();
        }
        List<List<Comparable>> values = new ArrayList<>(labels.size());
        for (int slot = 0; slot < labels.size(); slot++) {
            values.add(new ArrayList<Comparable>(rows));
        }
        List<List<Comparable>> keys = new ArrayList<>(rows);
        for (int p = 0; p < partials.size(); p++) {
            Table partial = partials.get(p);
            int[] slotOf = slotOfColumn.get(p);
            Comparable[][] cells = new Comparable[labels.size()][];
            for (int i = 0; i < partial.columnCount(); i++) {
                cells[slotOf[i]] = (Comparable[]) partial.getColumn(i).values().toArray(new Comparable[0]);
            }
            for (int row = 0; row < partial.size(); row++) {
                for (int slot = 0; slot < labels.size(); slot++) {
                    values.get(slot).add(null == cells[slot] ? null : cells[slot][row]);
                }
                keys.add(partial.getRowIndex().key(row));
            }
        }

        List<Column> columns = new ArrayList<>(labels.size());
        for (int slot = 0; slot < labels.size(); slot++) {
            columns.add(Column.of(labels.get(slot).get(0), values.get(slot)));
        }
        return new Table(Header.ofTuples(labels, depth), Index.of(commonIndexNames(partials), keys), columns);
    }

    private static List<String> commonIndexNames(List<Table> partials) {
        List<String> names = partials.get(0).getRowIndex().names();
        for (Table partial : partials) {
            if (!partial.getRowIndex().names().equals(names)) {
                return new ArrayList<>();
            }
        }
        return names;
    }
}
