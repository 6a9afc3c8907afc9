package io.github.jsummarise.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Row labels of a table. Grouped results are labelled by their group key, named after the key columns;
 * a positional index has no names and labels its rows 0..n-1.
 */
public final class Index {
    private final List<String> names;
    private final List<List<Comparable>> keys;

    private Index(List<String> names, List<List<Comparable>> keys) {
        this.names = names;
        this.keys = keys;
    }

    public static Index of(List<String> names, List<List<Comparable>> keys) {
        List<List<Comparable>> copy = new ArrayList<>(keys.size());
        for (List<Comparable> key : keys) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(key)));
        }
        return new Index(Collections.unmodifiableList(new ArrayList<>(names)), Collections.unmodifiableList(copy));
    }

    public static Index range(int size) {
        List<List<Comparable>> keys = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            keys.add(Collections.<Comparable>singletonList(i));
        }
        return new Index(Collections.<String>emptyList(), Collections.unmodifiableList(keys));
    }

    /**
     * unnamed single level index, e.g. the function names labelling the rows of an ungrouped aggregation
     */
    public static Index labels(List<? extends Comparable> labels) {
        List<List<Comparable>> keys = new ArrayList<>(labels.size());
        for (Comparable label : labels) {
            keys.add(Collections.singletonList(label));
        }
        return new Index(Collections.<String>emptyList(), Collections.unmodifiableList(keys));
    }

    public List<String> names() {
        return names;
    }

    public List<List<Comparable>> keys() {
        return keys;
    }

    public List<Comparable> key(int row) {
        return keys.get(row);
    }

    public int size() {
        return keys.size();
    }

    public Index take(List<Integer> rows) {
        List<List<Comparable>> taken = new ArrayList<>(rows.size());
        for (int row : rows) {
            taken.add(keys.get(row));
        }
        return new Index(names, Collections.unmodifiableList(taken));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Index)) {
            return false;
        }
        Index index = (Index) o;
        return names.equals(index.names) && keys.equals(index.keys);
    }

    @Override
    public int hashCode() {
        return 31 * names.hashCode() + keys.hashCode();
    }

    @Override
    public String toString() {
        return names + keys.toString();
    }
}
