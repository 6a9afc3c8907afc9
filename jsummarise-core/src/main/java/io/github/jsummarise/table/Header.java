package io.github.jsummarise.table;

import com.google.common.base.Joiner;
import io.github.jsummarise.exception.IllegalSizeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.lang.String.format;

/**
 * Column labels of a table as an ordered list of levels, each level holding one label per column.
 * A flat header has depth 1; a header of (column, function) pairs has depth 2.
 */
public final class Header {
    public static final String EMPTY_LABEL = "";

    private final List<List<String>> levels;
    private final int width;

    private Header(List<List<String>> levels, int width) {
        this.levels = levels;
        this.width = width;
    }

    public static Header of(List<String> labels) {
        List<List<String>> levels = new ArrayList<>(1);
        levels.add(Collections.unmodifiableList(new ArrayList<>(labels)));
        return new Header(Collections.unmodifiableList(levels), labels.size());
    }

    public static Header ofLevels(List<List<String>> levels) {
        if (levels.isEmpty()) {
            throw new IllegalSizeException("a header needs at least one level");
        }
        int width = levels.get(0).size();
        List<List<String>> copy = new ArrayList<>(levels.size());
        for (List<String> level : levels) {
            if (level.size() != width) {
                throw new IllegalSizeException(format("header level of width %d, expected %d", level.size(), width));
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(level)));
        }
        return new Header(Collections.unmodifiableList(copy), width);
    }

    /**
     * @param tuples    one label tuple per column, all of the same length
     * @param depth     tuple length, needed when there are no columns
     */
    public static Header ofTuples(List<List<String>> tuples, int depth) {
        List<List<String>> levels = new ArrayList<>(depth);
        for (int level = 0; level < depth; level++) {
            List<String> labels = new ArrayList<>(tuples.size());
            for (List<String> tuple : tuples) {
                if (tuple.size() != depth) {
                    throw new IllegalSizeException(format("label %s has %d levels, expected %d", tuple, tuple.size(), depth));
                }
                labels.add(tuple.get(level));
            }
            levels.add(labels);
        }
        return ofLevels(levels);
    }

    public int depth() {
        return levels.size();
    }

    public int width() {
        return width;
    }

    public List<String> level(int level) {
        return levels.get(level);
    }

    public List<List<String>> levels() {
        return levels;
    }

    public List<String> label(int column) {
        List<String> label = new ArrayList<>(levels.size());
        for (List<String> level : levels) {
            label.add(level.get(column));
        }
        return label;
    }

    public List<List<String>> labels() {
        List<List<String>> labels = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            labels.add(label(i));
        }
        return labels;
    }

    /**
     * appends levels of empty labels until the header reaches the given depth
     */
    public Header pad(int depth) {
        if (depth <= levels.size()) {
            return this;
        }
        List<List<String>> padded = new ArrayList<>(levels);
        List<String> empty = Collections.nCopies(width, EMPTY_LABEL);
        while (padded.size() < depth) {
            padded.add(empty);
        }
        return ofLevels(padded);
    }

    public Header select(List<Integer> columns) {
        List<List<String>> selected = new ArrayList<>(levels.size());
        for (List<String> level : levels) {
            List<String> labels = new ArrayList<>(columns.size());
            for (int column : columns) {
                labels.add(level.get(column));
            }
            selected.add(labels);
        }
        return ofLevels(selected);
    }

    /**
     * label of a column as one string, empty levels skipped
     */
    public String flatLabel(int column) {
        List<String> parts = new ArrayList<>(levels.size());
        for (String label : label(column)) {
            if (!EMPTY_LABEL.equals(label)) {
                parts.add(label);
            }
        }
        return Joiner.on('_').join(parts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Header)) {
            return false;
        }
        Header header = (Header) o;
        return width == header.width && levels.equals(header.levels);
    }

    @Override
    public int hashCode() {
        return levels.hashCode();
    }

    @Override
    public String toString() {
        return levels.toString();
    }
}
