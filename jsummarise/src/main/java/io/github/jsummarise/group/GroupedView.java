package io.github.jsummarise.group;

import io.github.jsummarise.agg.AggregationPrimitive;
import io.github.jsummarise.agg.AggregationView;
import io.github.jsummarise.agg.FunctionRef;
import io.github.jsummarise.agg.FunctionSpec;
import io.github.jsummarise.table.Column;
import io.github.jsummarise.table.Header;
import io.github.jsummarise.table.Table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Selected columns of a grouped table. Results have one row per group; path A results are labelled by
 * (column, function) pairs.
 */
public class GroupedView implements AggregationView {
    private final GroupedTable grouped;
    private final Table view;
    private final AggregationPrimitive primitive;

    GroupedView(GroupedTable grouped, Table view, AggregationPrimitive primitive) {
        this.grouped = grouped;
        this.view = view;
        this.primitive = primitive;
    }

    @Override
    public List<String> getColumnNames() {
        return view.getColumnNames();
    }

    @Override
    public Table aggregate(FunctionSpec spec) {
        List<String> names = view.getColumnNames();
        List<List<String>> labels = new ArrayList<>(names.size() * spec.size());
        List<Column> columns = new ArrayList<>(names.size() * spec.size());
        for (int i = 0; i < names.size(); i++) {
            Column column = view.getColumn(i);
            for (FunctionRef function : spec) {
                List<Comparable> reduced = new ArrayList<>(grouped.groupCount());
                for (int group = 0; group < grouped.groupCount(); group++) {
                    reduced.add(primitive.reduce(function, column.values(grouped.getRows(group))));
                }
                labels.add(Arrays.asList(names.get(i), function.label()));
                columns.add(Column.of(names.get(i), reduced));
            }
        }
        return new Table(Header.ofTuples(labels, 2), grouped.toIndex(), columns);
    }

    @Override
    public Table describe() {
        List<String> names = view.getColumnNames();
        List<List<String>> labels = new ArrayList<>();
        List<Column> columns = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            Column column = view.getColumn(i);
            boolean numeric = column.isNumeric();
            List<String> statistics = primitive.describeStatistics(numeric);
            List<Map<String, Comparable>> perGroup = new ArrayList<>(grouped.groupCount());
            for (int group = 0; group < grouped.groupCount(); group++) {
                perGroup.add(primitive.describe(column.values(grouped.getRows(group)), numeric));
            }
            for (String statistic : statistics) {
                List<Comparable> values = new ArrayList<>(perGroup.size());
                for (Map<String, Comparable> stats : perGroup) {
                    values.add(stats.get(statistic));
                }
                labels.add(Arrays.asList(names.get(i), statistic));
                columns.add(Column.of(names.get(i), values));
            }
        }
        return new Table(Header.ofTuples(labels, 2), grouped.toIndex(), columns);
    }

    @Override
    public Table apply(FunctionRef function) {
        switch (function.kind()) {
            case NAMED:
            case COLUMN:
                return function.isDescribe() ? describe() : aggregate(FunctionSpec.of(function));
            case ROWS:
                List<String> outputColumns = function.outputColumns();
                List<List<Comparable>> outputs = new ArrayList<>(outputColumns.size());
                for (int i = 0; i < outputColumns.size(); i++) {
                    outputs.add(new ArrayList<Comparable>(grouped.groupCount()));
                }
                for (int group = 0; group < grouped.groupCount(); group++) {
                    Comparable[] out = function.aggregationFunction().agg(grouped.getKey(group), view.getRows(grouped.getRows(group)));
                    function.checkRowSize(out);
                    for (int i = 0; i < out.length; i++) {
                        outputs.get(i).add(out[i]);
                    }
                }
                List<Column> columns = new ArrayList<>(outputColumns.size());
                for (int i = 0; i < outputColumns.size(); i++) {
                    columns.add(Column.of(outputColumns.get(i), outputs.get(i)));
                }
                return new Table(Header.of(outputColumns), grouped.toIndex(), columns);
            default:
                throw new IllegalStateException(function.kind().name());
        }
    }
}
