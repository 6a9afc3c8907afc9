package io.github.jsummarise.agg;

import io.github.jsummarise.table.Column;
import io.github.jsummarise.table.Header;
import io.github.jsummarise.table.Index;
import io.github.jsummarise.table.Table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Aggregates over all rows. Results have one row per function (or per statistic) and one column per
 * selected column.
 */
public class UngroupedView implements AggregationView {
    private final Table view;
    private final AggregationPrimitive primitive;

    public UngroupedView(Table view, AggregationPrimitive primitive) {
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
        List<Column> columns = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            List<Comparable> values = view.getColumn(i).values();
            List<Comparable> reduced = new ArrayList<>(spec.size());
            for (FunctionRef function : spec) {
                reduced.add(primitive.reduce(function, values));
            }
            columns.add(Column.of(names.get(i), reduced));
        }
        return new Table(Header.of(names), Index.labels(spec.labels()), columns);
    }

    @Override
    public Table describe() {
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < view.columnCount(); i++) {
            if (view.getColumn(i).isNumeric()) {
                kept.add(i);
            }
        }
        // numeric columns only, unless there are none
        boolean numeric = !kept.isEmpty();
        if (!numeric) {
            for (int i = 0; i < view.columnCount(); i++) {
                kept.add(i);
            }
        }

        List<String> statistics = primitive.describeStatistics(numeric);
        List<String> names = new ArrayList<>(kept.size());
        List<Column> columns = new ArrayList<>(kept.size());
        for (int i : kept) {
            String name = view.getColumnNames().get(i);
            Map<String, Comparable> stats = primitive.describe(view.getColumn(i).values(), numeric);
            List<Comparable> values = new ArrayList<>(statistics.size());
            for (String statistic : statistics) {
                values.add(stats.get(statistic));
            }
            names.add(name);
            columns.add(Column.of(name, values));
        }
        return new Table(Header.of(names), Index.labels(statistics), columns);
    }

    @Override
    public Table apply(FunctionRef function) {
        switch (function.kind()) {
            case NAMED:
            case COLUMN:
                return function.isDescribe() ? describe() : aggregate(FunctionSpec.of(function));
            case ROWS:
                List<Integer> all = new ArrayList<>(view.size());
                for (int i = 0; i < view.size(); i++) {
                    all.add(i);
                }
                Comparable[] out = function.aggregationFunction().agg(Collections.<Comparable>emptyList(), view.getRows(all));
                List<String> outputColumns = function.outputColumns();
                function.checkRowSize(out);
                List<Column> columns = new ArrayList<>(outputColumns.size());
                for (int i = 0; i < outputColumns.size(); i++) {
                    columns.add(Column.of(outputColumns.get(i), Collections.singletonList(out[i])));
                }
                return new Table(Header.of(outputColumns), Index.labels(Collections.singletonList(function.label())), columns);
            default:
                throw new IllegalStateException(function.kind().name());
        }
    }
}
