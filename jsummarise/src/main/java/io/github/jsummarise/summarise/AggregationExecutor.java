package io.github.jsummarise.summarise;

import io.github.jsummarise.agg.AggregationPrimitive;
import io.github.jsummarise.agg.AggregationView;
import io.github.jsummarise.agg.FunctionRef;
import io.github.jsummarise.agg.FunctionSpec;
import io.github.jsummarise.agg.UngroupedView;
import io.github.jsummarise.exception.InvalidArgumentException;
import io.github.jsummarise.exception.UnsupportedFunctionException;
import io.github.jsummarise.group.GroupedTable;
import io.github.jsummarise.table.Column;
import io.github.jsummarise.table.Header;
import io.github.jsummarise.table.Index;
import io.github.jsummarise.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Runs one request against the dataset (or its groups) and produces its partial results.
 */
public class AggregationExecutor {
    private static final Logger logger = LoggerFactory.getLogger(AggregationExecutor.class);

    private final ColumnResolver columnResolver;
    private final AggregationPrimitive primitive;
    private final RenamePolicy renamePolicy;

    public AggregationExecutor(ColumnResolver columnResolver, AggregationPrimitive primitive, RenamePolicy renamePolicy) {
        this.columnResolver = requireNonNull(columnResolver);
        this.primitive = requireNonNull(primitive);
        this.renamePolicy = requireNonNull(renamePolicy);
    }

    /**
     * @param grouped   null to aggregate over all rows
     * @return          one partial result, or one per callable when the callables had to run one by one
     */
    public List<Table> execute(AggregationRequest request, Table dataset, GroupedTable grouped) {
        List<String> columns = columnResolver.resolve(request.col(), dataset);
        FunctionSpec spec = request.func();
        checkFunctions(spec);

        AggregationView view = null == grouped
                ? new UngroupedView(dataset.select(columns), primitive)
                : grouped.select(columns);

        if (spec.isDescribe()) {
            logger.debug("{}: describe {}", request, columns);
            return Collections.singletonList(rename(request, view.describe(), null == grouped, null));
        }
        if (primitive.supports(spec)) {
            logger.debug("{}: aggregate {} in one pass", request, columns);
            return Collections.singletonList(rename(request, view.aggregate(spec), null == grouped, null));
        }
        if (spec.allCallable()) {
            logger.debug("{}: apply {} callables to {} one by one", request, spec.size(), columns);
            if (spec.size() == 1) {
                return Collections.singletonList(rename(request, view.apply(spec.get(0)), false, spec.get(0)));
            }
            return renameEach(request, view, spec);
        }
        throw unsupported(spec);
    }

    private void checkFunctions(FunctionSpec spec) {
        if (spec.containsDescribe() && spec.size() > 1) {
            throw new InvalidArgumentException(format(
                    "describe cannot be combined with other functions %s, pass it as the single function of a separate request", spec));
        }
        if (new HashSet<>(spec.labels()).size() != spec.size()) {
            throw new InvalidArgumentException(format("function labels must be unique within a request: %s", spec.labels()));
        }
    }

    private UnsupportedFunctionException unsupported(FunctionSpec spec) {
        List<FunctionRef> unknown = new ArrayList<>();
        List<FunctionRef> named = new ArrayList<>();
        List<FunctionRef> callables = new ArrayList<>();
        for (FunctionRef function : spec) {
            if (function.isCallable()) {
                callables.add(function);
            } else if (!primitive.supports(function)) {
                unknown.add(function);
            } else {
                named.add(function);
            }
        }
        if (!unknown.isEmpty()) {
            return new UnsupportedFunctionException(format("unsupported aggregation function(s) %s", unknown));
        }
        return new UnsupportedFunctionException(format(
                "named functions %s cannot be applied together with callables %s", named, callables));
    }

    private List<Table> renameEach(AggregationRequest request, AggregationView view, FunctionSpec spec) {
        List<Table> outputs = new ArrayList<>(spec.size());
        for (FunctionRef function : spec) {
            Table out = view.apply(function);
            if (request.isNameTemplate()) {
                out = rename(request, out, false, function);
            }
            outputs.add(out);
        }
        if (request.hasName() && !request.isNameTemplate()) {
            multiColumnRename(request, outputs.size() + " separate results");
        }
        return outputs;
    }

    /**
     * @param rowsAreFunctions  whether the rows of out are labelled by function (ungrouped one pass aggregation)
     * @param function          the callable that produced out, null for one pass results
     */
    private Table rename(AggregationRequest request, Table out, boolean rowsAreFunctions, FunctionRef function) {
        if (!request.hasName()) {
            return out;
        }
        if (request.isNameTemplate()) {
            return rowsAreFunctions ? expandWide(request, out) : expandLabels(request, out, function);
        }
        if (out.columnCount() == 1) {
            return out.withHeader(Header.of(Collections.singletonList(request.name())));
        }
        multiColumnRename(request, out.columnCount() + " columns");
        return out;
    }

    private void multiColumnRename(AggregationRequest request, String what) {
        if (RenamePolicy.FAIL == renamePolicy) {
            throw new InvalidArgumentException(format(
                    "name '%s' needs a single result column but %s produced %s", request.name(), request, what));
        }
        logger.warn("name '{}' ignored: {} produced {}", request.name(), request, what);
    }

    private static Table expandLabels(AggregationRequest request, Table out, FunctionRef function) {
        Header header = out.getHeader();
        List<String> labels = new ArrayList<>(header.width());
        for (int i = 0; i < header.width(); i++) {
            String fn = header.depth() > 1 ? header.level(1).get(i) : (null == function ? "" : function.label());
            labels.add(request.expandName(header.level(0).get(i), fn));
        }
        return out.withHeader(Header.of(labels));
    }

    /**
     * one row with a column per (column, function) pair, the row labels of out being function names
     */
    private static Table expandWide(AggregationRequest request, Table out) {
        List<String> labels = new ArrayList<>(out.columnCount() * out.size());
        List<Column> columns = new ArrayList<>(out.columnCount() * out.size());
        for (int i = 0; i < out.columnCount(); i++) {
            String col = out.getHeader().level(0).get(i);
            for (int row = 0; row < out.size(); row++) {
                String label = request.expandName(col, String.valueOf(out.getRowIndex().key(row).get(0)));
                labels.add(label);
                columns.add(Column.of(label, Collections.singletonList(out.getColumn(i).get(row))));
            }
        }
        return new Table(Header.of(labels), Index.range(1), columns);
    }
}
