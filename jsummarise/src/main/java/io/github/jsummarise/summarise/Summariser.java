package io.github.jsummarise.summarise;

import io.github.jsummarise.agg.AggregationPrimitive;
import io.github.jsummarise.agg.BuiltinAggregationPrimitive;
import io.github.jsummarise.group.GroupedTable;
import io.github.jsummarise.group.Grouping;
import io.github.jsummarise.group.HashGrouping;
import io.github.jsummarise.selector.PatternSelectorResolver;
import io.github.jsummarise.selector.SelectorResolver;
import io.github.jsummarise.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies a batch of aggregation requests to a dataset, optionally grouped, and merges their results into
 * one table.
 *
 * <p>Each request is a tuple {@code (column selector, function(s)[, name])}:
 * <ul>
 *     <li>the selector is a column name, a glob such as {@code "avg_*"}, a {@link io.github.jsummarise.selector.ColumnSelector}
 *     or a list of those;</li>
 *     <li>functions are built-in names ({@code "mean"}, {@code "sum"}, ..., {@code "describe"}), callables, or a list of them;</li>
 *     <li>the name relabels a single result column, or every result column when it contains the
 *     {@code {_col}} / {@code {_fn}} placeholders.</li>
 * </ul>
 * Requests run in order and the whole batch fails on the first failing request.
 */
public class Summariser {
    private static final Logger logger = LoggerFactory.getLogger(Summariser.class);

    private final RequestNormalizer normalizer;
    private final GroupingResolver groupingResolver;
    private final AggregationExecutor executor;
    private final ResultAssembler assembler;

    public Summariser() {
        this(SummariseConfig.fromEnv());
    }

    public Summariser(SummariseConfig config) {
        this(config, new PatternSelectorResolver(), new BuiltinAggregationPrimitive());
    }

    public Summariser(SummariseConfig config, SelectorResolver selectorResolver, AggregationPrimitive primitive) {
        this(config, selectorResolver, primitive, new HashGrouping(primitive, config.isGroupSort(), config.isGroupDropna()));
    }

    public Summariser(SummariseConfig config, SelectorResolver selectorResolver, AggregationPrimitive primitive, Grouping grouping) {
        ColumnResolver columnResolver = new ColumnResolver(selectorResolver);
        this.normalizer = new RequestNormalizer();
        this.groupingResolver = new GroupingResolver(columnResolver, grouping);
        this.executor = new AggregationExecutor(columnResolver, primitive, config.getRenamePolicy());
        this.assembler = new ResultAssembler();
    }

    public Table summarise(Table dataset, List<?> requests) {
        return summarise(dataset, requests, null);
    }

    /**
     * @param requests  tuples as Object[], List or {@link AggregationTuple}
     * @param by        null for no grouping, a selector of key columns, or a {@link io.github.jsummarise.group.GroupingConfig}
     */
    public Table summarise(Table dataset, List<?> requests, Object by) {
        List<AggregationRequest> normalized = normalizer.normalize(requests);
        GroupedTable grouped = groupingResolver.resolve(dataset, by);

        List<Table> partials = new ArrayList<>(normalized.size());
        for (AggregationRequest request : normalized) {
            partials.addAll(executor.execute(request, dataset, grouped));
        }
        Table result = assembler.assemble(partials, null != grouped);
        logger.debug("summarised {} requests into {} partial results, {} rows x {} columns",
                normalized.size(), partials.size(), result.size(), result.columnCount());
        return result;
    }
}
