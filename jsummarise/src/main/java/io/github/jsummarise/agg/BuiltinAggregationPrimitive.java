package io.github.jsummarise.agg;

import com.google.common.collect.ImmutableList;
import com.google.common.math.Quantiles;
import com.google.common.math.Stats;
import io.github.jsummarise.exception.UnsupportedFunctionException;
import io.github.jsummarise.function.ColumnFunction;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;

public class BuiltinAggregationPrimitive implements AggregationPrimitive {
    static final List<String> NUMERIC_STATISTICS = ImmutableList.of("count", "mean", "std", "min", "25%", "50%", "75%", "max");
    static final List<String> OBJECT_STATISTICS = ImmutableList.of("count", "unique", "top", "freq");

    @Override
    public boolean supports(FunctionRef function) {
        switch (function.kind()) {
            case NAMED:
                return function.isDescribe() || Builtins.FUNCTIONS.containsKey(function.label());
            case COLUMN:
                return true;
            case ROWS:
                return false;
            default:
                throw new IllegalStateException(function.kind().name());
        }
    }

    @Override
    public Comparable reduce(FunctionRef function, List<Comparable> values) {
        switch (function.kind()) {
            case NAMED:
                ColumnFunction builtin = Builtins.FUNCTIONS.get(function.label());
                if (null == builtin) {
                    throw new UnsupportedFunctionException(format("unsupported aggregation function %s", function));
                }
                return builtin.apply(values);
            case COLUMN:
                return function.columnFunction().apply(values);
            case ROWS:
                throw new UnsupportedFunctionException(format("%s needs whole rows and cannot reduce a column", function));
            default:
                throw new IllegalStateException(function.kind().name());
        }
    }

    @Override
    public List<String> describeStatistics(boolean numeric) {
        return numeric ? NUMERIC_STATISTICS : OBJECT_STATISTICS;
    }

    @Override
    public Map<String, Comparable> describe(List<Comparable> values, boolean numeric) {
        return numeric ? describeNumeric(values) : describeObject(values);
    }

    private static Map<String, Comparable> describeNumeric(List<Comparable> values) {
        List<Double> doubles = Builtins.doubles(values);
        Map<String, Comparable> stats = new LinkedHashMap<>();
        stats.put("count", (long) doubles.size());
        if (doubles.isEmpty()) {
            for (String statistic : NUMERIC_STATISTICS.subList(1, NUMERIC_STATISTICS.size())) {
                stats.put(statistic, null);
            }
            return stats;
        }
        Stats summary = Stats.of(doubles);
        Map<Integer, Double> quartiles = Quantiles.percentiles().indexes(25, 50, 75).compute(doubles);
        stats.put("mean", summary.mean());
        stats.put("std", doubles.size() < 2 ? null : summary.sampleStandardDeviation());
        stats.put("min", summary.min());
        stats.put("25%", quartiles.get(25));
        stats.put("50%", quartiles.get(50));
        stats.put("75%", quartiles.get(75));
        stats.put("max", summary.max());
        return stats;
    }

    private static Map<String, Comparable> describeObject(List<Comparable> values) {
        List<Comparable> present = Builtins.nonNull(values);
        Map<Comparable, Long> frequencies = new HashMap<>();
        Comparable top = null;
        long freq = 0;
        for (Comparable value : present) {
            long count = frequencies.merge(value, 1L, Long::sum);
            // first value to reach the highest count wins ties
            if (count > freq) {
                top = value;
                freq = count;
            }
        }
        Map<String, Comparable> stats = new LinkedHashMap<>();
        stats.put("count", (long) present.size());
        stats.put("unique", (long) frequencies.size());
        stats.put("top", top);
        stats.put("freq", present.isEmpty() ? null : freq);
        return stats;
    }
}
