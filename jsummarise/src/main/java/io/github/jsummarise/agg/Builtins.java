package io.github.jsummarise.agg;

import com.google.common.collect.ImmutableMap;
import com.google.common.math.Quantiles;
import com.google.common.math.Stats;
import io.github.jsummarise.function.ColumnFunction;
import io.github.jsummarise.util.ScalarUtil;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Built-in column reducers, known by name. Nulls are skipped by everything but size.
 */
final class Builtins {
    static final Map<String, ColumnFunction> FUNCTIONS = ImmutableMap.<String, ColumnFunction>builder()
            .put("sum", Builtins::sum)
            .put("prod", Builtins::prod)
            .put("mean", Builtins::mean)
            .put("median", Builtins::median)
            .put("min", Builtins::min)
            .put("max", Builtins::max)
            .put("count", values -> (long) nonNull(values).size())
            .put("size", values -> (long) values.size())
            .put("nunique", values -> (long) new HashSet<>(nonNull(values)).size())
            .put("first", Builtins::first)
            .put("last", Builtins::last)
            .put("std", Builtins::std)
            .put("var", Builtins::var)
            .build();

    private Builtins() {
    }

    static List<Comparable> nonNull(List<Comparable> values) {
        List<Comparable> ret = new ArrayList<>(values.size());
        for (Comparable value : values) {
            if (null != value) {
                ret.add(value);
            }
        }
        return ret;
    }

    static List<Double> doubles(List<Comparable> values) {
        List<Double> ret = new ArrayList<>(values.size());
        for (Comparable value : values) {
            if (null != value) {
                ret.add(ScalarUtil.toDoubleValue(value));
            }
        }
        return ret;
    }

    private static boolean allIntegral(List<Comparable> values) {
        for (Comparable value : values) {
            if (!ScalarUtil.isIntegral(value)) {
                return false;
            }
        }
        return true;
    }

    private static boolean allBigDecimal(List<Comparable> values) {
        for (Comparable value : values) {
            if (!(value instanceof BigDecimal)) {
                return false;
            }
        }
        return !values.isEmpty();
    }

    static Comparable sum(List<Comparable> values) {
        List<Comparable> present = nonNull(values);
        if (allIntegral(present)) {
            long sum = 0;
            for (Comparable value : present) {
                sum += ((Number) value).longValue();
            }
            return sum;
        }
        if (allBigDecimal(present)) {
            BigDecimal sum = BigDecimal.ZERO;
            for (Comparable value : present) {
                sum = sum.add((BigDecimal) value);
            }
            return sum;
        }
        double sum = 0;
        for (double value : doubles(present)) {
            sum += value;
        }
        return sum;
    }

    static Comparable prod(List<Comparable> values) {
        List<Comparable> present = nonNull(values);
        if (allIntegral(present)) {
            long prod = 1;
            for (Comparable value : present) {
                prod *= ((Number) value).longValue();
            }
            return prod;
        }
        double prod = 1;
        for (double value : doubles(present)) {
            prod *= value;
        }
        return prod;
    }

    static Comparable mean(List<Comparable> values) {
        List<Double> doubles = doubles(values);
        return doubles.isEmpty() ? null : Stats.meanOf(doubles);
    }

    static Comparable median(List<Comparable> values) {
        List<Double> doubles = doubles(values);
        return doubles.isEmpty() ? null : Quantiles.median().compute(doubles);
    }

    static Comparable std(List<Comparable> values) {
        List<Double> doubles = doubles(values);
        return doubles.size() < 2 ? null : Stats.of(doubles).sampleStandardDeviation();
    }

    static Comparable var(List<Comparable> values) {
        List<Double> doubles = doubles(values);
        return doubles.size() < 2 ? null : Stats.of(doubles).sampleVariance();
    }

    static Comparable min(List<Comparable> values) {
        Comparable min = null;
        for (Comparable value : nonNull(values)) {
            if (null == min || ScalarUtil.compare(value, min) < 0) {
                min = value;
            }
        }
        return min;
    }

    static Comparable max(List<Comparable> values) {
        Comparable max = null;
        for (Comparable value : nonNull(values)) {
            if (null == max || ScalarUtil.compare(value, max) > 0) {
                max = value;
            }
        }
        return max;
    }

    static Comparable first(List<Comparable> values) {
        for (Comparable value : values) {
            if (null != value) {
                return value;
            }
        }
        return null;
    }

    static Comparable last(List<Comparable> values) {
        for (int i = values.size() - 1; i >= 0; i--) {
            if (null != values.get(i)) {
                return values.get(i);
            }
        }
        return null;
    }
}
