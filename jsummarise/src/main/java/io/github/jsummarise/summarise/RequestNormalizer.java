package io.github.jsummarise.summarise;

import io.github.jsummarise.agg.FunctionRef;
import io.github.jsummarise.agg.FunctionSpec;
import io.github.jsummarise.exception.InvalidArgumentException;
import io.github.jsummarise.function.AggregationFunction;
import io.github.jsummarise.function.ColumnFunction;
import io.github.jsummarise.selector.ColumnSelector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import static java.lang.String.format;

/**
 * Validates raw (column, function(s), name) tuples and turns them into {@link AggregationRequest}s,
 * before anything is aggregated.
 */
public class RequestNormalizer {
    public List<AggregationRequest> normalize(List<?> requests) {
        if (null == requests || requests.isEmpty()) {
            throw new InvalidArgumentException("at least one aggregation request is required");
        }
        List<AggregationRequest> normalized = new ArrayList<>(requests.size());
        for (int position = 0; position < requests.size(); position++) {
            normalized.add(normalize(position, toTuple(position, requests.get(position))));
        }
        return normalized;
    }

    private static Object[] toTuple(int position, Object raw) {
        if (raw instanceof Object[]) {
            return (Object[]) raw;
        }
        if (raw instanceof AggregationTuple) {
            return ((AggregationTuple) raw).toArray();
        }
        if (raw instanceof List) {
            return ((List<?>) raw).toArray();
        }
        throw new InvalidArgumentException(format("the aggregation request at position %d must be a tuple, got %s",
                position, null == raw ? "null" : raw.getClass().getName()));
    }

    private static AggregationRequest normalize(int position, Object[] tuple) {
        if (tuple.length < 2) {
            throw new InvalidArgumentException(format(
                    "the aggregation request at position %d must supply at least a column and a function", position));
        }
        if (tuple.length > 3) {
            throw new InvalidArgumentException(format(
                    "the aggregation request at position %d has %d elements, maximum three elements: column, function(s), name",
                    position, tuple.length));
        }

        ColumnSelector col;
        try {
            col = ColumnSelector.of(tuple[0]);
        } catch (InvalidArgumentException e) {
            throw new InvalidArgumentException(format("column in the aggregation request at position %d: %s",
                    position, e.getMessage()));
        }
        FunctionSpec func = toFunctionSpec(position, tuple[1]);
        String name = tuple.length == 3 ? toLabel(position, tuple[2]) : null;
        return new AggregationRequest(col, func, name);
    }

    private static FunctionSpec toFunctionSpec(int position, Object raw) {
        FunctionRef single = toFunctionRef(raw);
        if (null != single) {
            return FunctionSpec.of(single);
        }

        List<?> items;
        if (raw instanceof Object[]) {
            items = Arrays.asList((Object[]) raw);
        } else if (raw instanceof Collection) {
            items = new ArrayList<>((Collection<?>) raw);
        } else {
            throw new InvalidArgumentException(format(
                    "func in the aggregation request at position %d must be a function name, a callable or a list of them, got %s",
                    position, describe(raw)));
        }
        if (items.isEmpty()) {
            throw new InvalidArgumentException(format(
                    "func in the aggregation request at position %d is an empty list", position));
        }

        List<FunctionRef> functions = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            FunctionRef function = toFunctionRef(items.get(i));
            if (null == function) {
                throw new InvalidArgumentException(format(
                        "func in the aggregation request at position %d: element %d must be a function name or a callable, got %s",
                        position, i, describe(items.get(i))));
            }
            functions.add(function);
        }
        return FunctionSpec.of(functions);
    }

    /**
     * @return null if raw is no single function
     */
    private static FunctionRef toFunctionRef(Object raw) {
        if (raw instanceof String) {
            return FunctionRef.named((String) raw);
        }
        if (raw instanceof FunctionRef) {
            return (FunctionRef) raw;
        }
        if (raw instanceof ColumnFunction) {
            return FunctionRef.column((ColumnFunction) raw);
        }
        if (raw instanceof AggregationFunction) {
            return FunctionRef.rows((AggregationFunction) raw);
        }
        return null;
    }

    private static String toLabel(int position, Object raw) {
        if (null == raw) {
            return null;
        }
        if (raw instanceof String || raw instanceof Number || raw instanceof Boolean
                || raw instanceof Character || raw instanceof Enum) {
            return raw.toString();
        }
        throw new InvalidArgumentException(format(
                "name in the aggregation request at position %d must be a scalar label, got %s", position, describe(raw)));
    }

    private static String describe(Object raw) {
        return null == raw ? "null" : raw.getClass().getName();
    }
}
