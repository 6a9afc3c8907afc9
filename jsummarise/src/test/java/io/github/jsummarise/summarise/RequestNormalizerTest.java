package io.github.jsummarise.summarise;

import io.github.jsummarise.agg.FunctionRef;
import io.github.jsummarise.exception.InvalidArgumentException;
import io.github.jsummarise.function.ColumnFunction;
import io.github.jsummarise.selector.ColumnSelector;
import io.github.jsummarise.table.Type;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class RequestNormalizerTest {
    private final RequestNormalizer normalizer = new RequestNormalizer();

    private static String failure(List<?> requests) {
        try {
            new RequestNormalizer().normalize(requests);
        } catch (InvalidArgumentException e) {
            return e.getMessage();
        }
        throw new AssertionError("normalize accepted " + requests);
    }

    @Test
    public void keepsOrder() {
        List<AggregationRequest> requests = normalizer.normalize(Arrays.asList(
                new Object[]{"run", "mean"},
                Arrays.asList("jump", Arrays.asList("min", "max"), "jump_range"),
                Summarise.col(Type.INT).agg("sum")));
        assert requests.size() == 3;
        assert requests.get(0).col().name().equals("run");
        assert requests.get(0).func().labels().equals(Collections.singletonList("mean"));
        assert !requests.get(0).hasName();
        assert requests.get(1).func().labels().equals(Arrays.asList("min", "max"));
        assert requests.get(1).name().equals("jump_range");
        assert requests.get(2).col().kind() == ColumnSelector.Kind.TYPE;
    }

    @Test
    public void callables() {
        ColumnFunction size = new ColumnFunction() {
            @Override
            public Comparable apply(List<Comparable> values) {
                return values.size();
            }
        };
        List<AggregationRequest> requests = normalizer.normalize(Collections.singletonList(
                new Object[]{"run", new Object[]{"mean", size, FunctionRef.column("size", size)}}));
        assert requests.get(0).func().get(0).kind() == FunctionRef.Kind.NAMED;
        assert requests.get(0).func().get(1).kind() == FunctionRef.Kind.COLUMN;
        assert requests.get(0).func().get(1).label().equals(FunctionRef.LAMBDA);
        assert requests.get(0).func().get(2).label().equals("size");
    }

    @Test
    public void scalarNames() {
        List<AggregationRequest> requests = normalizer.normalize(Arrays.asList(
                new Object[]{"run", "mean", 2024},
                new Object[]{"jump", "mean", null}));
        assert requests.get(0).name().equals("2024");
        assert !requests.get(1).hasName();
    }

    @Test
    public void emptyBatch() {
        assert failure(Collections.emptyList()).equals("at least one aggregation request is required");
        assert failure(null).equals("at least one aggregation request is required");
    }

    @Test
    public void arityNamesPosition() {
        String tooShort = failure(Arrays.asList(new Object[]{"run", "mean"}, new Object[]{"jump"}));
        assert tooShort.contains("position 1");
        assert tooShort.contains("at least a column and a function");

        String tooLong = failure(Collections.singletonList(new Object[]{"run", "mean", "a", "b"}));
        assert tooLong.contains("position 0");
        assert tooLong.contains("maximum three elements");
    }

    @Test
    public void badFunctions() {
        assert failure(Collections.singletonList(new Object[]{"run", 42})).contains("position 0");
        assert failure(Collections.singletonList(new Object[]{"run", Collections.emptyList()})).contains("empty list");
        String element = failure(Arrays.asList(new Object[]{"run", "mean"}, new Object[]{"run", Arrays.asList("mean", 1.5)}));
        assert element.contains("position 1");
        assert element.contains("element 1");
    }

    @Test
    public void badColumnAndName() {
        assert failure(Collections.singletonList(new Object[]{3, "mean"})).contains("position 0");
        assert failure(Collections.singletonList(new Object[]{"run", "mean", Arrays.asList("a")})).contains("scalar label");
        assert failure(Collections.singletonList("run")).contains("must be a tuple");
    }
}
