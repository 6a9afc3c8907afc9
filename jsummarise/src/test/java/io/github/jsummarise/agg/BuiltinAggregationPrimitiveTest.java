package io.github.jsummarise.agg;

import io.github.jsummarise.exception.InconsistentColumnTypeException;
import io.github.jsummarise.exception.UnsupportedFunctionException;
import io.github.jsummarise.function.AggregationFunction;
import io.github.jsummarise.function.ColumnFunction;
import io.github.jsummarise.table.Row;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static io.github.jsummarise.Fixtures.close;

public class BuiltinAggregationPrimitiveTest {
    private final AggregationPrimitive primitive = new BuiltinAggregationPrimitive();
    private final List<Comparable> run = Arrays.<Comparable>asList(3, 4, 1, 3, 2, 4, null);

    private Comparable reduce(String name, List<Comparable> values) {
        return primitive.reduce(FunctionRef.named(name), values);
    }

    @Test
    public void builtins() {
        assert reduce("sum", run).equals(17L);
        assert close(reduce("mean", run), 17.0 / 6);
        assert close(reduce("median", run), 3.0);
        assert reduce("min", run).equals(1);
        assert reduce("max", run).equals(4);
        assert reduce("count", run).equals(6L);
        assert reduce("size", run).equals(7L);
        assert reduce("nunique", run).equals(4L);
        assert reduce("first", run).equals(3);
        assert reduce("last", run).equals(4);
        assert reduce("prod", run).equals(288L);
        assert close(reduce("var", run), 1.3666666666666667);
        assert close(reduce("std", run), Math.sqrt(1.3666666666666667));
    }

    @Test
    public void doublesAndStrings() {
        assert close(reduce("sum", Arrays.<Comparable>asList(1, 2.5)), 3.5);
        assert reduce("max", Arrays.<Comparable>asList("finals", "heats")).equals("heats");
        assert reduce("count", Arrays.<Comparable>asList("finals", null)).equals(1L);
    }

    @Test
    public void emptyValues() {
        List<Comparable> none = Collections.<Comparable>singletonList(null);
        assert reduce("sum", none).equals(0L);
        assert reduce("mean", none) == null;
        assert reduce("median", none) == null;
        assert reduce("min", none) == null;
        assert reduce("std", Collections.<Comparable>singletonList(1)) == null;
    }

    @Test(expected = InconsistentColumnTypeException.class)
    public void meanOfStrings() {
        reduce("mean", Arrays.<Comparable>asList("heats", "finals"));
    }

    @Test
    public void capability() {
        assert primitive.supports(FunctionRef.named("mean"));
        assert primitive.supports(FunctionRef.describe());
        assert !primitive.supports(FunctionRef.named("mode"));
        ColumnFunction range = new ColumnFunction() {
            @Override
            public Comparable apply(List<Comparable> values) {
                return values.size();
            }
        };
        assert primitive.supports(FunctionRef.column("range", range));
        AggregationFunction rows = new AggregationFunction() {
            @Override
            public Comparable[] agg(List<Comparable> groupByColumns, List<Row> rows) {
                return new Comparable[]{rows.size()};
            }
        };
        assert !primitive.supports(FunctionRef.rows("rows", rows));
        assert !primitive.supports(FunctionSpec.of(FunctionRef.named("mean"), FunctionRef.rows("rows", rows)));
        assert primitive.supports(FunctionSpec.of(FunctionRef.named("mean"), FunctionRef.column("range", range)));
    }

    @Test(expected = UnsupportedFunctionException.class)
    public void unknownName() {
        reduce("mode", run);
    }

    @Test
    public void describeNumeric() {
        Map<String, Comparable> stats = primitive.describe(run, true);
        assert stats.keySet().equals(new LinkedHashSet<>(primitive.describeStatistics(true)));
        assert stats.get("count").equals(6L);
        assert close(stats.get("mean"), 17.0 / 6);
        assert close(stats.get("min"), 1.0);
        assert close(stats.get("25%"), 2.25);
        assert close(stats.get("50%"), 3.0);
        assert close(stats.get("75%"), 3.75);
        assert close(stats.get("max"), 4.0);
    }

    @Test
    public void describeObject() {
        Map<String, Comparable> stats = primitive.describe(
                Arrays.<Comparable>asList("heats", "heats", "finals", "finals", "heats", null), false);
        assert stats.get("count").equals(5L);
        assert stats.get("unique").equals(2L);
        assert stats.get("top").equals("heats");
        assert stats.get("freq").equals(3L);
    }
}
