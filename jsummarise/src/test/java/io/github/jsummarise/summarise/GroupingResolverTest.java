package io.github.jsummarise.summarise;

import io.github.jsummarise.Fixtures;
import io.github.jsummarise.agg.BuiltinAggregationPrimitive;
import io.github.jsummarise.exception.InvalidArgumentException;
import io.github.jsummarise.group.GroupedTable;
import io.github.jsummarise.group.GroupingConfig;
import io.github.jsummarise.group.HashGrouping;
import io.github.jsummarise.selector.ColumnSelector;
import io.github.jsummarise.selector.PatternSelectorResolver;
import io.github.jsummarise.table.Table;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public class GroupingResolverTest {
    private final GroupingResolver resolver = new GroupingResolver(
            new ColumnResolver(new PatternSelectorResolver()),
            new HashGrouping(new BuiltinAggregationPrimitive(), true, true));
    private final Table athletes = Fixtures.athletes();

    @Test
    public void absent() {
        assert null == resolver.resolve(athletes, null);
        assert null == resolver.resolve(athletes, "");
        assert null == resolver.resolve(athletes, Collections.emptyList());
        assert null == resolver.resolve(athletes, new String[0]);
    }

    @Test
    public void scalarSelector() {
        GroupedTable grouped = resolver.resolve(athletes, "category");
        assert grouped.getKeyNames().equals(Collections.singletonList("category"));
        assert grouped.groupCount() == 2;
    }

    @Test
    public void globSelector() {
        GroupedTable grouped = resolver.resolve(athletes, "[ic]*");
        assert grouped.getKeyNames().equals(Arrays.asList("id", "category"));
        assert grouped.groupCount() == 4;
    }

    @Test
    public void options() {
        GroupedTable grouped = resolver.resolve(athletes, GroupingConfig.by("category").sort(false));
        assert grouped.getKey(0).equals(Collections.<Comparable>singletonList("heats"));

        Map<String, Object> options = new HashMap<>();
        options.put(GroupingConfig.BY, "id");
        assert resolver.resolve(athletes, options).groupCount() == 4;
    }

    @Test(expected = InvalidArgumentException.class)
    public void optionKeysMustBeStrings() {
        Map<Object, Object> options = new HashMap<>();
        options.put(1, "category");
        resolver.resolve(athletes, options);
    }

    @Test
    public void emptyKeySelectorIsAbsent() {
        assert null == resolver.resolve(athletes, ColumnSelector.list(Collections.<ColumnSelector>emptyList()));
        assert null == resolver.resolve(athletes, Arrays.asList(Collections.emptyList(), new String[0]));
    }

    @Test
    public void emptyKeySelectorRunsUngrouped() {
        Table out = new Summariser(SummariseConfig.defaults()).summarise(athletes,
                Collections.singletonList(Summarise.tuple("run", "mean")), ColumnSelector.list(new String[0]));
        assert out.size() == 1;
        assert out.getRowIndex().key(0).equals(Collections.<Comparable>singletonList("mean"));
    }
}
