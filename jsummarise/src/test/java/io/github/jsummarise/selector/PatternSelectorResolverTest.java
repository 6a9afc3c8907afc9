package io.github.jsummarise.selector;

import io.github.jsummarise.Fixtures;
import io.github.jsummarise.exception.ColumnNotFoundException;
import io.github.jsummarise.exception.InvalidArgumentException;
import io.github.jsummarise.table.Table;
import io.github.jsummarise.table.TableBuilder;
import io.github.jsummarise.table.Type;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.regex.Pattern;

public class PatternSelectorResolverTest {
    private final SelectorResolver resolver = new PatternSelectorResolver();
    private final Table athletes = Fixtures.athletes();

    @Test
    public void globKeepsSchemaOrder() {
        assert resolver.resolve(ColumnSelector.glob("*u*"), athletes).equals(Arrays.asList("jump", "run"));
        assert resolver.resolve(ColumnSelector.glob("?ump"), athletes).equals(Collections.singletonList("jump"));
        assert resolver.resolve(ColumnSelector.glob("[rs]*"), athletes).equals(Arrays.asList("run", "swim"));
        assert resolver.resolve(ColumnSelector.glob("[!rs]*"), athletes).equals(Arrays.asList("id", "category", "jump"));
    }

    @Test
    public void regexFindsAnywhere() {
        assert resolver.resolve(ColumnSelector.regex("^(run|swim)$"), athletes).equals(Arrays.asList("run", "swim"));
        assert resolver.resolve(ColumnSelector.of(Pattern.compile("at")), athletes).equals(Collections.singletonList("category"));
    }

    @Test
    public void byType() {
        assert resolver.resolve(ColumnSelector.type(Type.INT), athletes).equals(Arrays.asList("jump", "run", "swim"));
        assert resolver.resolve(ColumnSelector.type(Type.STRING, Type.BIGINT), athletes).equals(Arrays.asList("id", "category"));
    }

    @Test
    public void sameSelectorSameColumns() {
        ColumnSelector selector = ColumnSelector.glob("*");
        assert resolver.resolve(selector, athletes).equals(resolver.resolve(selector, athletes));
    }

    @Test(expected = ColumnNotFoundException.class)
    public void noMatch() {
        resolver.resolve(ColumnSelector.glob("avg_*"), athletes);
    }

    @Test(expected = IllegalArgumentException.class)
    public void literalIsNoPattern() {
        resolver.resolve(ColumnSelector.name("run"), athletes);
    }

    @Test
    public void ofRawValues() {
        ColumnSelector selector = ColumnSelector.of(Arrays.asList("run", new String[]{"jump", "swim"}));
        assert selector.kind() == ColumnSelector.Kind.LIST;
        assert selector.items().size() == 2;
        assert selector.items().get(1).kind() == ColumnSelector.Kind.LIST;
        assert ColumnSelector.of(Type.INT).kind() == ColumnSelector.Kind.TYPE;
        assert ColumnSelector.isGlob("avg_*");
        assert !ColumnSelector.isGlob("avg_run");
    }

    @Test(expected = InvalidArgumentException.class)
    public void ofUnsupportedValue() {
        ColumnSelector.of(42);
    }

    @Test
    public void classBodiesAreLiteral() {
        Table table = new TableBuilder("^a", "ba", "[x", "a&b").appendRow(1, 2, 3, 4).build();
        assert resolver.resolve(ColumnSelector.glob("[^]*"), table).equals(Collections.singletonList("^a"));
        assert resolver.resolve(ColumnSelector.glob("[!^]a"), table).equals(Collections.singletonList("ba"));
        assert resolver.resolve(ColumnSelector.glob("[[]x"), table).equals(Collections.singletonList("[x"));
        assert resolver.resolve(ColumnSelector.glob("a[&]b"), table).equals(Collections.singletonList("a&b"));
        assert resolver.resolve(ColumnSelector.glob("[a-b]a"), table).equals(Collections.singletonList("ba"));
    }

    @Test(expected = InvalidArgumentException.class)
    public void reversedRange() {
        ColumnSelector.glob("[z-a]*");
    }
}
