package io.github.jsummarise.summarise;

import io.github.jsummarise.table.Column;
import io.github.jsummarise.table.Header;
import io.github.jsummarise.table.Index;
import io.github.jsummarise.table.Table;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ResultAssemblerTest {
    private final ResultAssembler assembler = new ResultAssembler();

    private static List<List<Comparable>> keys(Comparable... keys) {
        List<List<Comparable>> ret = new ArrayList<>(keys.length);
        for (Comparable key : keys) {
            ret.add(Collections.singletonList(key));
        }
        return ret;
    }

    private static Table grouped(Header header, List<List<Comparable>> keys, List<Comparable> values) {
        return new Table(header, Index.of(Collections.singletonList("category"), keys),
                Collections.<Column>singletonList(Column.of(header.level(0).get(0), values)));
    }

    @Test
    public void singlePartialUntouched() {
        Table only = grouped(Header.of(Collections.singletonList("run")), keys("finals"), Arrays.<Comparable>asList(1.0));
        assert assembler.assemble(Collections.singletonList(only), true) == only;
    }

    @Test
    public void padsShallowHeaders() {
        Table deep = grouped(Header.ofTuples(Collections.singletonList(Arrays.asList("run", "mean")), 2),
                keys("finals", "heats"), Arrays.<Comparable>asList(2.0, 3.0));
        Table flat = grouped(Header.of(Collections.singletonList("jump_avg")),
                keys("finals", "heats"), Arrays.<Comparable>asList(2.5, 3.5));

        List<Table> aligned = ResultAssembler.alignDepths(Arrays.asList(deep, flat));
        assert aligned.get(0) == deep;
        assert aligned.get(1).getHeader().depth() == 2;
        assert aligned.get(1).getHeader().label(0).equals(Arrays.asList("jump_avg", Header.EMPTY_LABEL));

        Table merged = assembler.assemble(Arrays.asList(flat, deep), true);
        assert merged.getHeader().depth() == 2;
        assert merged.getHeader().level(0).equals(Arrays.asList("jump_avg", "run"));
        assert merged.getHeader().level(1).equals(Arrays.asList(Header.EMPTY_LABEL, "mean"));
    }

    @Test
    public void groupedSideBySide() {
        Table run = grouped(Header.of(Collections.singletonList("run")),
                keys("finals", "heats"), Arrays.<Comparable>asList(2.0, 3.0));
        Table jump = grouped(Header.of(Collections.singletonList("jump")),
                keys("heats", "relay"), Arrays.<Comparable>asList(3.5, 1.0));

        Table merged = assembler.assemble(Arrays.asList(run, jump), true);
        assert merged.columnCount() == 2;
        assert merged.getRowIndex().keys().equals(keys("finals", "heats", "relay"));
        assert merged.getRowIndex().names().equals(Collections.singletonList("category"));
        assert merged.getColumn("run").values().equals(Arrays.asList(2.0, 3.0, null));
        assert merged.getColumn("jump").values().equals(Arrays.asList(null, 3.5, 1.0));
    }

    @Test
    public void ungroupedStacked() {
        Table means = new Table(Header.of(Arrays.asList("run", "jump")), Index.labels(Collections.singletonList("mean")),
                Arrays.<Column>asList(Column.of("run", Arrays.asList(2.5)), Column.of("jump", Arrays.asList(2.8))));
        Table max = new Table(Header.of(Collections.singletonList("run")), Index.labels(Collections.singletonList("max")),
                Collections.<Column>singletonList(Column.of("run", Arrays.asList(4))));

        Table merged = assembler.assemble(Arrays.asList(means, max), false);
        assert merged.size() == 2;
        assert merged.getRowIndex().keys().equals(keys("mean", "max"));
        assert merged.getColumnNames().equals(Arrays.asList("run", "jump"));
        assert merged.getColumn("run").values().equals(Arrays.<Comparable>asList(2.5, 4.0));
        assert merged.getColumn("jump").values().equals(Arrays.asList(2.8, null));
    }
}
