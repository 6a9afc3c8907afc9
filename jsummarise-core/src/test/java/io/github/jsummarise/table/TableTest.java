package io.github.jsummarise.table;

import io.github.jsummarise.exception.ColumnNotFoundException;
import io.github.jsummarise.exception.IllegalSizeException;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class TableTest {
    private static Table table() {
        return new TableBuilder(new ColumnTypeBuilder()
                .column("id", Type.BIGINT)
                .column("category", Type.STRING)
                .column("run", Type.INT)
                .build())
                .appendRow(100200L, "heats", 3)
                .appendRow(101200L, "finals", 1)
                .appendRow(102201L, "heats", null)
                .build();
    }

    @Test
    public void build() {
        Table table = table();
        assert table.size() == 3;
        assert table.columnCount() == 3;
        assert table.getColumnNames().equals(Arrays.asList("id", "category", "run"));
        assert table.getRowIndex().equals(Index.range(3));
        assert table.getHeader().depth() == 1;
        assert table.getIndex("run") == 2;
        assert table.getIndex("swim") == null;
    }

    @Test
    public void selectKeepsRequestedOrder() {
        Table selected = table().select(Arrays.asList("run", "id"));
        assert selected.getColumnNames().equals(Arrays.asList("run", "id"));
        assert selected.getColumn("run").get(1).equals(1);
        assert selected.size() == 3;
    }

    @Test(expected = ColumnNotFoundException.class)
    public void selectMissingColumn() {
        table().select(Collections.singletonList("swim"));
    }

    @Test
    public void take() {
        Table taken = table().take(Arrays.asList(2, 0));
        assert taken.size() == 2;
        assert taken.getColumn("id").get(0).equals(102201L);
        assert taken.getRowIndex().key(0).equals(Collections.singletonList(2));
    }

    @Test
    public void rows() {
        Row row = table().getRow(1);
        assert row.getLong("id") == 101200L;
        assert row.getString("category").equals("finals");
        assert row.getComparable(2).equals(1);
        assert row.getColumnNames().contains("run");
        assert row.getAll().length == 3;
        assert table().getRow(2).getInteger("run") == null;
    }

    @Test(expected = ColumnNotFoundException.class)
    public void rowMissingColumn() {
        table().getRow(0).getComparable("swim");
    }

    @Test(expected = IllegalSizeException.class)
    public void headerWidthMustMatch() {
        Table table = table();
        table.withHeader(Header.of(Collections.singletonList("only")));
    }

    @Test(expected = IllegalSizeException.class)
    public void rowWidthMustMatch() {
        new TableBuilder("a", "b").appendRow(1);
    }

    @Test
    public void duplicateNamesResolveToFirst() {
        Table table = new TableBuilder("a", "a").appendRow(1, 2).build();
        assert table.getColumn("a").get(0).equals(1);
        assert table.select(Arrays.asList("a", "a")).columnCount() == 2;
    }
}
