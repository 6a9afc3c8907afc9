package io.github.jsummarise;

import io.github.jsummarise.json.JsonTables;
import io.github.jsummarise.table.ColumnTypeBuilder;
import io.github.jsummarise.table.Table;
import io.github.jsummarise.table.Type;

import java.io.InputStream;

public class Fixtures {
    public static final double DELTA = 1e-9;

    private Fixtures() {
    }

    /**
     * six athletes: id, category, jump, run, swim
     */
    public static Table athletes() {
        InputStream inputStream = Fixtures.class.getClassLoader().getResourceAsStream("athletes.json");
        return JsonTables.read(inputStream, new ColumnTypeBuilder()
                .column("id", Type.BIGINT)
                .column("category", Type.STRING)
                .column("jump", Type.INT)
                .column("run", Type.INT)
                .column("swim", Type.INT)
                .build());
    }

    public static boolean close(Object actual, double expected) {
        return actual instanceof Number && Math.abs(((Number) actual).doubleValue() - expected) < DELTA;
    }
}
