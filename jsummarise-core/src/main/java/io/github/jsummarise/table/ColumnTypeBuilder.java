package io.github.jsummarise.table;

import java.util.LinkedHashMap;
import java.util.Map;

public class ColumnTypeBuilder {
    private final LinkedHashMap<String, Type> columnTypeMap = new LinkedHashMap<>();

    public ColumnTypeBuilder column(String name, Type type) {
        columnTypeMap.put(name, type);
        return this;
    }

    public Map<String, Type> build() {
        return columnTypeMap;
    }
}
