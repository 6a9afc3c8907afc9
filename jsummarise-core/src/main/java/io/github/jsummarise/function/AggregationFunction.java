package io.github.jsummarise.function;

import io.github.jsummarise.table.Row;

import java.util.List;

public interface AggregationFunction {
    /**
     * 每个分组调用一次，不分组时对全部行调用一次且groupByColumns为空
     * 返回的Comparable[]即该分组的一行输出，长度必须与声明的输出列一致
     * @param groupByColumns    key of the group
     * @param rows              rows of the group restricted to the selected columns
     * @return                  one output row
     */
    Comparable[] agg(List<Comparable> groupByColumns, List<Row> rows);
}
