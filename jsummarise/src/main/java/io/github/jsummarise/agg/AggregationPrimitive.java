package io.github.jsummarise.agg;

import java.util.List;
import java.util.Map;

/**
 * Applies single aggregation functions to the values of one column, and computes descriptive statistics.
 */
public interface AggregationPrimitive {
    /**
     * capability query: whether reduce can apply the function to a column's values
     */
    boolean supports(FunctionRef function);

    default boolean supports(FunctionSpec spec) {
        for (FunctionRef function : spec) {
            if (!supports(function)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws io.github.jsummarise.exception.UnsupportedFunctionException if the function is not supported
     */
    Comparable reduce(FunctionRef function, List<Comparable> values);

    /**
     * @param numeric   numeric statistics, or the count/unique/top/freq set for other columns
     * @return          statistic names in output order
     */
    List<String> describeStatistics(boolean numeric);

    /**
     * @return statistic name to value, in the order of describeStatistics
     */
    Map<String, Comparable> describe(List<Comparable> values, boolean numeric);
}
