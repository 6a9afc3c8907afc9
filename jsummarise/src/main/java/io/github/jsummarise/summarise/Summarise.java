package io.github.jsummarise.summarise;

import io.github.jsummarise.table.Table;

import java.util.List;

/**
 * Static entry points over a {@link Summariser} configured from the environment.
 */
public final class Summarise {
    private static Summariser summariser = null;

    private Summarise() {
    }

    private static synchronized Summariser summariser() {
        if (null == summariser) {
            summariser = new Summariser(SummariseConfig.fromEnv());
        }
        return summariser;
    }

    public static Table summarise(Table dataset, List<?> requests) {
        return summariser().summarise(dataset, requests, null);
    }

    public static Table summarise(Table dataset, List<?> requests, Object by) {
        return summariser().summarise(dataset, requests, by);
    }

    public static AggregationTuple col(Object selector) {
        return new AggregationTuple(selector);
    }

    public static Object[] tuple(Object... elements) {
        return elements;
    }
}
