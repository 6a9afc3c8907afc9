package io.github.jsummarise.selector;

import io.github.jsummarise.table.Table;

import java.util.List;

/**
 * Resolves pattern selectors (GLOB, REGEX, TYPE) against the columns of a table.
 * Implementations must keep the order they resolve to stable for an unchanged schema.
 */
public interface SelectorResolver {
    List<String> resolve(ColumnSelector selector, Table schema);
}
