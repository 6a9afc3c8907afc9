package io.github.jsummarise.selector;

import io.github.jsummarise.exception.ColumnNotFoundException;
import io.github.jsummarise.table.Column;
import io.github.jsummarise.table.Table;
import io.github.jsummarise.table.Type;

import java.util.ArrayList;
import java.util.List;

import static java.lang.String.format;

/**
 * Matches patterns against the schema's column names, in schema order.
 */
public class PatternSelectorResolver implements SelectorResolver {
    @Override
    public List<String> resolve(ColumnSelector selector, Table schema) {
        List<String> names = schema.getColumnNames();
        List<String> matched = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            if (matches(selector, names.get(i), schema.getColumn(i))) {
                matched.add(names.get(i));
            }
        }
        if (matched.isEmpty()) {
            throw new ColumnNotFoundException(format("selector %s matched no column of %s", selector, names));
        }
        return matched;
    }

    private static boolean matches(ColumnSelector selector, String name, Column column) {
        switch (selector.kind()) {
            case GLOB:
                return selector.pattern().matcher(name).matches();
            case REGEX:
                return selector.pattern().matcher(name).find();
            case TYPE:
                Type type = column.getType();
                return null != type && selector.types().contains(type);
            default:
                throw new IllegalArgumentException(format("%s is not a pattern selector", selector));
        }
    }
}
