package io.github.jsummarise.summarise;

import io.github.jsummarise.exception.InvalidArgumentException;
import io.github.jsummarise.selector.ColumnSelector;
import io.github.jsummarise.selector.SelectorResolver;
import io.github.jsummarise.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Turns a selector into concrete column names. A literal name stands for itself unless it is a glob matching
 * some column; lists are flattened in order; patterns go to the {@link SelectorResolver} and keep its order.
 * Literal names are not checked here, a missing one fails when its column is read.
 */
public class ColumnResolver {
    private static final Logger logger = LoggerFactory.getLogger(ColumnResolver.class);

    private final SelectorResolver selectorResolver;

    public ColumnResolver(SelectorResolver selectorResolver) {
        this.selectorResolver = requireNonNull(selectorResolver);
    }

    public List<String> resolve(ColumnSelector selector, Table schema) {
        List<String> resolved = new ArrayList<>();
        resolve(selector, schema, resolved);
        return resolved;
    }

    private void resolve(ColumnSelector selector, Table schema, List<String> resolved) {
        switch (selector.kind()) {
            case NAME:
                if (!schema.hasColumn(selector.name()) && ColumnSelector.isGlob(selector.name())) {
                    List<String> matched = globMatches(selector.name(), schema);
                    if (!matched.isEmpty()) {
                        resolved.addAll(matched);
                        return;
                    }
                }
                resolved.add(selector.name());
                return;
            case LIST:
                for (ColumnSelector item : selector.items()) {
                    resolve(item, schema, resolved);
                }
                return;
            case GLOB:
            case REGEX:
            case TYPE:
                resolved.addAll(selectorResolver.resolve(selector, schema));
                return;
            default:
                throw new IllegalStateException(selector.kind().name());
        }
    }

    /**
     * @return empty when the name is no valid glob, so that it stays a literal
     */
    private static List<String> globMatches(String glob, Table schema) {
        List<String> matched = new ArrayList<>();
        ColumnSelector pattern;
        try {
            pattern = ColumnSelector.glob(glob);
        } catch (InvalidArgumentException e) {
            logger.debug("'{}' taken literally: {}", glob, e.getMessage());
            return matched;
        }
        for (String name : schema.getColumnNames()) {
            if (pattern.pattern().matcher(name).matches()) {
                matched.add(name);
            }
        }
        return matched;
    }
}
