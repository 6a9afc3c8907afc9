package io.github.jsummarise.group;

import io.github.jsummarise.exception.InvalidArgumentException;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.lang.String.format;

/**
 * Options handed to the grouping runtime as they are. Known options: by, sort, dropna.
 */
public class GroupingConfig {
    public static final String BY = "by";
    public static final String SORT = "sort";
    public static final String DROPNA = "dropna";

    private final LinkedHashMap<String, Object> options = new LinkedHashMap<>();

    public static GroupingConfig by(String... keys) {
        return new GroupingConfig().option(BY, Arrays.asList(keys.clone()));
    }

    /**
     * @throws InvalidArgumentException if an option key is not a String
     */
    public static GroupingConfig of(Map<?, ?> options) {
        GroupingConfig config = new GroupingConfig();
        for (Map.Entry<?, ?> option : options.entrySet()) {
            if (!(option.getKey() instanceof String)) {
                throw new InvalidArgumentException(format("grouping option keys must be strings, got %s in %s",
                        option.getKey(), options));
            }
            config.options.put((String) option.getKey(), option.getValue());
        }
        return config;
    }

    public GroupingConfig sort(boolean sort) {
        return option(SORT, sort);
    }

    public GroupingConfig dropna(boolean dropna) {
        return option(DROPNA, dropna);
    }

    public GroupingConfig option(String key, Object value) {
        options.put(key, value);
        return this;
    }

    public Map<String, Object> options() {
        return Collections.unmodifiableMap(options);
    }

    @Override
    public String toString() {
        return options.toString();
    }
}
