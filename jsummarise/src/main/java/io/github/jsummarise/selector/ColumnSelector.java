package io.github.jsummarise.selector;

import io.github.jsummarise.exception.InvalidArgumentException;
import io.github.jsummarise.table.Type;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Denotes one or more columns: a literal name, a list of selectors, a glob, a regular expression or the
 * set of columns of given types.
 */
public final class ColumnSelector {
    public enum Kind {
        NAME,
        LIST,
        GLOB,
        REGEX,
        TYPE
    }

    private final Kind kind;
    private final String name;
    private final List<ColumnSelector> items;
    private final Pattern pattern;
    private final Set<Type> types;

    private ColumnSelector(Kind kind, String name, List<ColumnSelector> items, Pattern pattern, Set<Type> types) {
        this.kind = kind;
        this.name = name;
        this.items = items;
        this.pattern = pattern;
        this.types = types;
    }

    public static ColumnSelector name(String name) {
        return new ColumnSelector(Kind.NAME, requireNonNull(name), null, null, null);
    }

    public static ColumnSelector list(List<ColumnSelector> items) {
        return new ColumnSelector(Kind.LIST, null, Collections.unmodifiableList(new ArrayList<>(items)), null, null);
    }

    public static ColumnSelector list(String... names) {
        List<ColumnSelector> items = new ArrayList<>(names.length);
        for (String name : names) {
            items.add(name(name));
        }
        return list(items);
    }

    public static ColumnSelector glob(String glob) {
        return new ColumnSelector(Kind.GLOB, glob, null, Globs.toPattern(glob), null);
    }

    public static ColumnSelector regex(String regex) {
        return regex(Pattern.compile(regex));
    }

    public static ColumnSelector regex(Pattern pattern) {
        return new ColumnSelector(Kind.REGEX, pattern.pattern(), null, pattern, null);
    }

    public static ColumnSelector type(Type first, Type... rest) {
        return new ColumnSelector(Kind.TYPE, null, null, null, Collections.unmodifiableSet(EnumSet.of(first, rest)));
    }

    /**
     * selector from a loosely typed value: a String, a Pattern, a Type, a ColumnSelector,
     * or a collection or array of those
     */
    public static ColumnSelector of(Object raw) {
        if (raw instanceof ColumnSelector) {
            return (ColumnSelector) raw;
        }
        if (raw instanceof String) {
            return name((String) raw);
        }
        if (raw instanceof Pattern) {
            return regex((Pattern) raw);
        }
        if (raw instanceof Type) {
            return type((Type) raw);
        }
        if (raw instanceof Object[]) {
            return of(Arrays.asList((Object[]) raw));
        }
        if (raw instanceof Collection) {
            List<ColumnSelector> items = new ArrayList<>();
            for (Object item : (Collection<?>) raw) {
                items.add(of(item));
            }
            return list(items);
        }
        throw new InvalidArgumentException(format("cannot select columns with %s",
                null == raw ? "null" : raw.getClass().getName()));
    }

    /**
     * whether a literal name contains glob wildcards
     */
    public static boolean isGlob(String name) {
        return Globs.isGlob(name);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * literal name for NAME, the source text for GLOB and REGEX
     */
    public String name() {
        return name;
    }

    public List<ColumnSelector> items() {
        return items;
    }

    public Pattern pattern() {
        return pattern;
    }

    public Set<Type> types() {
        return types;
    }

    @Override
    public String toString() {
        switch (kind) {
            case NAME:
                return "'" + name + "'";
            case LIST:
                return items.toString();
            case GLOB:
                return "glob(" + name + ")";
            case REGEX:
                return "regex(" + name + ")";
            case TYPE:
                return "type" + types;
            default:
                throw new IllegalStateException(kind.name());
        }
    }
}
